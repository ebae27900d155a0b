package com.ryuqq.recordstore.core.model;

/**
 * 락 보유자(Holder) 식별자.
 *
 * <p>HolderId는 하나의 논리적 소유자를 다른 소유자와 구분하는 불투명(opaque) 토큰입니다.
 * 저장소는 값을 해석하지 않으며, 정확한 문자열 일치로만 비교합니다.</p>
 *
 * <p><strong>기본 Holder:</strong></p>
 * <ul>
 *   <li>호출자가 holder를 생략(null)하면 저장소는 고정된 {@link #DEFAULT}를 사용합니다</li>
 *   <li>호출마다 새로운 값을 생성하지 않으므로, holder 없이 호출하는 서로 다른 호출 지점은
 *       동일한 소유자의 재진입(re-entrant) 획득과 구분되지 않습니다</li>
 *   <li>따라서 holder 없는 lock/write/release 호출은 멱등하게 조합됩니다</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HolderId {

    /**
     * holder가 생략되었을 때 사용하는 고정 기본 Holder.
     */
    public static final HolderId DEFAULT = new HolderId("default-holder");

    private final String value;

    private HolderId(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("HolderId cannot be null or empty");
        }
        this.value = value;
    }

    /**
     * HolderId 생성.
     *
     * @param value Holder 값
     * @return HolderId 인스턴스
     * @throws IllegalArgumentException 값이 null 또는 빈 문자열인 경우
     */
    public static HolderId of(String value) {
        return new HolderId(value);
    }

    /**
     * null이면 {@link #DEFAULT}로 치환.
     *
     * @param holder 호출자가 전달한 Holder (nullable)
     * @return holder 또는 DEFAULT
     */
    public static HolderId orDefault(HolderId holder) {
        return holder != null ? holder : DEFAULT;
    }

    /**
     * HolderId 값 조회.
     *
     * @return Holder 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HolderId holderId = (HolderId) o;
        return value.equals(holderId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
