package com.ryuqq.recordstore.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 키별 락 엔트리.
 *
 * <p>키가 잠겨 있는 동안에만 존재하며, 키당 살아있는(만료되지 않은) 엔트리는 최대 하나입니다.</p>
 *
 * <p><strong>만료 규칙 (Lazy Expiry):</strong></p>
 * <ul>
 *   <li>holdTimeout이 없으면 명시적 release 전까지 만료되지 않음</li>
 *   <li>현재 시각이 hold deadline을 지나면 만료로 간주</li>
 *   <li>만료된 엔트리는 획득 및 holder 검사에서 "락 없음"과 동일하게 취급</li>
 *   <li>백그라운드 스위퍼 없이 상태를 참조하는 시점에 판정</li>
 * </ul>
 *
 * <p>deadline은 {@link System#nanoTime()} 기준의 단조 시각으로 보관되어
 * 벽시계 조정의 영향을 받지 않습니다.</p>
 *
 * @param key 트랜잭션 키
 * @param holder 락 보유자
 * @param acquiredAt 획득 시각
 * @param holdTimeout 최대 보유 시간 (null이면 만료 없음)
 * @param deadlineNanos hold deadline ({@link System#nanoTime()} 기준, 만료 없음이면 {@link #NO_DEADLINE})
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LockEntry(
    String key,
    HolderId holder,
    Instant acquiredAt,
    Duration holdTimeout,
    long deadlineNanos
) {

    /**
     * 만료 없음을 나타내는 deadline 값.
     */
    public static final long NO_DEADLINE = Long.MAX_VALUE;

    /**
     * {@link System#nanoTime()} 차이로 비교할 수 있는 최대 기간 (약 146년).
     *
     * <p>이보다 긴 timeout은 만료 없음(무기한)으로 취급합니다.</p>
     */
    public static final Duration MAX_BOUNDED_DURATION = Duration.ofNanos(Long.MAX_VALUE >> 1);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public LockEntry {
        if (key == null || holder == null || acquiredAt == null) {
            throw new IllegalArgumentException("key, holder and acquiredAt are required for LockEntry");
        }
    }

    /**
     * 새 락 엔트리 생성.
     *
     * @param key 트랜잭션 키
     * @param holder 락 보유자
     * @param holdTimeout 최대 보유 시간 (nullable)
     * @param nowNanos 현재 {@link System#nanoTime()} 값
     * @return LockEntry
     */
    public static LockEntry acquire(String key, HolderId holder, Duration holdTimeout, long nowNanos) {
        long deadline = NO_DEADLINE;
        if (!isUnbounded(holdTimeout)) {
            deadline = nowNanos + holdTimeout.toNanos();
            if (deadline == NO_DEADLINE) {
                deadline--;
            }
        }
        return new LockEntry(key, holder, Instant.now(), holdTimeout, deadline);
    }

    /**
     * 무기한 timeout 여부.
     *
     * @param timeout 확인할 기간 (nullable)
     * @return null이거나 {@link #MAX_BOUNDED_DURATION}보다 긴 경우 true
     */
    public static boolean isUnbounded(Duration timeout) {
        return timeout == null || timeout.compareTo(MAX_BOUNDED_DURATION) > 0;
    }

    /**
     * hold deadline 존재 여부.
     *
     * @return holdTimeout이 지정된 경우 true
     */
    public boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    /**
     * 만료 여부 확인.
     *
     * @param nowNanos 현재 {@link System#nanoTime()} 값
     * @return deadline이 지난 경우 true
     */
    public boolean isExpired(long nowNanos) {
        return hasDeadline() && nowNanos - deadlineNanos >= 0;
    }

    /**
     * deadline까지 남은 시간.
     *
     * @param nowNanos 현재 {@link System#nanoTime()} 값
     * @return 남은 나노초 (만료 없음이면 {@link Long#MAX_VALUE}, 만료되었으면 0 이하)
     */
    public long remainingNanos(long nowNanos) {
        return hasDeadline() ? deadlineNanos - nowNanos : Long.MAX_VALUE;
    }

    /**
     * 지정한 holder가 이 엔트리의 보유자인지 확인.
     *
     * @param candidate 확인할 holder
     * @return 보유자가 같으면 true
     */
    public boolean isHeldBy(HolderId candidate) {
        return holder.equals(candidate);
    }
}
