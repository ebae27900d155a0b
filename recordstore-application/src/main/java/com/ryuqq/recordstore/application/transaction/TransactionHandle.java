package com.ryuqq.recordstore.application.transaction;

import com.ryuqq.recordstore.core.model.TransactionRecord;

/**
 * 트랜잭션 실행 핸들.
 *
 * <p>{@link TransactionExecutor#execute}의 결과를 표현하며, 결과가 캐시에서 왔는지
 * 이번 호출에서 계산되었는지를 구분합니다.</p>
 *
 * <p><strong>두 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li><strong>캐시 적중 (fromCache = true):</strong> 이전 호출이 기록한 결과를 그대로 반환</li>
 *   <li><strong>신규 계산 (fromCache = false):</strong> 이번 호출이 계산하고 저장한 결과</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransactionHandle handle = executor.execute("txn-123", holder, () -&gt; charge(order));
 * if (handle.isFromCache()) {
 *     // 중복 요청: 이전 결과 재사용
 * }
 * Object result = handle.getResult();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransactionHandle {

    private final String key;
    private final boolean fromCache;
    private final TransactionRecord record;

    /**
     * Private constructor - 정적 팩토리 메서드 사용 권장.
     *
     * @throws IllegalArgumentException key 또는 record가 null인 경우
     */
    private TransactionHandle(String key, boolean fromCache, TransactionRecord record) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        this.key = key;
        this.fromCache = fromCache;
        this.record = record;
    }

    /**
     * 캐시 적중 핸들 생성.
     *
     * @param key 트랜잭션 키
     * @param record 저장되어 있던 레코드
     * @return TransactionHandle (fromCache=true)
     */
    public static TransactionHandle cached(String key, TransactionRecord record) {
        return new TransactionHandle(key, true, record);
    }

    /**
     * 신규 계산 핸들 생성.
     *
     * @param key 트랜잭션 키
     * @param record 이번 호출이 저장한 레코드
     * @return TransactionHandle (fromCache=false)
     */
    public static TransactionHandle computed(String key, TransactionRecord record) {
        return new TransactionHandle(key, false, record);
    }

    /**
     * @return 트랜잭션 키 (non-null)
     */
    public String getKey() {
        return key;
    }

    /**
     * @return 캐시에서 가져온 경우 true, 이번 호출에서 계산한 경우 false
     */
    public boolean isFromCache() {
        return fromCache;
    }

    /**
     * @return 저장된 레코드 (non-null)
     */
    public TransactionRecord getRecord() {
        return record;
    }

    /**
     * 결과 값 조회.
     *
     * <p>계산 결과가 null이었다면 null을 반환합니다.</p>
     *
     * @return 저장된 결과 (nullable)
     */
    public Object getResult() {
        return record.result();
    }

    @Override
    public String toString() {
        return "TransactionHandle{key=" + key + ", fromCache=" + fromCache + ", result=" + record.result() + "}";
    }
}
