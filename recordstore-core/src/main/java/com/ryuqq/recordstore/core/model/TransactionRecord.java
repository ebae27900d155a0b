package com.ryuqq.recordstore.core.model;

import java.time.Instant;

/**
 * 캐시된 트랜잭션 결과 레코드.
 *
 * <p>TransactionRecord는 트랜잭션 키와 외부에서 계산된 결과(result)의 쌍입니다.
 * 저장소는 result를 해석하거나 변경하지 않으며, 전달받은 참조를 그대로 저장하고 반환합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <ul>
 *   <li>성공한 write로만 생성/덮어쓰기</li>
 *   <li>부분 갱신 없음</li>
 *   <li>동일 키에 대한 다음 write 전까지 읽기 전용</li>
 *   <li>TTL 없음 (덮어쓸 때까지 유지)</li>
 * </ul>
 *
 * @param key 트랜잭션 키
 * @param result 불투명 결과 값
 * @param writtenAt 기록 시각 (진단용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TransactionRecord(
    String key,
    Object result,
    Instant writtenAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key 또는 writtenAt이 null인 경우
     */
    public TransactionRecord {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (writtenAt == null) {
            throw new IllegalArgumentException("writtenAt cannot be null");
        }
    }

    /**
     * 현재 시각으로 레코드 생성.
     *
     * @param key 트랜잭션 키
     * @param result 결과 값
     * @return TransactionRecord
     */
    public static TransactionRecord now(String key, Object result) {
        return new TransactionRecord(key, result, Instant.now());
    }
}
