package com.ryuqq.recordstore.application.transaction;

import java.time.Duration;

/**
 * TransactionExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>holdTimeout: 실행마다 획득하는 락의 최대 보유 시간 (기본 5분, null이면 만료 없음)</li>
 * </ul>
 *
 * <p>보유 시간은 계산이 비정상적으로 길어져도 다른 호출자가 영원히 막히지 않도록
 * 상한을 둡니다. 만료된 락은 다른 holder가 획득할 수 있으며, 그 이후의 쓰기는
 * {@link com.ryuqq.recordstore.core.exception.HolderConflictException}으로 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param holdTimeout 락 보유 시간 (null 또는 양수)
 */
public record ExecutorConfig(Duration holdTimeout) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: holdTimeout=5분</p>
     */
    public ExecutorConfig() {
        this(Duration.ofMinutes(5));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException holdTimeout이 0 이하인 경우
     */
    public ExecutorConfig {
        if (holdTimeout != null && (holdTimeout.isNegative() || holdTimeout.isZero())) {
            throw new IllegalArgumentException(
                "holdTimeout must be positive (current: " + holdTimeout + ")"
            );
        }
    }

    /**
     * 만료 없는 락을 사용하는 설정.
     *
     * @return holdTimeout=null 설정
     */
    public static ExecutorConfig neverExpire() {
        return new ExecutorConfig(null);
    }

    /**
     * holdTimeout만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withHoldTimeout(Duration holdTimeout) {
        return new ExecutorConfig(holdTimeout);
    }
}
