package com.ryuqq.recordstore.adapter.runner;

/**
 * ExpiredLockReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 300000ms = 5분)</li>
 *   <li>batchSize: 한 번의 스캔에서 제거할 최대 만료 락 수 (기본 50)</li>
 * </ul>
 *
 * <p>만료된 락은 조회 시점에 지연 제거되므로 스캔은 아무도 다시 조회하지 않는 키의
 * 락 엔트리를 정리하는 용도입니다. 주기를 짧게 잡을 필요는 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record ReaperConfig(
    long scanIntervalMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=300000ms (5분), batchSize=50</p>
     */
    public ReaperConfig() {
        this(300000, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanIntervalMs, batchSize);
    }
}
