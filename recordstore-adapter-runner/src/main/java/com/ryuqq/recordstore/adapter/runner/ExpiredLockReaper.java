package com.ryuqq.recordstore.adapter.runner;

import com.ryuqq.recordstore.core.spi.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 만료 락 Reaper 컴포넌트.
 *
 * <p>보유 시간이 지난 락 엔트리를 주기적으로 제거합니다.</p>
 *
 * <p><strong>정리 시나리오:</strong></p>
 * <pre>
 * 1. holder가 holdTimeout과 함께 락 획득
 * 2. holder 프로세스 내 작업이 중단됨 → release 호출 안 됨
 * 3. 이후 아무도 같은 키를 조회하지 않음 → 지연 만료도 발생하지 않음
 * 4. Reaper가 주기적 스캔 (예: 5분마다)
 * 5. store.reapExpiredLocks(batchSize) → 만료 엔트리 제거, 대기자 깨움
 * </pre>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>만료 락 엔트리 정리 (살아 있는 락은 건드리지 않음)</li>
 *   <li>스캔 실패 시 로깅 후 다음 주기에 재시도</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExpiredLockReaper {

    private static final Logger log = LoggerFactory.getLogger(ExpiredLockReaper.class);
    private final RecordStore store;
    private final ReaperConfig config;
    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ExpiredLockReaper(RecordStore store, ReaperConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
    }

    /**
     * 만료 락 스캔 및 제거.
     *
     * <p>주기적으로 호출되어야 합니다. {@link #start()}가 이를 대신 스케줄링합니다.</p>
     *
     * @return 이번 스캔에서 제거한 엔트리 수 (실패 시 0)
     */
    public int scan() {
        log.info("ExpiredLockReaper scan started");
        try {
            int reaped = store.reapExpiredLocks(config.batchSize());
            log.info("ExpiredLockReaper scan completed: {} expired locks removed (batchSize={})",
                reaped, config.batchSize());
            return reaped;
        } catch (Exception e) {
            log.error("ExpiredLockReaper scan failed", e);
            return 0;
        }
    }

    /**
     * 단일 스레드 스케줄러로 주기적 스캔 시작.
     *
     * @throws IllegalStateException 이미 실행 중인 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("ExpiredLockReaper is already running");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "expired-lock-reaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::scan, config.scanIntervalMs(), config.scanIntervalMs(),
            TimeUnit.MILLISECONDS);
        log.info("ExpiredLockReaper started: scanIntervalMs={}", config.scanIntervalMs());
    }

    /**
     * 스케줄러 종료. 실행 중이 아니면 아무것도 하지 않습니다.
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            scheduler = null;
        }
        log.info("ExpiredLockReaper stopped");
    }

    /**
     * @return 스케줄러가 실행 중이면 true
     */
    public synchronized boolean isRunning() {
        return scheduler != null;
    }
}
