package com.ryuqq.recordstore.core.exception;

/**
 * 락 대기 중 스레드가 인터럽트된 경우.
 *
 * <p>발생 시점에 스레드의 인터럽트 플래그는 복원되어 있으며, 락 상태는 변경되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LockInterruptedException extends RecordStoreException {

    public LockInterruptedException(String key, InterruptedException cause) {
        super("Interrupted while waiting for lock on transaction with key " + key, cause);
    }
}
