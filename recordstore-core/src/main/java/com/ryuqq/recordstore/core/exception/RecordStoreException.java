package com.ryuqq.recordstore.core.exception;

/**
 * 레코드 저장소 예외의 공통 상위 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
