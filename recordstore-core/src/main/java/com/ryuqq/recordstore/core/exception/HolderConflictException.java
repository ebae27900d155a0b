package com.ryuqq.recordstore.core.exception;

import com.ryuqq.recordstore.core.model.HolderId;

/**
 * 다른 holder가 락을 보유한 키에 write를 시도한 경우.
 *
 * <p>락을 먼저 기다리거나 잃지 않는 한 재시도해도 성공하지 않습니다.
 * 호출자는 "다른 곳에서 보유 중이라 기록 불가"로 노출해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class HolderConflictException extends RecordStoreException {

    private final String key;
    private final HolderId holder;

    public HolderConflictException(String key, HolderId holder) {
        super("Cannot write to transaction with key " + key + " because it is locked by another holder.");
        this.key = key;
        this.holder = holder;
    }

    public String getKey() {
        return key;
    }

    /**
     * 거부된 write를 시도한 holder.
     */
    public HolderId getHolder() {
        return holder;
    }
}
