package com.ryuqq.recordstore.core.exception;

import com.ryuqq.recordstore.core.model.HolderId;

/**
 * 보유하지 않은 락을 해제하려 한 경우.
 *
 * <p>살아있는 락이 없거나(미획득 또는 만료 후 해제) 다른 holder가 보유 중일 때 발생합니다.
 * 호출자 계약 위반이므로 재시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NotHolderException extends RecordStoreException {

    private final String key;
    private final HolderId holder;

    public NotHolderException(String key, HolderId holder) {
        super("No lock held by " + holder + " for transaction with key " + key);
        this.key = key;
        this.holder = holder;
    }

    public String getKey() {
        return key;
    }

    public HolderId getHolder() {
        return holder;
    }
}
