package com.ryuqq.recordstore.adapter.inmemory.store;

import com.ryuqq.recordstore.core.model.TransactionRecord;

import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory table of cached transaction records.
 *
 * <p>A plain key → {@link TransactionRecord} map with no knowledge of locks. Holder checks
 * are applied by {@link InMemoryRecordStore}, which calls {@link #put(String, Object)} only
 * from inside {@link InMemoryLockManager#guardWrite}.</p>
 *
 * <p><strong>Thread Safety:</strong> backed by {@link ConcurrentHashMap}; reads never block
 * and a put is visible to every read that happens after it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryRecordTable {

    /**
     * Key: transaction key, Value: last record written for it.
     */
    private final ConcurrentHashMap<String, TransactionRecord> records;

    /**
     * Creates an empty table.
     */
    public InMemoryRecordTable() {
        this.records = new ConcurrentHashMap<>();
    }

    /**
     * @param key the transaction key
     * @return the stored record, or null if absent
     */
    public TransactionRecord get(String key) {
        return records.get(key);
    }

    /**
     * Stores or replaces the record for the key.
     *
     * @param key the transaction key
     * @param result the opaque result
     * @return the stored record
     */
    public TransactionRecord put(String key, Object result) {
        TransactionRecord record = TransactionRecord.now(key, result);
        records.put(key, record);
        return record;
    }

    /**
     * @param key the transaction key
     * @return true if a record is stored for the key
     */
    public boolean contains(String key) {
        return records.containsKey(key);
    }

    /**
     * @return the number of stored records
     */
    public int size() {
        return records.size();
    }
}
