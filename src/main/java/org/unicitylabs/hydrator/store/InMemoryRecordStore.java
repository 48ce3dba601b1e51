package org.unicitylabs.hydrator.store;

import org.unicitylabs.hydrator.projection.record.DomainRecord;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store for embedding and tests.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, DomainRecord> records = new ConcurrentHashMap<>();
    private final Map<String, DomainRecord> pending = new LinkedHashMap<>();

    @Override
    public DomainRecord findById(String eventId) {
        DomainRecord record = records.get(eventId);
        if (record != null) {
            return record;
        }
        synchronized (pending) {
            return pending.get(eventId);
        }
    }

    @Override
    public boolean save(DomainRecord record) {
        synchronized (pending) {
            return pending.putIfAbsent(record.getEventId(), record) == null;
        }
    }

    @Override
    public int flush() {
        int inserted = 0;
        synchronized (pending) {
            for (DomainRecord record : pending.values()) {
                if (records.putIfAbsent(record.getEventId(), record) == null) {
                    inserted++;
                }
            }
            pending.clear();
        }
        return inserted;
    }

    @Override
    public long failedCount() {
        return 0;
    }

    @Override
    public int pendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }

    @Override
    public long count() {
        return records.size();
    }
}
