package com.hoa.retention.chaos;

import com.hoa.retention.store.PartialBatchFailureException;
import com.hoa.retention.store.RecordFilter;
import com.hoa.retention.store.RecordStore;
import com.hoa.retention.store.StoreUnavailableException;

import java.sql.SQLException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator around a {@link RecordStore} that injects failures for resilience
 * tests: failing specific update calls by sequence number, failing deletes on
 * specific tables, and simulating a disconnected store.
 */
public class ChaosRecordStore implements RecordStore {

    private final RecordStore delegate;
    private final Set<Integer> failingUpdates = ConcurrentHashMap.newKeySet();
    private final Set<String> failingDeleteTables = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean disconnected = new AtomicBoolean(false);
    private final AtomicInteger updateCount = new AtomicInteger(0);

    public ChaosRecordStore(RecordStore delegate) {
        this.delegate = delegate;
    }

    /**
     * Fails the given update calls, numbered from 1 in call order.
     */
    public void failUpdates(Integer... callNumbers) {
        failingUpdates.addAll(Set.of(callNumbers));
    }

    public void failDeletesOn(String table) {
        failingDeleteTables.add(table);
    }

    /**
     * When enabled, isConnected() returns false and every statement throws.
     */
    public void setDisconnected(boolean value) {
        disconnected.set(value);
    }

    public int updateCalls() {
        return updateCount.get();
    }

    public void reset() {
        failingUpdates.clear();
        failingDeleteTables.clear();
        disconnected.set(false);
        updateCount.set(0);
    }

    @Override
    public long update(String table, RecordFilter filter, Map<String, Object> setFields) {
        int call = updateCount.incrementAndGet();
        checkConnected();
        if (failingUpdates.contains(call)) {
            throw new PartialBatchFailureException("ChaosRecordStore: simulated update failure #" + call,
                    new SQLException("simulated", "HY000"));
        }
        return delegate.update(table, filter, setFields);
    }

    @Override
    public long delete(String table, RecordFilter filter) {
        checkConnected();
        if (failingDeleteTables.contains(table)) {
            throw new PartialBatchFailureException("ChaosRecordStore: simulated delete failure on " + table,
                    new SQLException("simulated", "HY000"));
        }
        return delegate.delete(table, filter);
    }

    @Override
    public long count(String table, RecordFilter filter) {
        checkConnected();
        return delegate.count(table, filter);
    }

    @Override
    public boolean isConnected() {
        return !disconnected.get() && delegate.isConnected();
    }

    @Override
    public String getName() {
        return "chaos(" + delegate.getName() + ")";
    }

    private void checkConnected() {
        if (disconnected.get()) {
            throw new StoreUnavailableException("ChaosRecordStore: simulated disconnect");
        }
    }
}
