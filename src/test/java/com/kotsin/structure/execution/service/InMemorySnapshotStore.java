package com.kotsin.structure.execution.service;

import com.kotsin.structure.persistence.SnapshotRecord;
import com.kotsin.structure.persistence.SnapshotStore;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

class InMemorySnapshotStore implements SnapshotStore {

    final Map<String, SnapshotRecord> documents = new ConcurrentHashMap<>();
    final AtomicInteger writes = new AtomicInteger();

    @Override
    public void upsert(SnapshotRecord record) {
        writes.incrementAndGet();
        documents.put(record.getSymbol() + "@" + record.getTime(), record);
    }
}
