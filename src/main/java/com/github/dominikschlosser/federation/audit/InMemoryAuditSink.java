package com.github.dominikschlosser.federation.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/** Keeps every record in memory, in delivery order. */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(AuditRecord record) {
        records.add(record);
    }

    public List<AuditRecord> getRecords() {
        return List.copyOf(records);
    }

    public List<AuditRecord> getRecords(String traceId) {
        return records.stream().filter(r -> r.getTraceId().equals(traceId)).collect(Collectors.toList());
    }
}
