package com.github.dominikschlosser.federation.audit;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.keycloak.util.JsonSerialization;

/**
 * Compliance summary over a batch of audit records: how many assertions were issued, how many
 * requests were rejected and why, and which providers received assertions.
 */
public final class AuditSummary {

    private final int total;
    private final int issued;
    private final int rejected;
    private final Map<String, Integer> rejectionsByReason;
    private final Map<String, Integer> issuedByProvider;

    private AuditSummary(
            int total,
            int issued,
            int rejected,
            Map<String, Integer> rejectionsByReason,
            Map<String, Integer> issuedByProvider) {
        this.total = total;
        this.issued = issued;
        this.rejected = rejected;
        this.rejectionsByReason = Collections.unmodifiableMap(rejectionsByReason);
        this.issuedByProvider = Collections.unmodifiableMap(issuedByProvider);
    }

    /** Only {@link AuditEventType#FEDERATION} records are counted; the others describe sub-steps. */
    public static AuditSummary from(List<AuditRecord> records) {
        int total = 0;
        int issued = 0;
        int rejected = 0;
        Map<String, Integer> byReason = new TreeMap<>();
        Map<String, Integer> byProvider = new TreeMap<>();

        for (AuditRecord record : records) {
            if (record.getEventType() != AuditEventType.FEDERATION) {
                continue;
            }
            total++;
            if (record.getOutcome().isRejected()) {
                rejected++;
                byReason.merge(record.getOutcome().getReason().getCode(), 1, Integer::sum);
            } else {
                issued++;
                byProvider.merge(String.valueOf(record.getProviderId()), 1, Integer::sum);
            }
        }
        return new AuditSummary(total, issued, rejected, byReason, byProvider);
    }

    public int getTotal() {
        return total;
    }

    public int getIssued() {
        return issued;
    }

    public int getRejected() {
        return rejected;
    }

    public Map<String, Integer> getRejectionsByReason() {
        return rejectionsByReason;
    }

    public Map<String, Integer> getIssuedByProvider() {
        return issuedByProvider;
    }

    public String toJson() throws IOException {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", total);
        summary.put("issued", issued);
        summary.put("rejected", rejected);
        summary.put("rejections_by_reason", rejectionsByReason);
        summary.put("issued_by_provider", issuedByProvider);
        return JsonSerialization.writeValueAsPrettyString(summary);
    }
}
