package com.github.dominikschlosser.federation.audit;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.dominikschlosser.federation.Fixtures;
import com.github.dominikschlosser.federation.RejectionReason;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuditSummaryTest {

    @Test
    void countsFederationOutcomesByReasonAndProvider() throws IOException {
        List<AuditRecord> records = List.of(
                record("t-1", Fixtures.AWS, AuditEventType.FEDERATION, AuditOutcome.ISSUED),
                record("t-2", Fixtures.OCI, AuditEventType.CORRELATION,
                        AuditOutcome.rejected(RejectionReason.NO_USER_FOUND)),
                record("t-2", Fixtures.OCI, AuditEventType.FEDERATION,
                        AuditOutcome.rejected(RejectionReason.NO_USER_FOUND)),
                record("t-3", Fixtures.AWS, AuditEventType.FEDERATION,
                        AuditOutcome.rejected(RejectionReason.NO_BINDING)),
                record("t-4", Fixtures.AWS, AuditEventType.FEDERATION, AuditOutcome.ISSUED),
                record("t-5", null, AuditEventType.CONFIGURATION_RELOAD, AuditOutcome.RELOADED));

        AuditSummary summary = AuditSummary.from(records);

        assertThat(summary.getTotal()).isEqualTo(4);
        assertThat(summary.getIssued()).isEqualTo(2);
        assertThat(summary.getRejected()).isEqualTo(2);
        assertThat(summary.getRejectionsByReason()).containsExactly(
                Map.entry("NoBinding", 1), Map.entry("NoUserFound", 1));
        assertThat(summary.getIssuedByProvider()).containsExactly(Map.entry(Fixtures.AWS, 2));
        assertThat(summary.toJson()).contains("\"rejections_by_reason\"").contains("\"issued_by_provider\"");
    }

    @Test
    void emptyInputGivesZeroes() {
        AuditSummary summary = AuditSummary.from(List.of());

        assertThat(summary.getTotal()).isZero();
        assertThat(summary.getRejectionsByReason()).isEmpty();
    }

    private static AuditRecord record(
            String traceId, String providerId, AuditEventType type, AuditOutcome outcome) {
        return new AuditRecord(traceId, providerId, type, outcome, "dr.smith@example.com", Fixtures.NOW, Map.of());
    }
}
