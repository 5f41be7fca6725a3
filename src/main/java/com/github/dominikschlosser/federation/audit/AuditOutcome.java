package com.github.dominikschlosser.federation.audit;

import com.github.dominikschlosser.federation.RejectionReason;
import java.util.Objects;

/**
 * Outcome of an audited event. Rendered as {@code issued}, {@code correlated}, {@code reloaded},
 * {@code evaluated} or {@code rejected:<reason code>}.
 */
public final class AuditOutcome {

    public static final AuditOutcome ISSUED = new AuditOutcome("issued", null);
    public static final AuditOutcome CORRELATED = new AuditOutcome("correlated", null);
    public static final AuditOutcome RELOADED = new AuditOutcome("reloaded", null);
    public static final AuditOutcome EVALUATED = new AuditOutcome("evaluated", null);

    private final String label;
    private final RejectionReason reason;

    private AuditOutcome(String label, RejectionReason reason) {
        this.label = label;
        this.reason = reason;
    }

    public static AuditOutcome rejected(RejectionReason reason) {
        return new AuditOutcome("rejected", Objects.requireNonNull(reason, "reason"));
    }

    public boolean isRejected() {
        return reason != null;
    }

    /** @return the rejection reason, or {@code null} for a successful outcome */
    public RejectionReason getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuditOutcome)) {
            return false;
        }
        AuditOutcome that = (AuditOutcome) o;
        return label.equals(that.label) && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, reason);
    }

    @Override
    public String toString() {
        return reason == null ? label : label + ":" + reason.getCode();
    }
}
