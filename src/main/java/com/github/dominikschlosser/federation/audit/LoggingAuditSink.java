package com.github.dominikschlosser.federation.audit;

import java.io.IOException;
import org.jboss.logging.Logger;
import org.keycloak.util.JsonSerialization;

/**
 * Writes each record as one JSON line to the {@code federation.audit} logger, for log shippers that
 * forward audit categories to the compliance store.
 *
 * <pre>{@code
 * {"timestamp":"2026-10-18T09:15:00Z","trace_id":"t-1","event":"federation",
 *  "provider_id":"AWS-Federation","subject":"dr.smith@example.com","outcome":"issued"}
 * }</pre>
 */
public class LoggingAuditSink implements AuditSink {

    public static final String CATEGORY = "federation.audit";

    private final Logger auditLogger;

    public LoggingAuditSink() {
        this(Logger.getLogger(CATEGORY));
    }

    public LoggingAuditSink(Logger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @Override
    public void append(AuditRecord record) throws IOException {
        auditLogger.info(JsonSerialization.writeValueAsString(record.toMap()));
    }
}
