package com.github.dominikschlosser.federation.audit;

import java.io.IOException;

/** External, append-only destination of audit records, consumed for compliance reporting. */
public interface AuditSink {

    void append(AuditRecord record) throws IOException;
}
