package com.jupiter.audit;

import com.jupiter.domain.QueryAuditRecord;

/**
 * Destination for query audit records.
 * Implementations may throw; callers treat audit writes as best-effort.
 */
public interface QueryAuditSink {

    /**
     * Persist one audit record
     *
     * @param record the record for a finished query execution
     */
    void record(QueryAuditRecord record);
}
