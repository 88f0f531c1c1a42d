package com.jupiter.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jupiter.domain.QueryAuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each audit record as a single JSON line to the {@code jupiter.audit}
 * logger. Routing and retention of that logger are configured in Logback.
 */
public class LoggingQueryAuditSink implements QueryAuditSink {

    public static final String AUDIT_LOGGER = "jupiter.audit";

    private final Logger auditLog;
    private final ObjectMapper objectMapper;

    public LoggingQueryAuditSink(ObjectMapper objectMapper) {
        this(objectMapper, LoggerFactory.getLogger(AUDIT_LOGGER));
    }

    LoggingQueryAuditSink(ObjectMapper objectMapper, Logger auditLog) {
        this.objectMapper = objectMapper;
        this.auditLog = auditLog;
    }

    @Override
    public void record(QueryAuditRecord record) {
        try {
            auditLog.info(objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit record for query " + record.getQueryId(), e);
        }
    }
}
