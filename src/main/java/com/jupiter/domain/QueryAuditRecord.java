package com.jupiter.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Audit entry emitted once per query execution.
 */
public class QueryAuditRecord {

    @JsonProperty("query_id")
    private final String queryId;

    @JsonProperty("user_id")
    private final String userId;

    @JsonProperty("tenant_id")
    private final String tenantId;

    @JsonProperty("backend")
    private final String backend;

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("execution_time")
    private final double executionTime;

    @JsonProperty("result_count")
    private final int resultCount;

    @JsonProperty("timestamp")
    private final String timestamp;

    public QueryAuditRecord(String queryId, String userId, String tenantId, String backend,
                            boolean success, double executionTime, int resultCount, String timestamp) {
        this.queryId = queryId;
        this.userId = userId;
        this.tenantId = tenantId;
        this.backend = backend;
        this.success = success;
        this.executionTime = executionTime;
        this.resultCount = resultCount;
        this.timestamp = timestamp;
    }

    /**
     * Build the audit entry for a finished execution
     */
    public static QueryAuditRecord of(QueryResult result, String userId, String tenantId) {
        return new QueryAuditRecord(
            result.getQueryId(),
            userId,
            tenantId,
            result.getBackend(),
            result.isSuccess(),
            result.getExecutionTime(),
            result.getData().size(),
            result.getTimestamp());
    }

    public String getQueryId() {
        return queryId;
    }

    public String getUserId() {
        return userId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getBackend() {
        return backend;
    }

    public boolean isSuccess() {
        return success;
    }

    public double getExecutionTime() {
        return executionTime;
    }

    public int getResultCount() {
        return resultCount;
    }

    public String getTimestamp() {
        return timestamp;
    }
}
