package com.jupiter.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Execution result envelope returned by query providers and the query manager.
 *
 * Providers fill in {@code success}, {@code data}, {@code total},
 * {@code execution_time} and, on failure, {@code error}. The query manager
 * then tags the envelope with {@code query_id}, {@code backend} and
 * {@code timestamp}. Failures are always reported through this envelope
 * ({@code success=false}); providers and the manager never throw.
 */
public class QueryResult {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("data")
    private List<Map<String, Object>> data;

    @JsonProperty("total")
    private long total;

    @JsonProperty("execution_time")
    private double executionTime; // seconds

    @JsonProperty("query_id")
    private String queryId;

    @JsonProperty("backend")
    private String backend;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("error")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String error;

    @JsonProperty("sql")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String sql;

    @JsonProperty("has_more")
    private boolean hasMore;

    /**
     * Default constructor
     */
    public QueryResult() {
        this.data = new ArrayList<>();
    }

    /**
     * Successful result with rows and the pre-pagination total
     */
    public static QueryResult success(List<Map<String, Object>> data, long total) {
        QueryResult result = new QueryResult();
        result.setSuccess(true);
        result.setData(data);
        result.setTotal(total);
        return result;
    }

    /**
     * Failed result carrying an error message and no rows
     */
    public static QueryResult failure(String error) {
        QueryResult result = new QueryResult();
        result.setSuccess(false);
        result.setError(error);
        return result;
    }

    // Getters and Setters

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public List<Map<String, Object>> getData() {
        return data;
    }

    public void setData(List<Map<String, Object>> data) {
        this.data = data != null ? data : new ArrayList<>();
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    public double getExecutionTime() {
        return executionTime;
    }

    public void setExecutionTime(double executionTime) {
        this.executionTime = executionTime;
    }

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public boolean isHasMore() {
        return hasMore;
    }

    public void setHasMore(boolean hasMore) {
        this.hasMore = hasMore;
    }

    @Override
    public String toString() {
        return "QueryResult{success=" + success + ", total=" + total + ", rows=" + data.size()
            + ", backend=" + backend + ", queryId=" + queryId
            + (error != null ? ", error=" + error : "") + "}";
    }
}
