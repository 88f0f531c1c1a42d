package com.jupiter.query;

import com.jupiter.query.provider.QueryBackend;

/**
 * Exception thrown when a backend fails to execute a compiled query
 * Carries the backend and the query text that failed
 */
public class QueryExecutionException extends RuntimeException {

    private final QueryBackend backend;
    private final String query;

    public QueryExecutionException(String message, QueryBackend backend, String query, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.query = query;
    }

    /**
     * Query text that failed, or null when the failure happened outside a
     * specific query
     */
    public String getQuery() {
        return query;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (backend != null) {
            sb.append(" [Backend: ").append(backend).append("]");
        }
        return sb.toString();
    }
}
