package com.jupiter.query.provider;

import com.jupiter.domain.QueryResult;
import com.jupiter.domain.ValidationResult;
import com.jupiter.query.ast.QueryAst;

/**
 * Executes query ASTs against one storage backend.
 * Implementations must be safe to call from multiple threads and must never
 * throw: failures are reported through the returned envelopes.
 */
public interface QueryProvider {

    /**
     * @return the backend this provider is registered under
     */
    QueryBackend backend();

    /**
     * @return short human-readable description for backend discovery
     */
    String description();

    /**
     * Check whether the AST can be executed by this provider.
     *
     * @param ast the query to check
     * @return errors that prevent execution and warnings about performance
     */
    ValidationResult validateAst(QueryAst ast);

    /**
     * Execute the AST and return rows with the pre-pagination total.
     *
     * @param ast the query to run
     * @return the result envelope, {@code success=false} on any failure
     */
    QueryResult executeAst(QueryAst ast);
}
