package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Root of the query abstract syntax tree.
 *
 * This is the universal query representation that every query provider
 * validates and executes. A QueryAst is built once per request, either by the
 * {@link com.jupiter.query.parser.TextQueryParser} or directly by a caller
 * (for example from JSON), and is immutable afterwards. The query manager
 * assigns a query id with {@link #withQueryId(String)}, which returns a copy.
 *
 * Invariants:
 * - When {@code tenant_id} is set, every provider AND-s it into its filter
 * - {@code limit} and {@code offset} must not be negative (checked by validation)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class QueryAst {

    private final String queryId;
    private final String tenantId;
    private final List<SelectField> select;
    private final Expression where;
    private final GroupBy groupBy;
    private final List<OrderBy> orderBy;
    private final Integer limit;
    private final Integer offset;
    private final TimeRange timeRange;
    private final String sourceText;

    @JsonCreator
    public QueryAst(@JsonProperty("query_id") String queryId,
                    @JsonProperty("tenant_id") String tenantId,
                    @JsonProperty("select") List<SelectField> select,
                    @JsonProperty("where") Expression where,
                    @JsonProperty("group_by") GroupBy groupBy,
                    @JsonProperty("order_by") List<OrderBy> orderBy,
                    @JsonProperty("limit") Integer limit,
                    @JsonProperty("offset") Integer offset,
                    @JsonProperty("time_range") TimeRange timeRange,
                    @JsonProperty("source_text") String sourceText) {
        this.queryId = queryId;
        this.tenantId = tenantId;
        this.select = select == null ? List.of() : List.copyOf(select);
        this.where = where;
        this.groupBy = groupBy;
        this.orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        this.limit = limit;
        this.offset = offset;
        this.timeRange = timeRange;
        this.sourceText = sourceText;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this AST carrying the given query id.
     */
    public QueryAst withQueryId(String newQueryId) {
        return toBuilder().queryId(newQueryId).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .queryId(queryId)
            .tenantId(tenantId)
            .select(select)
            .where(where)
            .groupBy(groupBy)
            .orderBy(orderBy)
            .limit(limit)
            .offset(offset)
            .timeRange(timeRange)
            .sourceText(sourceText);
    }

    @JsonProperty("query_id")
    public String getQueryId() {
        return queryId;
    }

    @JsonProperty("tenant_id")
    public String getTenantId() {
        return tenantId;
    }

    @JsonProperty("select")
    public List<SelectField> getSelect() {
        return select;
    }

    @JsonProperty("where")
    public Expression getWhere() {
        return where;
    }

    @JsonProperty("group_by")
    public GroupBy getGroupBy() {
        return groupBy;
    }

    @JsonProperty("order_by")
    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    @JsonProperty("limit")
    public Integer getLimit() {
        return limit;
    }

    @JsonProperty("offset")
    public Integer getOffset() {
        return offset;
    }

    @JsonProperty("time_range")
    public TimeRange getTimeRange() {
        return timeRange;
    }

    @JsonProperty("source_text")
    public String getSourceText() {
        return sourceText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryAst)) return false;
        QueryAst other = (QueryAst) o;
        return Objects.equals(queryId, other.queryId)
            && Objects.equals(tenantId, other.tenantId)
            && select.equals(other.select)
            && Objects.equals(where, other.where)
            && Objects.equals(groupBy, other.groupBy)
            && orderBy.equals(other.orderBy)
            && Objects.equals(limit, other.limit)
            && Objects.equals(offset, other.offset)
            && Objects.equals(timeRange, other.timeRange)
            && Objects.equals(sourceText, other.sourceText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queryId, tenantId, select, where, groupBy, orderBy, limit, offset,
            timeRange, sourceText);
    }

    @Override
    public String toString() {
        return "QueryAst{queryId=" + queryId + ", tenantId=" + tenantId + ", select=" + select
            + ", where=" + where + ", groupBy=" + groupBy + ", orderBy=" + orderBy
            + ", limit=" + limit + ", offset=" + offset + ", timeRange=" + timeRange + "}";
    }

    /**
     * Builder pattern for creating QueryAst instances
     */
    public static class Builder {
        private String queryId;
        private String tenantId;
        private final List<SelectField> select = new ArrayList<>();
        private Expression where;
        private GroupBy groupBy;
        private final List<OrderBy> orderBy = new ArrayList<>();
        private Integer limit;
        private Integer offset;
        private TimeRange timeRange;
        private String sourceText;

        public Builder queryId(String queryId) {
            this.queryId = queryId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder select(List<SelectField> fields) {
            this.select.clear();
            if (fields != null) {
                this.select.addAll(fields);
            }
            return this;
        }

        public Builder select(SelectField... fields) {
            return select(Arrays.asList(fields));
        }

        public Builder where(Expression where) {
            this.where = where;
            return this;
        }

        public Builder groupBy(GroupBy groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public Builder orderBy(List<OrderBy> orderBy) {
            this.orderBy.clear();
            if (orderBy != null) {
                this.orderBy.addAll(orderBy);
            }
            return this;
        }

        public Builder orderBy(OrderBy... orderBy) {
            return orderBy(Arrays.asList(orderBy));
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Builder timeRange(TimeRange timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        public Builder sourceText(String sourceText) {
            this.sourceText = sourceText;
            return this;
        }

        public QueryAst build() {
            return new QueryAst(queryId, tenantId, select, where, groupBy, orderBy, limit, offset,
                timeRange, sourceText);
        }
    }
}
