package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A value-producing node of the query AST: a field reference, a literal,
 * a literal list (right-hand side of IN / NOT_IN) or an aggregate function call.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Field.class, name = "field"),
    @JsonSubTypes.Type(value = Literal.class, name = "literal"),
    @JsonSubTypes.Type(value = LiteralList.class, name = "list"),
    @JsonSubTypes.Type(value = FunctionCall.class, name = "function")
})
public interface Operand {
}
