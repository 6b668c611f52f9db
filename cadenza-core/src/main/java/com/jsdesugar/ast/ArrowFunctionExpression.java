package com.jsdesugar.ast;

import java.util.List;

public record ArrowFunctionExpression(
    SourceLocation loc,
    boolean expression,  // true if body is expression, false if block
    boolean async,
    List<Pattern> params,
    Node body            // Can be Expression or BlockStatement
) implements Expression {
    public ArrowFunctionExpression {
        params = List.copyOf(params);
    }

    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }
}
