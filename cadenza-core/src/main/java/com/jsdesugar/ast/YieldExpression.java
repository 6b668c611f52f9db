package com.jsdesugar.ast;

public record YieldExpression(
    SourceLocation loc,
    boolean delegate,  // true for yield*, false for yield
    Expression argument  // null for standalone yield
) implements Expression {
    @Override
    public String type() {
        return "YieldExpression";
    }
}
