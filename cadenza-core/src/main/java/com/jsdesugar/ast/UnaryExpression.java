package com.jsdesugar.ast;

public record UnaryExpression(
    SourceLocation loc,
    String operator,
    boolean prefix,
    Expression argument
) implements Expression {
    @Override
    public String type() {
        return "UnaryExpression";
    }
}
