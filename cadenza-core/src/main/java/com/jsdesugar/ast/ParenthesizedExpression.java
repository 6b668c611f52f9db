package com.jsdesugar.ast;

public record ParenthesizedExpression(
    SourceLocation loc,
    Expression expression
) implements Expression {
    @Override
    public String type() {
        return "ParenthesizedExpression";
    }
}
