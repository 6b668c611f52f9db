package com.jsdesugar.ast;

public record ConditionalExpression(
    SourceLocation loc,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {
    @Override
    public String type() {
        return "ConditionalExpression";
    }
}
