package com.jsdesugar.ast;

public record BinaryExpression(
    SourceLocation loc,
    String operator,
    Expression left,
    Expression right
) implements Expression {
    @Override
    public String type() {
        return "BinaryExpression";
    }
}
