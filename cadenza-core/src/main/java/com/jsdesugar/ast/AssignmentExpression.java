package com.jsdesugar.ast;

public record AssignmentExpression(
    SourceLocation loc,
    String operator,
    Pattern left,
    Expression right
) implements Expression {
    @Override
    public String type() {
        return "AssignmentExpression";
    }
}
