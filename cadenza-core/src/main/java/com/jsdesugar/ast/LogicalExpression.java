package com.jsdesugar.ast;

public record LogicalExpression(
    SourceLocation loc,
    String operator,  // "&&" | "||" | "??"
    Expression left,
    Expression right
) implements Expression {
    @Override
    public String type() {
        return "LogicalExpression";
    }
}
