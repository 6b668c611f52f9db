package com.jsdesugar.ast;

public record AwaitExpression(
    SourceLocation loc,
    Expression argument
) implements Expression {
    @Override
    public String type() {
        return "AwaitExpression";
    }
}
