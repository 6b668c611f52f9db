package com.jsdesugar.ast;

public record ThisExpression(
    SourceLocation loc
) implements Expression {
    @Override
    public String type() {
        return "ThisExpression";
    }
}
