package com.jsdesugar.ast;

public record ThrowStatement(
    SourceLocation loc,
    Expression argument
) implements Statement {
    @Override
    public String type() {
        return "ThrowStatement";
    }
}
