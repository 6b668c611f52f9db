package com.jsdesugar.ast;

public record ContinueStatement(
    SourceLocation loc,
    Identifier label  // Can be null
) implements Statement {
    @Override
    public String type() {
        return "ContinueStatement";
    }
}
