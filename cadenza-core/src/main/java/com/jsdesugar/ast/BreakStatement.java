package com.jsdesugar.ast;

public record BreakStatement(
    SourceLocation loc,
    Identifier label  // Can be null
) implements Statement {
    @Override
    public String type() {
        return "BreakStatement";
    }
}
