package com.jsdesugar.ast;

public record ReturnStatement(
    SourceLocation loc,
    Expression argument  // null for a bare return
) implements Statement {
    @Override
    public String type() {
        return "ReturnStatement";
    }
}
