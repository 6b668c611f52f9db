package com.jsdesugar.ast;

public record IfStatement(
    SourceLocation loc,
    Expression test,
    Statement consequent,
    Statement alternate  // Can be null
) implements Statement {
    @Override
    public String type() {
        return "IfStatement";
    }
}
