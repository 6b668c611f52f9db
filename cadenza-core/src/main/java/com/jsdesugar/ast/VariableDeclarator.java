package com.jsdesugar.ast;

public record VariableDeclarator(
    SourceLocation loc,
    Pattern id,
    Expression init  // Can be null
) implements Node {
    @Override
    public String type() {
        return "VariableDeclarator";
    }
}
