package com.jsdesugar.ast;

public record WhileStatement(
    SourceLocation loc,
    Expression test,
    Statement body
) implements Statement {
    @Override
    public String type() {
        return "WhileStatement";
    }
}
