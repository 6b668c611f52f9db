package com.jsdesugar.ast;

public record DoWhileStatement(
    SourceLocation loc,
    Statement body,
    Expression test
) implements Statement {
    @Override
    public String type() {
        return "DoWhileStatement";
    }
}
