package com.jsdesugar.ast;

public record LabeledStatement(
    SourceLocation loc,
    Identifier label,
    Statement body
) implements Statement {
    @Override
    public String type() {
        return "LabeledStatement";
    }
}
