package com.jsdesugar.ast;

public record ExpressionStatement(
    SourceLocation loc,
    Expression expression,
    String directive  // non-null only for directive prologues
) implements Statement {
    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
