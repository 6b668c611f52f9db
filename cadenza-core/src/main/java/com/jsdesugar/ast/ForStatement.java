package com.jsdesugar.ast;

public record ForStatement(
    SourceLocation loc,
    Node init,  // VariableDeclaration, Expression or null
    Expression test,  // Can be null
    Expression update,  // Can be null
    Statement body
) implements Statement {
    @Override
    public String type() {
        return "ForStatement";
    }
}
