package com.jsdesugar.ast;

public record ForInStatement(
    SourceLocation loc,
    Node left,  // VariableDeclaration or Pattern
    Expression right,
    Statement body
) implements Statement {
    @Override
    public String type() {
        return "ForInStatement";
    }
}
