package com.jsdesugar.ast;

public record ForOfStatement(
    SourceLocation loc,
    Node left,  // VariableDeclaration or Pattern
    Expression right,
    Statement body,
    boolean await  // for await (...)
) implements Statement {
    @Override
    public String type() {
        return "ForOfStatement";
    }
}
