package com.jsdesugar.ast;

public record ClassDeclaration(
    SourceLocation loc,
    Identifier id,
    Expression superClass,  // Can be null
    ClassBody body
) implements Statement {
    @Override
    public String type() {
        return "ClassDeclaration";
    }
}
