package com.jsdesugar.ast;

public record ClassExpression(
    SourceLocation loc,
    Identifier id,  // Can be null
    Expression superClass,  // Can be null
    ClassBody body
) implements Expression {
    @Override
    public String type() {
        return "ClassExpression";
    }
}
