package com.jsdesugar.ast;

public record MemberExpression(
    SourceLocation loc,
    Expression object,
    Expression property,
    boolean computed,
    boolean optional
) implements Expression, Pattern {
    @Override
    public String type() {
        return "MemberExpression";
    }
}
