package com.jsdesugar.ast;

public record UpdateExpression(
    SourceLocation loc,
    String operator,  // "++" | "--"
    boolean prefix,
    Expression argument
) implements Expression {
    @Override
    public String type() {
        return "UpdateExpression";
    }
}
