package com.jsdesugar.ast;

import java.util.List;

public record CallExpression(
    SourceLocation loc,
    Expression callee,
    List<Expression> arguments,
    boolean optional
) implements Expression {
    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "CallExpression";
    }
}
