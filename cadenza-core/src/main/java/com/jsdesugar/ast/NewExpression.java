package com.jsdesugar.ast;

import java.util.List;

public record NewExpression(
    SourceLocation loc,
    Expression callee,
    List<Expression> arguments
) implements Expression {
    public NewExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "NewExpression";
    }
}
