package com.jsdesugar.ast;

import java.util.List;

public record SequenceExpression(
    SourceLocation loc,
    List<Expression> expressions
) implements Expression {
    public SequenceExpression {
        expressions = List.copyOf(expressions);
    }

    @Override
    public String type() {
        return "SequenceExpression";
    }
}
