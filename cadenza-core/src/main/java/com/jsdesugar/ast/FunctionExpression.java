package com.jsdesugar.ast;

import java.util.List;

public record FunctionExpression(
    SourceLocation loc,
    Identifier id,  // null for anonymous functions
    boolean generator,
    boolean async,
    List<Pattern> params,
    BlockStatement body
) implements Expression {
    public FunctionExpression {
        params = List.copyOf(params);
    }

    public FunctionExpression withBody(BlockStatement body) {
        return new FunctionExpression(loc, id, generator, async, params, body);
    }

    public FunctionExpression withGenerator(boolean generator) {
        return new FunctionExpression(loc, id, generator, async, params, body);
    }

    @Override
    public String type() {
        return "FunctionExpression";
    }
}
