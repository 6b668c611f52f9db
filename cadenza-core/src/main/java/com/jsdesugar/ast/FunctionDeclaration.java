package com.jsdesugar.ast;

import java.util.List;

public record FunctionDeclaration(
    SourceLocation loc,
    Identifier id,
    boolean generator,
    boolean async,
    List<Pattern> params,
    BlockStatement body
) implements Statement {
    public FunctionDeclaration {
        params = List.copyOf(params);
    }

    public FunctionDeclaration withBody(BlockStatement body) {
        return new FunctionDeclaration(loc, id, generator, async, params, body);
    }

    public FunctionDeclaration withGenerator(boolean generator) {
        return new FunctionDeclaration(loc, id, generator, async, params, body);
    }

    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
