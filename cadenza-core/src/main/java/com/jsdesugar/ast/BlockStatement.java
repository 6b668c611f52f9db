package com.jsdesugar.ast;

import java.util.List;

public record BlockStatement(
    SourceLocation loc,
    List<Statement> body
) implements Statement {
    public BlockStatement {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }
}
