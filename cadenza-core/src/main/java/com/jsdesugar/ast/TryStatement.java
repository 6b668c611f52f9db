package com.jsdesugar.ast;

public record TryStatement(
    SourceLocation loc,
    BlockStatement block,
    CatchClause handler,  // Can be null
    BlockStatement finalizer  // Can be null
) implements Statement {
    @Override
    public String type() {
        return "TryStatement";
    }
}
