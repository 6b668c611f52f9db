package com.jsdesugar.ast;

public record CatchClause(
    SourceLocation loc,
    Pattern param,  // null for catch without binding
    BlockStatement body
) implements Node {
    @Override
    public String type() {
        return "CatchClause";
    }
}
