package com.jsdesugar.ast;

public record EmptyStatement(
    SourceLocation loc
) implements Statement {
    @Override
    public String type() {
        return "EmptyStatement";
    }
}
