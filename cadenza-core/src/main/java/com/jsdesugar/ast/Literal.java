package com.jsdesugar.ast;

public record Literal(
    SourceLocation loc,
    Object value,  // String, Boolean, Number or null
    String raw
) implements Expression {
    @Override
    public String type() {
        return "Literal";
    }
}
