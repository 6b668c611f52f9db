package com.jsdesugar.ast;

public record Identifier(
    SourceLocation loc,
    String name
) implements Expression, Pattern {
    public Identifier(String name) {
        this(null, name);
    }

    @Override
    public String type() {
        return "Identifier";
    }
}
