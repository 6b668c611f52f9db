package com.jsdesugar.ast;

import java.util.List;

public record VariableDeclaration(
    SourceLocation loc,
    List<VariableDeclarator> declarations,
    String kind  // "var" | "let" | "const"
) implements Statement {
    public VariableDeclaration {
        declarations = List.copyOf(declarations);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
