package com.jsdesugar.ast;

import java.util.List;

public record Program(
    SourceLocation loc,
    List<Statement> body,
    String sourceType  // "script" | "module"
) implements Node {
    public Program {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Program";
    }
}
