package com.jsdesugar.ast;

import java.util.List;

public record ClassBody(
    SourceLocation loc,
    List<MethodDefinition> body
) implements Node {
    public ClassBody {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "ClassBody";
    }
}
