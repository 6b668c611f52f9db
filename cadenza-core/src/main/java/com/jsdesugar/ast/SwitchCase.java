package com.jsdesugar.ast;

import java.util.List;

public record SwitchCase(
    SourceLocation loc,
    Expression test,  // null for default
    List<Statement> consequent
) implements Node {
    public SwitchCase {
        consequent = List.copyOf(consequent);
    }

    @Override
    public String type() {
        return "SwitchCase";
    }
}
