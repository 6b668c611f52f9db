package com.jsdesugar.ast;

import java.util.List;

public record SwitchStatement(
    SourceLocation loc,
    Expression discriminant,
    List<SwitchCase> cases
) implements Statement {
    public SwitchStatement {
        cases = List.copyOf(cases);
    }

    @Override
    public String type() {
        return "SwitchStatement";
    }
}
