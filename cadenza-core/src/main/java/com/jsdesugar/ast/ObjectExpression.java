package com.jsdesugar.ast;

import java.util.List;

public record ObjectExpression(
    SourceLocation loc,
    List<Property> properties
) implements Expression {
    public ObjectExpression {
        properties = List.copyOf(properties);
    }

    @Override
    public String type() {
        return "ObjectExpression";
    }
}
