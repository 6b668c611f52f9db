package com.jsdesugar.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record ArrayExpression(
    SourceLocation loc,
    List<Expression> elements  // null entries are holes, e.g. [a, , b]
) implements Expression {
    public ArrayExpression {
        // List.copyOf rejects the null holes
        elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }
}
