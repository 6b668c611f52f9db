package com.jsdesugar.ast;

public record MethodDefinition(
    SourceLocation loc,
    Expression key,        // Property name
    FunctionExpression value,
    String kind,          // "constructor" | "method" | "get" | "set"
    boolean computed,
    boolean isStatic
) implements Node {

    public boolean isAccessor() {
        return "get".equals(kind) || "set".equals(kind);
    }

    public MethodDefinition withKey(Expression key) {
        return new MethodDefinition(loc, key, value, kind, computed, isStatic);
    }

    public MethodDefinition withValue(FunctionExpression value) {
        return new MethodDefinition(loc, key, value, kind, computed, isStatic);
    }

    @Override
    public String type() {
        return "MethodDefinition";
    }
}
