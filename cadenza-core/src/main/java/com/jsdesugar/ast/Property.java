package com.jsdesugar.ast;

/**
 * A property of an object literal. Accessors are properties of kind {@code "get"} or
 * {@code "set"} whose value is a {@link FunctionExpression}.
 */
public record Property(
    SourceLocation loc,
    Expression key,
    Expression value,
    String kind,  // "init" | "get" | "set"
    boolean method,
    boolean shorthand,
    boolean computed
) implements Node {

    public boolean isAccessor() {
        return "get".equals(kind) || "set".equals(kind);
    }

    public Property withKey(Expression key) {
        return new Property(loc, key, value, kind, method, shorthand, computed);
    }

    public Property withValue(Expression value) {
        return new Property(loc, key, value, kind, method, shorthand, computed);
    }

    @Override
    public String type() {
        return "Property";
    }
}
