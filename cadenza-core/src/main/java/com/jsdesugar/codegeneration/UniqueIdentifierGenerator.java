package com.jsdesugar.codegeneration;

/**
 * Hands out identifiers that cannot collide with each other or with user code that stays
 * clear of the reserved {@code $__} prefix.
 *
 * <p>One instance is created per compilation and passed explicitly to every pass that
 * needs fresh names, so names stay unique across the whole output program. Instances are
 * not thread-safe; independent compilations use independent generators.
 */
public final class UniqueIdentifierGenerator {

    private static final String PREFIX = "$__";

    private int identifierIndex;

    public String generateUniqueIdentifier() {
        return PREFIX + identifierIndex++;
    }
}
