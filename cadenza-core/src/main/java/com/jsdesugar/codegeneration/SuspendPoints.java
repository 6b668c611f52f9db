package com.jsdesugar.codegeneration;

/**
 * What {@link YieldFinder} saw in one function body.
 *
 * @param hasYield  the body contains a {@code yield} expression
 * @param hasAwait  the body contains an {@code await} expression
 * @param hasForIn  the body contains a {@code for-in} loop
 */
public record SuspendPoints(boolean hasYield, boolean hasAwait, boolean hasForIn) {

    public boolean hasAnySuspend() {
        return hasYield || hasAwait;
    }
}
