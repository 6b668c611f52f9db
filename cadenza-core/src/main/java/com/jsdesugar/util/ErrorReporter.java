package com.jsdesugar.util;

import com.jsdesugar.ast.SourceLocation;

/**
 * Sink for diagnostics produced while lowering a program.
 *
 * <p>Messages are {@link String#format} patterns. Whether an error stops the compilation
 * is up to the embedder, which can inspect {@link #hadError()} once the pass returns.
 */
public interface ErrorReporter {

    /**
     * @param location where the problem is, or null if it has no source position
     */
    void reportError(SourceLocation location, String format, Object... args);

    void reportWarning(SourceLocation location, String format, Object... args);

    boolean hadError();
}
