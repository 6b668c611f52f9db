package com.jsdesugar.util;

import com.jsdesugar.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps formatted diagnostics in memory for embedders that render them themselves.
 */
public class CollectingErrorReporter implements ErrorReporter {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    @Override
    public void reportError(SourceLocation location, String format, Object... args) {
        errors.add(LoggingErrorReporter.format(location, format, args));
    }

    @Override
    public void reportWarning(SourceLocation location, String format, Object... args) {
        warnings.add(LoggingErrorReporter.format(location, format, args));
    }

    @Override
    public boolean hadError() {
        return !errors.isEmpty();
    }

    public List<String> getErrors() {
        return List.copyOf(errors);
    }

    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }
}
