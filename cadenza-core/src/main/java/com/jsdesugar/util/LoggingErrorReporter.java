package com.jsdesugar.util;

import com.jsdesugar.ast.SourceLocation;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reports diagnostics through a {@link Logger}. Errors are logged at SEVERE, warnings at
 * WARNING.
 */
public class LoggingErrorReporter implements ErrorReporter {

    private final Logger logger;
    private int errorCount;
    private int warningCount;

    public LoggingErrorReporter(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public LoggingErrorReporter() {
        this(Logger.getLogger(LoggingErrorReporter.class.getName()));
    }

    @Override
    public void reportError(SourceLocation location, String format, Object... args) {
        errorCount++;
        logger.severe(format(location, format, args));
    }

    @Override
    public void reportWarning(SourceLocation location, String format, Object... args) {
        warningCount++;
        logger.warning(format(location, format, args));
    }

    @Override
    public boolean hadError() {
        return errorCount > 0;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getWarningCount() {
        return warningCount;
    }

    static String format(SourceLocation location, String format, Object... args) {
        String message = String.format(format, args);
        if (location == null || location.start() == null) {
            return message;
        }
        return location.start() + ": " + message;
    }
}
