package com.jsdesugar.util;

import com.jsdesugar.ast.SourceLocation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingErrorReporterTest {

    private final Logger logger = Logger.getLogger("com.jsdesugar.util.LoggingErrorReporterTest");
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void setUp() {
        logger.setUseParentHandlers(false);
        logger.addHandler(handler);
    }

    @AfterEach
    void tearDown() {
        logger.removeHandler(handler);
    }

    @Test
    void testErrorIsLoggedAtSevereWithPosition() {
        LoggingErrorReporter reporter = new LoggingErrorReporter(logger);
        SourceLocation location = new SourceLocation(
            new SourceLocation.Position(3, 4), new SourceLocation.Position(3, 9));

        reporter.reportError(location, "unexpected %s", "yield");

        assertTrue(reporter.hadError());
        assertEquals(1, reporter.getErrorCount());
        assertEquals(1, records.size());
        assertEquals(Level.SEVERE, records.get(0).getLevel());
        assertEquals("3:4: unexpected yield", records.get(0).getMessage());
    }

    @Test
    void testWarningDoesNotCountAsError() {
        LoggingErrorReporter reporter = new LoggingErrorReporter(logger);

        reporter.reportWarning(null, "label %s is unused", "outer");

        assertFalse(reporter.hadError());
        assertEquals(1, reporter.getWarningCount());
        assertEquals(Level.WARNING, records.get(0).getLevel());
        assertEquals("label outer is unused", records.get(0).getMessage());
    }
}
