package com.jsdesugar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TransformOptionsTest {

    @Test
    void testDefaults() {
        TransformOptions options = TransformOptions.defaults();
        assertTrue(options.generators());
        assertFalse(options.deferredFunctions());
    }

    @Test
    void testBuilder() {
        TransformOptions options = TransformOptions.builder()
            .generators(false)
            .deferredFunctions(true)
            .build();
        assertFalse(options.generators());
        assertTrue(options.deferredFunctions());
        assertEquals("TransformOptions{generators=false, deferredFunctions=true}", options.toString());
    }

    @Test
    void testToBuilderCopies() {
        TransformOptions base = TransformOptions.builder().deferredFunctions(true).build();
        TransformOptions derived = base.toBuilder().generators(false).build();

        assertTrue(base.generators());
        assertFalse(derived.generators());
        assertTrue(derived.deferredFunctions());
    }
}
