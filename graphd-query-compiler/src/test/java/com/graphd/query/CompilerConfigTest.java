package com.graphd.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CompilerConfig.
 */
public class CompilerConfigTest {

    @Test
    @DisplayName("Defaults are 1024 and 65536")
    public void testDefaults() {
        CompilerConfig config = CompilerConfig.defaults();
        assertEquals(1024, config.resultPageSizeDefault());
        assertEquals(65536, config.resultPageSizeMax());
    }

    @Test
    @DisplayName("Page sizes must be positive")
    public void testValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new CompilerConfig(0, 10));
        assertThrows(IllegalArgumentException.class,
            () -> new CompilerConfig(10, -1));
    }

    @Test
    @DisplayName("Unset and malformed settings fall back to the default")
    public void testParseOrDefault() {
        assertEquals(7, CompilerConfig.parseOrDefault("X", null, 7));
        assertEquals(7, CompilerConfig.parseOrDefault("X", "", 7));
        assertEquals(7, CompilerConfig.parseOrDefault("X", "lots", 7));
        assertEquals(7, CompilerConfig.parseOrDefault("X", "0", 7));
        assertEquals(7, CompilerConfig.parseOrDefault("X", "-3", 7));
        assertEquals(250, CompilerConfig.parseOrDefault("X", " 250 ", 7));
    }

    @Test
    @DisplayName("Reading the environment yields a valid configuration")
    public void testFromEnvironment() {
        CompilerConfig config = CompilerConfig.fromEnvironment();
        assertTrue(config.resultPageSizeDefault() > 0);
        assertTrue(config.resultPageSizeMax() > 0);
    }
}
