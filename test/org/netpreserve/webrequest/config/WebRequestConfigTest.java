package org.netpreserve.webrequest.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WebRequestConfigTest {
    @Test
    void testDefaults() {
        var config = WebRequestConfig.defaults();
        assertEquals("webrequest-listener", config.listenerThreadName());
        assertEquals(Duration.ofSeconds(10), config.slowDecisionWarning());
        assertEquals(120, config.maxLoggedUrlLength());
        assertTrue(config.slowDecisionWarningEnabled());
    }

    @Test
    void testOverrideFileReplacesOnlyGivenKeys(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("webrequest.yaml");
        Files.writeString(file, "slowDecisionWarning: 1500\n");
        var config = WebRequestConfig.load(file);
        assertEquals(Duration.ofMillis(1500), config.slowDecisionWarning());
        assertEquals("webrequest-listener", config.listenerThreadName());
        assertEquals(120, config.maxLoggedUrlLength());

        Files.writeString(file, "slowDecisionWarning: PT2M\nmaxLoggedUrlLength: 0\n");
        config = WebRequestConfig.load(file);
        assertEquals(Duration.ofMinutes(2), config.slowDecisionWarning());
        assertEquals(0, config.maxLoggedUrlLength());
    }

    @Test
    void testZeroDisablesWarning(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("webrequest.yaml");
        Files.writeString(file, "slowDecisionWarning: 0s\n");
        assertFalse(WebRequestConfig.load(file).slowDecisionWarningEnabled());
    }

    @Test
    void testMissingOrEmptyFileKeepsDefaults(@TempDir Path tempDir) throws Exception {
        assertEquals(WebRequestConfig.defaults(), WebRequestConfig.load(tempDir.resolve("missing.yaml")));
        Path empty = tempDir.resolve("empty.yaml");
        Files.writeString(empty, "");
        assertEquals(WebRequestConfig.defaults(), WebRequestConfig.load(empty));
    }
}
