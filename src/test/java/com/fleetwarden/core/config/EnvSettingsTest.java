package com.fleetwarden.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvSettingsTest {

    @Nested
    @DisplayName("parseDelayMs")
    class ParseDelayTests {

        @Test
        @DisplayName("invalid input falls back")
        void invalidFallsBack() {
            assertEquals(60_000, EnvSettings.parseDelayMs("soon", 60_000, 0));
            assertEquals(60_000, EnvSettings.parseDelayMs("", 60_000, 0));
            assertEquals(60_000, EnvSettings.parseDelayMs(null, 60_000, 0));
            assertEquals(60_000, EnvSettings.parseDelayMs("NaN", 60_000, 0));
        }

        @Test
        @DisplayName("valid input is floored and clamped to the minimum")
        void clampsToMinimum() {
            assertEquals(1500, EnvSettings.parseDelayMs("1500.9", 60_000, 0));
            assertEquals(1000, EnvSettings.parseDelayMs("5", 60_000, 1000));
            assertEquals(0, EnvSettings.parseDelayMs("-20", 60_000, 0));
        }
    }

    @Test
    void parsePositiveInt() {
        assertEquals(7, EnvSettings.parsePositiveInt(" 7 ", 3));
        assertEquals(3, EnvSettings.parsePositiveInt("0", 3));
        assertEquals(3, EnvSettings.parsePositiveInt("x", 3));
    }

    @Test
    void parseBoolean() {
        assertTrue(EnvSettings.parseBoolean("yes", false));
        assertFalse(EnvSettings.parseBoolean("OFF", true));
        assertTrue(EnvSettings.parseBoolean("maybe", true));
    }

    @Test
    @DisplayName("option wins over environment, blank counts as unset")
    void resolveOrder() {
        var env = new EnvSettings(Map.of("A", "from-env", "B", "  "));

        assertEquals("opt", env.resolve(" opt ", "A", "def"));
        assertEquals("from-env", env.resolve("", "A", "def"));
        assertEquals("def", env.resolve(null, "B", "def"));
        assertNull(env.get("B"));
    }
}
