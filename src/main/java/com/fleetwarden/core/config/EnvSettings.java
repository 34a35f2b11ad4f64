package com.fleetwarden.core.config;

import java.util.Map;

/**
 * Lenient parsing of environment-style overrides.
 * <p>
 * Every helper resolves "explicit option, then environment, then built-in default" and falls
 * back to the default when the input is blank, non-numeric, non-finite or out of range.
 */
public final class EnvSettings {

    private final Map<String, String> env;

    public EnvSettings(Map<String, String> env) {
        this.env = env == null ? Map.of() : env;
    }

    public static EnvSettings system() {
        return new EnvSettings(System.getenv());
    }

    /** Raw environment value, {@code null} when unset or blank. */
    public String get(String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    /** First non-blank of the option and the environment variable, else the fallback. */
    public String resolve(String option, String envName, String fallback) {
        if (option != null && !option.isBlank()) {
            return option.trim();
        }
        String fromEnv = get(envName);
        return fromEnv != null ? fromEnv : fallback;
    }

    public long delayMs(String envName, long fallback, long min) {
        return parseDelayMs(get(envName), fallback, min);
    }

    public boolean flag(String envName, boolean fallback) {
        return parseBoolean(get(envName), fallback);
    }

    /**
     * Parses a millisecond delay. Invalid input yields {@code fallback}; valid input is clamped to {@code min}.
     */
    public static long parseDelayMs(String value, long fallback, long min) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            return fallback;
        }
        return Math.max(min, (long) Math.floor(parsed));
    }

    /** Parses a positive integer, falling back on anything else. */
    public static int parsePositiveInt(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static boolean parseBoolean(String value, boolean fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return switch (value.trim().toLowerCase()) {
            case "1", "true", "yes", "on" -> true;
            case "0", "false", "no", "off" -> false;
            default -> fallback;
        };
    }
}
