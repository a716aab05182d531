package com.raditha.mvscan.config;

/**
 * Enumeration of sink policies deciding whether a stale read is consequential.
 */
public enum SinkMode {
    /**
     * Same-variable re-read at a branch predicate or cross-contract call.
     */
    SAME_VARIABLE,

    /**
     * The read value (or a local copy of it) reaches a branch, a call or a storage write.
     */
    VALUE_INFLUENCE,

    /**
     * No sink test: every pair passes. This is the default.
     */
    NONE;

    /**
     * Convert a string value to SinkMode.
     *
     * @param value the string value to convert (case-insensitive); blank means {@link #NONE}
     * @return the corresponding SinkMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static SinkMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }

        return switch (value.trim().toLowerCase()) {
            case "samevar" -> SAME_VARIABLE;
            case "value" -> VALUE_INFLUENCE;
            case "none", "off" -> NONE;
            default -> throw new IllegalArgumentException(
                    "Invalid sink test: " + value + ". Must be: value, samevar, or none");
        };
    }

    /**
     * Get the string representation of this mode for CLI and YAML usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case SAME_VARIABLE -> "samevar";
            case VALUE_INFLUENCE -> "value";
            case NONE -> "none";
        };
    }
}
