package com.yieldsolver.domain.model;

/**
 * How the Newton solver spends its iteration budget
 */
public enum IterationMode {
    // Always runs the full bound and reports the bound as iterations run
    FIXED("FIXED"),
    // Stops once the residual is within tolerance and reports the steps actually taken
    EARLY_EXIT("EARLY_EXIT");

    private final String value;

    IterationMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static IterationMode fromValue(String value) {
        for (IterationMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown iteration mode: " + value);
    }

    public static boolean isValid(String value) {
        for (IterationMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
