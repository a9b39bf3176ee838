package com.yieldsolver.domain.model;

/**
 * Closed-form TVM functions addressable by name
 */
public enum TimeValueFunction {
    FV("fv"),
    PV("pv"),
    PMT("pmt"),
    NPER("nper"),
    IPMT("ipmt"),
    PPMT("ppmt");

    private final String value;

    TimeValueFunction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TimeValueFunction fromValue(String value) {
        for (TimeValueFunction function : values()) {
            if (function.value.equalsIgnoreCase(value)) {
                return function;
            }
        }
        throw new IllegalArgumentException("Unknown time value function: " + value);
    }

    public static boolean isValid(String value) {
        for (TimeValueFunction function : values()) {
            if (function.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
