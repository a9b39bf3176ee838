package com.yieldsolver.domain.model;

/**
 * When payments fall within a period (the spreadsheet "when" / "type" argument)
 */
public enum PaymentTiming {
    END(0),
    BEGIN(1);

    private final int value;

    PaymentTiming(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static PaymentTiming fromValue(int value) {
        for (PaymentTiming timing : values()) {
            if (timing.value == value) {
                return timing;
            }
        }
        throw new IllegalArgumentException("Unknown payment timing: " + value);
    }

    /**
     * Accepts either the numeric form ("0", "1") or the name ("end", "begin")
     */
    public static PaymentTiming fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Unknown payment timing: null");
        }
        String trimmed = value.trim();
        if (trimmed.equals("0") || trimmed.equals("1")) {
            return fromValue(Integer.parseInt(trimmed));
        }
        for (PaymentTiming timing : values()) {
            if (timing.name().equalsIgnoreCase(trimmed)) {
                return timing;
            }
        }
        throw new IllegalArgumentException("Unknown payment timing: " + value);
    }

    public static boolean isValid(String value) {
        try {
            fromValue(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
