package com.sbus.core;

import java.util.Locale;

/**
 * Outcomes a receiver can settle a peek-locked message with.
 */
public enum DispositionType {
    COMPLETE,
    ABANDON,
    DEFER,
    DEADLETTER;

    /**
     * Parse an operation name such as {@code "complete"}.
     *
     * @throws IllegalArgumentException if the name is not a valid operation
     */
    public static DispositionType fromOperation(String operation) {
        if (operation != null) {
            for (DispositionType type : values()) {
                if (type.name().toLowerCase(Locale.ROOT).equals(operation)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("operation: '" + operation + "' is not a valid operation.");
    }

    public String operation() {
        return name().toLowerCase(Locale.ROOT);
    }
}
