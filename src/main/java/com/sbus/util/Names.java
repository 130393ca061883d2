package com.sbus.util;

import java.util.UUID;

public final class Names {

    private Names() {
    }

    /**
     * A name that is unique for the lifetime of the broker entity, so a reopened link
     * never collides with one the broker is still tearing down.
     */
    public static String uniqueName(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }
}
