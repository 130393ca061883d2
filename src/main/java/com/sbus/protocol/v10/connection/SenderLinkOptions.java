package com.sbus.protocol.v10.connection;

import java.util.Objects;

/**
 * Attach parameters of a sender link.
 */
public class SenderLinkOptions {

    private final String name;
    private final String targetAddress;

    public SenderLinkOptions(String name, String targetAddress) {
        this.name = Objects.requireNonNull(name, "name");
        this.targetAddress = Objects.requireNonNull(targetAddress, "targetAddress");
    }

    public String getName() {
        return name;
    }

    public String getTargetAddress() {
        return targetAddress;
    }

    @Override
    public String toString() {
        return String.format("SenderLinkOptions{name='%s', target='%s'}", name, targetAddress);
    }
}
