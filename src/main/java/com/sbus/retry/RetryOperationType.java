package com.sbus.retry;

public enum RetryOperationType {
    CBS_AUTH("cbsAuth"),
    MANAGEMENT("management"),
    RECEIVER_LINK("receiverLink"),
    SENDER_LINK("senderLink"),
    SEND_MESSAGE("sendMessage"),
    RECEIVE_MESSAGE("receiveMessage"),
    SESSION("session");

    private final String label;

    RetryOperationType(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
