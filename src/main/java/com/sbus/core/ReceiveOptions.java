package com.sbus.core;

import java.time.Duration;

/**
 * Options a receiver is created with.
 */
public class ReceiveOptions extends MessageHandlerOptions {

    private ReceiveMode receiveMode = ReceiveMode.PEEK_LOCK;
    private String name;

    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    public ReceiveOptions setReceiveMode(ReceiveMode receiveMode) {
        this.receiveMode = receiveMode == null ? ReceiveMode.PEEK_LOCK : receiveMode;
        return this;
    }

    /**
     * Link name; a unique one is generated when unset.
     */
    public String getName() {
        return name;
    }

    public ReceiveOptions setName(String name) {
        this.name = name;
        return this;
    }

    /**
     * Copy the handler options of {@code options} over these.
     */
    public ReceiveOptions applyHandlerOptions(MessageHandlerOptions options) {
        if (options == null) {
            return this;
        }
        if (options.getMaxConcurrentCalls() != null) {
            setMaxConcurrentCalls(options.getMaxConcurrentCalls());
        }
        if (options.getAutoComplete() != null) {
            setAutoComplete(options.getAutoComplete());
        }
        Duration renew = options.getMaxAutoRenewDuration();
        if (renew != null) {
            setMaxAutoRenewDuration(renew);
        }
        return this;
    }

    @Override
    public ReceiveOptions setMaxConcurrentCalls(int maxConcurrentCalls) {
        super.setMaxConcurrentCalls(maxConcurrentCalls);
        return this;
    }

    @Override
    public ReceiveOptions setAutoComplete(boolean autoComplete) {
        super.setAutoComplete(autoComplete);
        return this;
    }

    @Override
    public ReceiveOptions setMaxAutoRenewDuration(Duration maxAutoRenewDuration) {
        super.setMaxAutoRenewDuration(maxAutoRenewDuration);
        return this;
    }
}
