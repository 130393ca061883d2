package com.sbus.protocol.v10.connection;

import com.sbus.protocol.v10.types.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Attach parameters of a receiver link.
 */
public class ReceiverLinkOptions {

    // Sender settle modes
    public static final int SND_UNSETTLED = 0;
    public static final int SND_SETTLED = 1;

    // Receiver settle modes
    public static final int RCV_FIRST = 0;
    public static final int RCV_SECOND = 1;

    private final String name;
    private final String sourceAddress;
    private int sndSettleMode = SND_UNSETTLED;
    private int rcvSettleMode = RCV_SECOND;
    private final Map<Symbol, Object> sourceFilter = new LinkedHashMap<>();
    private final Map<Symbol, Object> properties = new LinkedHashMap<>();

    public ReceiverLinkOptions(String name, String sourceAddress) {
        this.name = Objects.requireNonNull(name, "name");
        this.sourceAddress = Objects.requireNonNull(sourceAddress, "sourceAddress");
    }

    public String getName() {
        return name;
    }

    public String getSourceAddress() {
        return sourceAddress;
    }

    public int getSndSettleMode() {
        return sndSettleMode;
    }

    public ReceiverLinkOptions setSndSettleMode(int sndSettleMode) {
        this.sndSettleMode = sndSettleMode;
        return this;
    }

    public int getRcvSettleMode() {
        return rcvSettleMode;
    }

    public ReceiverLinkOptions setRcvSettleMode(int rcvSettleMode) {
        this.rcvSettleMode = rcvSettleMode;
        return this;
    }

    public Map<Symbol, Object> getSourceFilter() {
        return Collections.unmodifiableMap(sourceFilter);
    }

    public ReceiverLinkOptions addSourceFilter(Symbol key, Object value) {
        sourceFilter.put(key, value);
        return this;
    }

    public Map<Symbol, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public ReceiverLinkOptions addProperty(Symbol key, Object value) {
        properties.put(key, value);
        return this;
    }

    @Override
    public String toString() {
        return String.format("ReceiverLinkOptions{name='%s', source='%s', sndSettleMode=%d, rcvSettleMode=%d, filter=%s}",
                name, sourceAddress, sndSettleMode, rcvSettleMode, sourceFilter);
    }
}
