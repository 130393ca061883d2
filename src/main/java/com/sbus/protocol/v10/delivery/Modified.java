package com.sbus.protocol.v10.delivery;

import com.sbus.protocol.v10.types.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AMQP 1.0 Modified delivery state.
 *
 * Abandon writes it with undeliverable-here unset so the message becomes available
 * again; defer sets undeliverable-here so the broker parks the message until it is
 * fetched by sequence number.
 *
 * Fields:
 * 0: delivery-failed (boolean) - Delivery count should be incremented
 * 1: undeliverable-here (boolean) - Don't redeliver to this link
 * 2: message-annotations (map) - Annotations to add to message
 */
public class Modified implements DeliveryState {

    private Boolean deliveryFailed;
    private Boolean undeliverableHere;
    private Map<Symbol, Object> messageAnnotations;

    @Override
    public long getDescriptor() {
        return MODIFIED;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    public Boolean getDeliveryFailed() {
        return deliveryFailed;
    }

    public boolean isDeliveryFailed() {
        return deliveryFailed != null && deliveryFailed;
    }

    public Boolean getUndeliverableHere() {
        return undeliverableHere;
    }

    public boolean isUndeliverableHere() {
        return undeliverableHere != null && undeliverableHere;
    }

    public Map<Symbol, Object> getMessageAnnotations() {
        return messageAnnotations == null ? Collections.emptyMap() : messageAnnotations;
    }

    public Modified setDeliveryFailed(Boolean deliveryFailed) {
        this.deliveryFailed = deliveryFailed;
        return this;
    }

    public Modified setUndeliverableHere(Boolean undeliverableHere) {
        this.undeliverableHere = undeliverableHere;
        return this;
    }

    /**
     * Set annotations from application-level property names.
     */
    public Modified setMessageAnnotations(Map<String, Object> propertiesToModify) {
        if (propertiesToModify == null || propertiesToModify.isEmpty()) {
            this.messageAnnotations = null;
            return this;
        }
        Map<Symbol, Object> annotations = new LinkedHashMap<>();
        propertiesToModify.forEach((key, value) -> annotations.put(Symbol.valueOf(key), value));
        this.messageAnnotations = Collections.unmodifiableMap(annotations);
        return this;
    }

    @Override
    public String toString() {
        return String.format("Modified{deliveryFailed=%s, undeliverableHere=%s, annotations=%s}",
                deliveryFailed, undeliverableHere, getMessageAnnotations().keySet());
    }
}
