package com.sbus.core;

import com.sbus.protocol.v10.transport.ErrorCondition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional parameters of a disposition: properties to modify on abandon or defer,
 * the error describing a dead-lettering.
 */
public class DispositionOptions {

    private Map<String, Object> propertiesToModify;
    private ErrorCondition error;

    public Map<String, Object> getPropertiesToModify() {
        return propertiesToModify == null ? Collections.emptyMap() : Collections.unmodifiableMap(propertiesToModify);
    }

    public DispositionOptions setPropertiesToModify(Map<String, Object> propertiesToModify) {
        this.propertiesToModify = propertiesToModify == null ? null : new LinkedHashMap<>(propertiesToModify);
        return this;
    }

    public ErrorCondition getError() {
        return error;
    }

    public DispositionOptions setError(ErrorCondition error) {
        this.error = error;
        return this;
    }
}
