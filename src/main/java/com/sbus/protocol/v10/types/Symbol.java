package com.sbus.protocol.v10.types;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * AMQP 1.0 Symbol type.
 * Symbols name error conditions, filters and annotation keys, so instances are interned.
 */
public final class Symbol implements Comparable<Symbol> {

    private static final ConcurrentMap<String, Symbol> SYMBOLS = new ConcurrentHashMap<>();

    private final String value;

    private Symbol(String value) {
        this.value = value;
    }

    public static Symbol valueOf(String value) {
        if (value == null) {
            return null;
        }
        return SYMBOLS.computeIfAbsent(value, Symbol::new);
    }

    public int length() {
        return value.length();
    }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Symbol symbol = (Symbol) obj;
        return Objects.equals(value, symbol.value);
    }

    @Override
    public int compareTo(Symbol other) {
        return value.compareTo(other.value);
    }
}
