package com.ai.coach.store;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Tagged value held by the key/value store. Every value crossing the store boundary
 * is one of {@link Type}; integers are carried as {@code long}, floats as {@code double}.
 */
public final class StoreValue {

    public enum Type {
        NULL,
        BOOL,
        INT,
        FLOAT,
        STRING,
        LIST,
        MAP
    }

    public static final StoreValue NULL = new StoreValue(Type.NULL, null);
    public static final StoreValue TRUE = new StoreValue(Type.BOOL, Boolean.TRUE);
    public static final StoreValue FALSE = new StoreValue(Type.BOOL, Boolean.FALSE);

    private final Type type;
    private final Object value;
    private final List<StoreValue> items;
    private final Map<String, StoreValue> entries;

    private StoreValue(Type type, Object value) {
        this(type, value, null, null);
    }

    private StoreValue(Type type, Object value, List<StoreValue> items, Map<String, StoreValue> entries) {
        this.type = type;
        this.value = value;
        this.items = items;
        this.entries = entries;
    }

    public static StoreValue ofBool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static StoreValue ofInt(long l) {
        return new StoreValue(Type.INT, l);
    }

    public static StoreValue ofFloat(double d) {
        return new StoreValue(Type.FLOAT, d);
    }

    public static StoreValue ofString(String s) {
        return s == null ? NULL : new StoreValue(Type.STRING, s);
    }

    public static StoreValue ofList(List<StoreValue> items) {
        if (items == null) return NULL;
        List<StoreValue> copy = Collections.unmodifiableList(new ArrayList<>(items));
        return new StoreValue(Type.LIST, copy, copy, null);
    }

    public static StoreValue ofMap(Map<String, StoreValue> entries) {
        if (entries == null) return NULL;
        Map<String, StoreValue> copy = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        return new StoreValue(Type.MAP, copy, null, copy);
    }

    /**
     * Wraps a plain Java value (as produced by Jackson or written by callers).
     * Unknown object types are stored by their string form.
     */
    public static StoreValue of(Object raw) {
        if (raw == null) return NULL;
        if (raw instanceof StoreValue) return (StoreValue) raw;
        if (raw instanceof Boolean) return ofBool((Boolean) raw);
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ofInt(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger) {
            BigInteger big = (BigInteger) raw;
            return big.bitLength() < 64 ? ofInt(big.longValue()) : ofFloat(big.doubleValue());
        }
        if (raw instanceof Float || raw instanceof Double || raw instanceof BigDecimal) {
            return ofFloat(((Number) raw).doubleValue());
        }
        if (raw instanceof CharSequence || raw instanceof Character) return ofString(raw.toString());
        if (raw instanceof Collection) {
            List<StoreValue> items = new ArrayList<>();
            for (Object o : (Collection<?>) raw) {
                items.add(of(o));
            }
            return ofList(items);
        }
        if (raw instanceof Map) {
            Map<String, StoreValue> entries = new LinkedHashMap<>();
            ((Map<?, ?>) raw).forEach((k, v) -> entries.put(String.valueOf(k), of(v)));
            return ofMap(entries);
        }
        return ofString(raw.toString());
    }

    public Type getType() {
        return type;
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    public boolean is(Type t) {
        return type == t;
    }

    public boolean asBoolean() {
        return (Boolean) require(Type.BOOL);
    }

    public long asLong() {
        return (Long) require(Type.INT);
    }

    public double asDouble() {
        return (Double) require(Type.FLOAT);
    }

    public String asString() {
        return (String) require(Type.STRING);
    }

    public List<StoreValue> asList() {
        require(Type.LIST);
        return items;
    }

    public Map<String, StoreValue> asMap() {
        require(Type.MAP);
        return entries;
    }

    /**
     * Unwraps back to plain Java types (Boolean, Long, Double, String, List, Map).
     */
    public Object toJava() {
        switch (type) {
            case LIST:
                return asList().stream().map(StoreValue::toJava).collect(Collectors.toList());
            case MAP:
                Map<String, Object> out = new LinkedHashMap<>();
                asMap().forEach((k, v) -> out.put(k, v.toJava()));
                return out;
            default:
                return value;
        }
    }

    private Object require(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " but value is " + type);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoreValue)) return false;
        StoreValue other = (StoreValue) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    /**
     * Display form used by templating and string comparisons.
     */
    @Override
    public String toString() {
        switch (type) {
            case NULL:
                return "null";
            case LIST:
                return asList().stream().map(StoreValue::toString).collect(Collectors.joining(", ", "[", "]"));
            case MAP:
                return asMap().entrySet().stream()
                        .map(e -> e.getKey() + ": " + e.getValue())
                        .collect(Collectors.joining(", ", "{", "}"));
            default:
                return String.valueOf(value);
        }
    }
}
