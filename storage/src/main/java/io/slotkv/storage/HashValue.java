package io.slotkv.storage;

import io.slotkv.core.Bytes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Field -> value map; insertion ordered so HGETALL/HKEYS are stable. */
public final class HashValue implements Value {

    private final LinkedHashMap<Bytes, Bytes> fields;
    private final long generation;

    public HashValue(Map<Bytes, Bytes> fields, long generation) {
        this.fields = new LinkedHashMap<>(fields);
        this.generation = generation;
    }

    @Override
    public ValueType type() {
        return ValueType.HASH;
    }

    @Override
    public long generation() {
        return generation;
    }

    @Override
    public HashValue copy(long generation) {
        return new HashValue(fields, generation);
    }

    public Map<Bytes, Bytes> fields() {
        return Collections.unmodifiableMap(fields);
    }

    Map<Bytes, Bytes> mutableFields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HashValue other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "HashValue" + fields;
    }
}
