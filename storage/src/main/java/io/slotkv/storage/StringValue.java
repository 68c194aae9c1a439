package io.slotkv.storage;

import io.slotkv.core.Bytes;

import java.util.Objects;

/** Immutable string value; never needs copy-on-write. */
public record StringValue(Bytes bytes) implements Value {

    public StringValue {
        Objects.requireNonNull(bytes, "bytes");
    }

    @Override
    public ValueType type() {
        return ValueType.STRING;
    }

    @Override
    public long generation() {
        return Long.MAX_VALUE;
    }

    @Override
    public Value copy(long generation) {
        return this;
    }
}
