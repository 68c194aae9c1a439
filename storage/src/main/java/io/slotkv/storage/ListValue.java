package io.slotkv.storage;

import io.slotkv.core.Bytes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public final class ListValue implements Value {

    private final ArrayList<Bytes> items;
    private final long generation;

    public ListValue(Collection<Bytes> items, long generation) {
        this.items = new ArrayList<>(items);
        this.generation = generation;
    }

    @Override
    public ValueType type() {
        return ValueType.LIST;
    }

    @Override
    public long generation() {
        return generation;
    }

    @Override
    public ListValue copy(long generation) {
        return new ListValue(items, generation);
    }

    /** Read-only view. */
    public List<Bytes> items() {
        return Collections.unmodifiableList(items);
    }

    List<Bytes> mutableItems() {
        return items;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ListValue other && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "ListValue" + items;
    }
}
