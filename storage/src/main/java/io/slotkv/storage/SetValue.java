package io.slotkv.storage;

import io.slotkv.core.Bytes;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public final class SetValue implements Value {

    private final LinkedHashSet<Bytes> members;
    private final long generation;

    public SetValue(Collection<Bytes> members, long generation) {
        this.members = new LinkedHashSet<>(members);
        this.generation = generation;
    }

    @Override
    public ValueType type() {
        return ValueType.SET;
    }

    @Override
    public long generation() {
        return generation;
    }

    @Override
    public SetValue copy(long generation) {
        return new SetValue(members, generation);
    }

    public Set<Bytes> members() {
        return Collections.unmodifiableSet(members);
    }

    Set<Bytes> mutableMembers() {
        return members;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SetValue other && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return "SetValue" + members;
    }
}
