package io.slotkv.storage;

/**
 * Shape of a stored value. The tag is the record type byte in snapshot files.
 */
public enum ValueType {
    STRING("string", (byte) 1),
    LIST("list", (byte) 2),
    HASH("hash", (byte) 3),
    SET("set", (byte) 4);

    private final String wireName;
    private final byte tag;

    ValueType(String wireName, byte tag) {
        this.wireName = wireName;
        this.tag = tag;
    }

    /** Name reported by TYPE. */
    public String wireName() {
        return wireName;
    }

    public byte tag() {
        return tag;
    }

    public static ValueType fromTag(byte tag) {
        for (ValueType t : values()) {
            if (t.tag == tag) return t;
        }
        throw new IllegalArgumentException("unknown value tag: " + tag);
    }
}
