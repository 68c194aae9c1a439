// file: core/src/main/java/io/slotkv/core/Bytes.java
package io.slotkv.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable byte string used for keys, members and string values.
 * <p>
 * Keys on the wire are opaque byte sequences; this wrapper gives them
 * value semantics (equals/hashCode/compareTo) so they can live in hash maps.
 * <p>
 * Invariants:
 *  - The backing array is never exposed; callers get copies.
 *  - hashCode is computed once.
 */
public final class Bytes implements Comparable<Bytes> {

    public static final Bytes EMPTY = new Bytes(new byte[0], false);

    private final byte[] data;
    private final int hash;

    private Bytes(byte[] data, boolean copy) {
        this.data = copy ? Arrays.copyOf(data, data.length) : data;
        this.hash = Arrays.hashCode(this.data);
    }

    public static Bytes of(byte[] data) {
        if (data == null) throw new NullPointerException("data");
        return new Bytes(data, true);
    }

    public static Bytes of(String s) {
        return new Bytes(s.getBytes(StandardCharsets.UTF_8), false);
    }

    /** Wrap without copying. Only for arrays the caller will never touch again. */
    public static Bytes wrap(byte[] data) {
        if (data == null) throw new NullPointerException("data");
        return new Bytes(data, false);
    }

    public static Bytes of(long n) {
        return of(Long.toString(n));
    }

    public int length() {
        return data.length;
    }

    public byte byteAt(int i) {
        return data[i];
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(data, data.length);
    }

    /** Internal read-only view for encoders; must not be mutated. */
    public byte[] unsafeArray() {
        return data;
    }

    public Bytes concat(Bytes other) {
        byte[] out = Arrays.copyOf(data, data.length + other.data.length);
        System.arraycopy(other.data, 0, out, data.length, other.data.length);
        return new Bytes(out, false);
    }

    public String utf8() {
        return new String(data, StandardCharsets.UTF_8);
    }

    /** Case-insensitive ASCII comparison, used for option keywords like EX/NX/BEFORE. */
    public boolean equalsIgnoreCase(String ascii) {
        if (ascii.length() != data.length) return false;
        for (int i = 0; i < data.length; i++) {
            if (Character.toUpperCase((char) (data[i] & 0xFF)) != Character.toUpperCase(ascii.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bytes other)) return false;
        return hash == other.hash && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public int compareTo(Bytes o) {
        return Arrays.compareUnsigned(data, o.data);
    }

    @Override
    public String toString() {
        return utf8();
    }
}
