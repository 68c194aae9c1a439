// file: storage/src/main/java/io/slotkv/storage/SnapshotCodec.java
package io.slotkv.storage;

import io.slotkv.core.Bytes;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.CheckedOutputStream;

/**
 * Binary framing for store snapshots.
 * <p>
 * Full on-disk layout (big-endian):
 * <p>
 *   [HEADER]
 *     - magic   (4B) = 0x534B5653 ("SKVS")
 *     - version (2B) = 1
 *     - created (8B) = epoch millis
 *     - count   (4B) = number of records
 * <p>
 *   [RECORD] repeated count times
 *     - type:     byte (see {@link ValueType#tag()})
 *     - key:      int32 len + bytes
 *     - expireAt: int64 (-1 => no expiry)
 *     - payload:
 *         string   -> int32 len + bytes
 *         list/set -> int32 n, n x (int32 len + bytes)
 *         hash     -> int32 n, n x (field, value)
 * <p>
 *   [TRAILER]
 *     - crc32 (4B) = CRC32 of every preceding byte
 * <p>
 * Decoding validates magic, version and checksum and rejects trailing or
 * missing bytes with {@link PersistenceException}.
 * <p>
 * The same image travels over a replication link when a replica is resynced.
 */
public final class SnapshotCodec {
    static final int MAGIC = 0x534B5653;
    static final short VERSION = 1;

    private SnapshotCodec() {}

    /** Encode a snapshot; the stream is flushed but not closed. */
    static void write(SnapshotData snapshot, OutputStream target) throws IOException {
        CRC32 crc = new CRC32();
        var checked = new CheckedOutputStream(target, crc);
        var out = new DataOutputStream(checked);

        out.writeInt(MAGIC);
        out.writeShort(VERSION);
        out.writeLong(snapshot.createdAtMillis());
        out.writeInt(snapshot.entries().size());

        for (SnapshotData.Entry e : snapshot.entries()) {
            Value v = e.value();
            out.writeByte(v.type().tag());
            writeBytes(out, e.key());
            out.writeLong(e.expireAtMillis() < 0 ? -1L : e.expireAtMillis());
            writePayload(out, v);
        }
        out.flush();

        // trailer is outside the checksum
        new DataOutputStream(target).writeInt((int) crc.getValue());
        target.flush();
    }

    public static byte[] encode(SnapshotData snapshot) {
        var buf = new ByteArrayOutputStream();
        try {
            write(snapshot, buf);
        } catch (IOException e) {
            throw new PersistenceException("in-memory snapshot encode failed", e);
        }
        return buf.toByteArray();
    }

    /** Decode a complete snapshot file image. */
    public static SnapshotData decode(byte[] image) {
        if (image.length < 4 + 2 + 8 + 4 + 4) {
            throw new PersistenceException("snapshot truncated: " + image.length + " bytes");
        }
        int bodyLen = image.length - 4;
        CRC32 crc = new CRC32();
        crc.update(image, 0, bodyLen);
        int expected = readIntAt(image, bodyLen);

        try (var in = new DataInputStream(new ByteArrayInputStream(image, 0, bodyLen))) {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new PersistenceException(String.format("bad snapshot magic 0x%08X", magic));
            }
            short version = in.readShort();
            if (version != VERSION) {
                throw new PersistenceException("unsupported snapshot version " + version);
            }
            if ((int) crc.getValue() != expected) {
                throw new PersistenceException("snapshot checksum mismatch");
            }
            long created = in.readLong();
            int count = in.readInt();
            if (count < 0) {
                throw new PersistenceException("negative record count " + count);
            }

            List<SnapshotData.Entry> entries = new ArrayList<>(Math.min(count, 1 << 16));
            for (int i = 0; i < count; i++) {
                ValueType type;
                try {
                    type = ValueType.fromTag(in.readByte());
                } catch (IllegalArgumentException e) {
                    throw new PersistenceException("record " + i + ": " + e.getMessage());
                }
                Bytes key = readBytes(in);
                long expireAt = in.readLong();
                Value value = readPayload(in, type);
                entries.add(new SnapshotData.Entry(key, value, expireAt));
            }
            if (in.available() > 0) {
                throw new PersistenceException("trailing bytes after " + count + " records");
            }
            return new SnapshotData(created, entries);
        } catch (EOFException e) {
            throw new PersistenceException("snapshot truncated", e);
        } catch (IOException e) {
            throw new PersistenceException("snapshot decode failed", e);
        }
    }

    // ----------------- helpers -----------------

    private static void writePayload(DataOutputStream out, Value v) throws IOException {
        if (v instanceof StringValue s) {
            writeBytes(out, s.bytes());
        } else if (v instanceof ListValue l) {
            writeAll(out, l.items());
        } else if (v instanceof SetValue s) {
            writeAll(out, s.members());
        } else if (v instanceof HashValue h) {
            Map<Bytes, Bytes> fields = h.fields();
            out.writeInt(fields.size());
            for (Map.Entry<Bytes, Bytes> f : fields.entrySet()) {
                writeBytes(out, f.getKey());
                writeBytes(out, f.getValue());
            }
        }
    }

    private static Value readPayload(DataInputStream in, ValueType type) throws IOException {
        switch (type) {
            case STRING:
                return new StringValue(readBytes(in));
            case LIST:
                return new ListValue(readAll(in), 0L);
            case SET:
                return new SetValue(readAll(in), 0L);
            case HASH: {
                int n = readCount(in);
                Map<Bytes, Bytes> fields = new LinkedHashMap<>();
                for (int i = 0; i < n; i++) {
                    Bytes field = readBytes(in);
                    fields.put(field, readBytes(in));
                }
                return new HashValue(fields, 0L);
            }
            default:
                throw new PersistenceException("unhandled value type " + type);
        }
    }

    private static void writeAll(DataOutputStream out, Collection<Bytes> items) throws IOException {
        out.writeInt(items.size());
        for (Bytes b : items) writeBytes(out, b);
    }

    private static List<Bytes> readAll(DataInputStream in) throws IOException {
        int n = readCount(in);
        List<Bytes> out = new ArrayList<>(Math.min(n, 1 << 16));
        for (int i = 0; i < n; i++) out.add(readBytes(in));
        return out;
    }

    private static void writeBytes(DataOutputStream out, Bytes b) throws IOException {
        out.writeInt(b.length());
        out.write(b.unsafeArray());
    }

    private static Bytes readBytes(DataInputStream in) throws IOException {
        int len = readCount(in);
        byte[] b = in.readNBytes(len);
        if (b.length != len) throw new EOFException();
        return Bytes.wrap(b);
    }

    private static int readCount(DataInputStream in) throws IOException {
        int n = in.readInt();
        if (n < 0) throw new PersistenceException("negative length " + n);
        return n;
    }

    private static int readIntAt(byte[] b, int off) {
        return ((b[off] & 0xFF) << 24) | ((b[off + 1] & 0xFF) << 16)
                | ((b[off + 2] & 0xFF) << 8) | (b[off + 3] & 0xFF);
    }
}
