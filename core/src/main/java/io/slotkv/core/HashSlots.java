package io.slotkv.core;

/**
 * Key to slot mapping shared by every node and by routing clients.
 * <p>
 * Properties:
 *  - Pure: slotFor(key) depends only on the key bytes.
 *  - CRC16/XMODEM (poly 0x1021, init 0), reduced modulo {@link #SLOT_COUNT}.
 *  - Hash tags: if the key contains "{...}" with a non-empty body, only the
 *    body is hashed, so related keys ("{doc:1}:meta", "{doc:1}:lines") can
 *    be forced into the same slot.
 */
public final class HashSlots {

    public static final int SLOT_COUNT = 16384;

    private static final int[] TABLE = new int[256];

    static {
        for (int i = 0; i < 256; i++) {
            int crc = i << 8;
            for (int b = 0; b < 8; b++) {
                crc = (crc & 0x8000) != 0 ? (crc << 1) ^ 0x1021 : crc << 1;
            }
            TABLE[i] = crc & 0xFFFF;
        }
    }

    private HashSlots() {
        // utility
    }

    public static int slotFor(Bytes key) {
        return slotFor(key.unsafeArray());
    }

    public static int slotFor(String key) {
        return slotFor(Bytes.of(key));
    }

    public static int slotFor(byte[] key) {
        int start = 0;
        int end = key.length;

        int open = indexOf(key, (byte) '{', 0);
        if (open >= 0) {
            int close = indexOf(key, (byte) '}', open + 1);
            if (close > open + 1) {
                start = open + 1;
                end = close;
            }
        }
        return crc16(key, start, end) % SLOT_COUNT;
    }

    public static int crc16(byte[] data, int from, int to) {
        int crc = 0;
        for (int i = from; i < to; i++) {
            crc = ((crc << 8) ^ TABLE[((crc >>> 8) ^ (data[i] & 0xFF)) & 0xFF]) & 0xFFFF;
        }
        return crc;
    }

    private static int indexOf(byte[] data, byte b, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == b) return i;
        }
        return -1;
    }
}
