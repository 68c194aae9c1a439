package io.slotkv.core.resp;

import io.slotkv.core.Bytes;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Streaming RESP2 decoder.
 * <p>
 * Bytes are appended with {@link #feed} in whatever chunks the socket hands
 * out; {@link #next()} returns the next complete frame or null when more
 * input is needed. A frame split across any number of reads decodes to the
 * same value as the frame delivered in one piece.
 * <p>
 * Error policy:
 *  - Unknown type prefix at the top level: recoverable. The offending line
 *    is discarded and a non-fatal {@link ProtocolException} is thrown.
 *  - Anything else (bad length, missing CRLF after a bulk payload, limits
 *    exceeded, unknown prefix inside an array): fatal.
 * <p>
 * Not thread-safe; one decoder per connection.
 */
public final class RespDecoder {

    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    static final int MAX_LINE_LENGTH = 64 * 1024;
    static final int MAX_DEPTH = 32;

    private byte[] buf = new byte[4096];
    private int start; // first unread byte
    private int end;   // one past last buffered byte

    /** Append raw bytes from the wire. */
    public void feed(byte[] src, int off, int len) {
        if (len == 0) return;
        ensureCapacity(len);
        System.arraycopy(src, off, buf, end, len);
        end += len;
    }

    public void feed(byte[] src) {
        feed(src, 0, src.length);
    }

    /** Number of buffered bytes not yet consumed by a complete frame. */
    public int buffered() {
        return end - start;
    }

    /**
     * Decode the next complete frame.
     *
     * @return the frame, or null if the buffer holds only a partial frame
     * @throws ProtocolException on malformed input (see class doc for fatality)
     */
    public Reply next() {
        if (start == end) return null;

        byte prefix = buf[start];
        if (!isKnownPrefix(prefix)) {
            int cr = findCrlf(start);
            if (cr < 0) {
                if (end - start > MAX_LINE_LENGTH) {
                    throw new ProtocolException("too big inline request", true);
                }
                return null;
            }
            String junk = ascii(start, Math.min(cr, start + 32));
            start = cr + 2;
            compactIfEmpty();
            throw new ProtocolException("unexpected type prefix '" + junk + "'", false);
        }

        int[] pos = {start};
        Reply frame = parse(pos, 0);
        if (frame == null) return null;
        start = pos[0];
        compactIfEmpty();
        return frame;
    }

    // ----------------- parsing -----------------

    /** Returns null when incomplete. Advances pos[0] past the frame on success. */
    private Reply parse(int[] pos, int depth) {
        if (pos[0] >= end) return null;
        if (depth > MAX_DEPTH) throw new ProtocolException("nesting too deep", true);

        byte prefix = buf[pos[0]];
        int lineStart = pos[0] + 1;
        int cr = findCrlf(lineStart);
        if (cr < 0) {
            if (end - lineStart > MAX_LINE_LENGTH) {
                throw new ProtocolException("line too long", true);
            }
            return null;
        }
        int afterLine = cr + 2;

        switch (prefix) {
            case '+' -> {
                pos[0] = afterLine;
                return new Reply.SimpleString(ascii(lineStart, cr));
            }
            case '-' -> {
                pos[0] = afterLine;
                return new Reply.Error(utf8(lineStart, cr));
            }
            case ':' -> {
                long v = parseLong(lineStart, cr, "invalid integer");
                pos[0] = afterLine;
                return Reply.integer(v);
            }
            case '$' -> {
                long len = parseLong(lineStart, cr, "invalid bulk length");
                if (len == -1) {
                    pos[0] = afterLine;
                    return Reply.NULL;
                }
                if (len < 0 || len > MAX_BULK_LENGTH) {
                    throw new ProtocolException("invalid bulk length", true);
                }
                long need = afterLine + len + 2;
                if (need > end) return null;
                int payloadEnd = afterLine + (int) len;
                if (buf[payloadEnd] != '\r' || buf[payloadEnd + 1] != '\n') {
                    throw new ProtocolException("bulk string not terminated by CRLF", true);
                }
                pos[0] = payloadEnd + 2;
                return new Reply.BulkString(Bytes.wrap(Arrays.copyOfRange(buf, afterLine, payloadEnd)));
            }
            case '*' -> {
                long count = parseLong(lineStart, cr, "invalid multibulk length");
                if (count == -1) {
                    pos[0] = afterLine;
                    return Reply.NULL_ARRAY;
                }
                if (count < 0 || count > MAX_ARRAY_LENGTH) {
                    throw new ProtocolException("invalid multibulk length", true);
                }
                int[] cursor = {afterLine};
                List<Reply> items = new ArrayList<>((int) Math.min(count, 64));
                for (long i = 0; i < count; i++) {
                    if (cursor[0] < end && !isKnownPrefix(buf[cursor[0]])) {
                        throw new ProtocolException(
                                "expected '$', got '" + (char) (buf[cursor[0]] & 0xFF) + "'", true);
                    }
                    Reply item = parse(cursor, depth + 1);
                    if (item == null) return null;
                    items.add(item);
                }
                pos[0] = cursor[0];
                return new Reply.Array(items);
            }
            default -> throw new ProtocolException("unexpected type prefix", true);
        }
    }

    private long parseLong(int from, int to, String what) {
        if (from == to || to - from > 20) throw new ProtocolException(what, true);
        boolean negative = buf[from] == '-';
        int i = negative ? from + 1 : from;
        if (i == to) throw new ProtocolException(what, true);
        long v = 0;
        try {
            for (; i < to; i++) {
                byte b = buf[i];
                if (b < '0' || b > '9') throw new ProtocolException(what, true);
                v = Math.addExact(Math.multiplyExact(v, 10L), b - '0');
            }
        } catch (ArithmeticException e) {
            throw new ProtocolException(what, true);
        }
        return negative ? -v : v;
    }

    private int findCrlf(int from) {
        for (int i = from; i < end - 1; i++) {
            if (buf[i] == '\r' && buf[i + 1] == '\n') return i;
        }
        return -1;
    }

    private static boolean isKnownPrefix(byte b) {
        return b == '+' || b == '-' || b == ':' || b == '$' || b == '*';
    }

    private String ascii(int from, int to) {
        return new String(buf, from, to - from, StandardCharsets.US_ASCII);
    }

    private String utf8(int from, int to) {
        return new String(buf, from, to - from, StandardCharsets.UTF_8);
    }

    // ----------------- buffer management -----------------

    private void ensureCapacity(int extra) {
        if (end + extra <= buf.length) return;
        int live = end - start;
        if (live + extra <= buf.length && start > 0) {
            System.arraycopy(buf, start, buf, 0, live);
        } else {
            int cap = Math.max(buf.length * 2, live + extra);
            byte[] grown = new byte[cap];
            System.arraycopy(buf, start, grown, 0, live);
            buf = grown;
        }
        start = 0;
        end = live;
    }

    private void compactIfEmpty() {
        if (start == end) {
            start = 0;
            end = 0;
        }
    }
}
