package io.slotkv.core.resp;

import io.slotkv.core.Bytes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One RESP2 frame.
 * <p>
 * Used in both directions: replies written by the server and frames read by
 * clients (and, for arrays of bulk strings, incoming requests). Each variant
 * maps to exactly one wire prefix:
 * <pre>
 *   SimpleString  +OK\r\n
 *   Error         -ERR message\r\n
 *   Integer       :42\r\n
 *   BulkString    $5\r\nhello\r\n
 *   Null          $-1\r\n
 *   Array         *2\r\n...
 *   NullArray     *-1\r\n
 * </pre>
 */
public sealed interface Reply
        permits Reply.SimpleString, Reply.Error, Reply.Integer, Reply.BulkString,
                Reply.Array, Reply.Null, Reply.NullArray {

    Reply OK = new SimpleString("OK");
    Reply PONG = new SimpleString("PONG");
    Reply NULL = new Null();
    Reply NULL_ARRAY = new NullArray();
    Reply ZERO = new Integer(0);
    Reply ONE = new Integer(1);
    Reply EMPTY_ARRAY = new Array(List.of());

    record SimpleString(String value) implements Reply {
        public SimpleString {
            Objects.requireNonNull(value, "value");
            if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("simple string must not contain CR or LF");
            }
        }
    }

    /** Error reply; message starts with the error code, e.g. "ERR", "WRONGTYPE", "MOVED". */
    record Error(String message) implements Reply {
        public Error {
            Objects.requireNonNull(message, "message");
            message = message.replace('\r', ' ').replace('\n', ' ');
        }

        public String code() {
            int sp = message.indexOf(' ');
            return sp < 0 ? message : message.substring(0, sp);
        }
    }

    record Integer(long value) implements Reply {}

    record BulkString(Bytes value) implements Reply {
        public BulkString {
            Objects.requireNonNull(value, "value");
        }

        public String utf8() {
            return value.utf8();
        }
    }

    record Array(List<Reply> elements) implements Reply {
        public Array {
            elements = List.copyOf(elements);
        }
    }

    record Null() implements Reply {}

    record NullArray() implements Reply {}

    // ----------------- factories -----------------

    static Reply simple(String s) {
        return new SimpleString(s);
    }

    static Reply error(String message) {
        return new Error(message);
    }

    static Reply integer(long n) {
        return n == 0 ? ZERO : n == 1 ? ONE : new Integer(n);
    }

    static Reply bulk(Bytes b) {
        return b == null ? NULL : new BulkString(b);
    }

    static Reply bulk(String s) {
        return s == null ? NULL : new BulkString(Bytes.of(s));
    }

    static Reply array(Reply... elements) {
        return new Array(List.of(elements));
    }

    static Reply bulkArray(Collection<Bytes> items) {
        List<Reply> out = new ArrayList<>(items.size());
        for (Bytes b : items) {
            out.add(new BulkString(b));
        }
        return new Array(out);
    }
}
