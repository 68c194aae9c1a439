package io.slotkv.core.resp;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Byte-exact RESP2 encoder.
 * <p>
 * Output must match what stock RESP clients expect, so every frame is
 * written with its fixed prefix byte and CRLF terminators, nothing else.
 */
public final class RespEncoder {

    private static final byte[] CRLF = {'\r', '\n'};

    private RespEncoder() {
        // utility
    }

    public static byte[] encode(Reply reply) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        write(reply, out);
        return out.toByteArray();
    }

    public static void write(Reply reply, ByteArrayOutputStream out) {
        if (reply instanceof Reply.SimpleString s) {
            out.write('+');
            writeAscii(s.value(), out);
            out.writeBytes(CRLF);
        } else if (reply instanceof Reply.Error e) {
            out.write('-');
            out.writeBytes(e.message().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (reply instanceof Reply.Integer i) {
            out.write(':');
            writeAscii(Long.toString(i.value()), out);
            out.writeBytes(CRLF);
        } else if (reply instanceof Reply.BulkString b) {
            byte[] data = b.value().unsafeArray();
            out.write('$');
            writeAscii(String.valueOf(data.length), out);
            out.writeBytes(CRLF);
            out.writeBytes(data);
            out.writeBytes(CRLF);
        } else if (reply instanceof Reply.Array a) {
            out.write('*');
            writeAscii(String.valueOf(a.elements().size()), out);
            out.writeBytes(CRLF);
            for (Reply r : a.elements()) {
                write(r, out);
            }
        } else if (reply instanceof Reply.Null) {
            writeAscii("$-1", out);
            out.writeBytes(CRLF);
        } else if (reply instanceof Reply.NullArray) {
            writeAscii("*-1", out);
            out.writeBytes(CRLF);
        } else {
            throw new IllegalArgumentException("unknown reply type: " + reply);
        }
    }

    private static void writeAscii(String s, ByteArrayOutputStream out) {
        out.writeBytes(s.getBytes(StandardCharsets.US_ASCII));
    }
}
