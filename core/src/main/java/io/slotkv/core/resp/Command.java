package io.slotkv.core.resp;

import io.slotkv.core.Bytes;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A parsed request: upper-cased command name plus ordered arguments.
 * <p>
 * Immutable. Built once per request by the codec, consumed once by the
 * dispatcher, and re-encoded verbatim when forwarded to replicas.
 */
public final class Command {

    private final String name;
    private final List<Bytes> args;

    public Command(String name, List<Bytes> args) {
        this.name = Objects.requireNonNull(name, "name").toUpperCase(Locale.ROOT);
        this.args = List.copyOf(args);
    }

    public static Command of(String name, String... args) {
        List<Bytes> list = new ArrayList<>(args.length);
        for (String a : args) {
            list.add(Bytes.of(a));
        }
        return new Command(name, list);
    }

    public static Command ofBytes(String name, Bytes... args) {
        return new Command(name, List.of(args));
    }

    /**
     * Interpret a decoded frame as a request.
     *
     * @return the command, or null for frames that carry no request (empty or null arrays)
     * @throws ProtocolException (non-fatal) when the frame is not an array of bulk strings
     */
    public static Command fromFrame(Reply frame) {
        if (frame instanceof Reply.NullArray) return null;
        if (!(frame instanceof Reply.Array array)) {
            throw new ProtocolException("expected '*', request must be an array of bulk strings", false);
        }
        List<Reply> elements = array.elements();
        if (elements.isEmpty()) return null;

        List<Bytes> parts = new ArrayList<>(elements.size());
        for (Reply e : elements) {
            if (!(e instanceof Reply.BulkString b)) {
                throw new ProtocolException("request must be an array of bulk strings", false);
            }
            parts.add(b.value());
        }
        String name = parts.get(0).utf8();
        return new Command(name, parts.subList(1, parts.size()));
    }

    public String name() {
        return name;
    }

    public List<Bytes> args() {
        return args;
    }

    public int argCount() {
        return args.size();
    }

    public Bytes arg(int i) {
        return args.get(i);
    }

    /** Frame form: array of bulk strings, name first. */
    public Reply toFrame() {
        List<Reply> out = new ArrayList<>(args.size() + 1);
        out.add(Reply.bulk(name));
        for (Bytes a : args) {
            out.add(new Reply.BulkString(a));
        }
        return new Reply.Array(out);
    }

    public byte[] encode() {
        return RespEncoder.encode(toFrame());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Command other)) return false;
        return name.equals(other.name) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        for (Bytes a : args) {
            sb.append(' ');
            String s = a.utf8();
            sb.append(s.length() > 64 ? s.substring(0, 64) + "..." : s);
        }
        return sb.toString();
    }
}
