package io.slotkv.server.command;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of one command.
 *
 * @param arity    positive: exact argument count including the name; negative: minimum
 * @param firstKey index of the first key in {@link Command#args()}, or -1 for keyless commands
 * @param lastKey  index of the last key; negative counts from the end (-1 = last argument)
 * @param keyStep  distance between keys
 */
public record CommandSpec(
        String name,
        int arity,
        Set<Flag> flags,
        int firstKey,
        int lastKey,
        int keyStep,
        CommandHandler handler,
        Rewriter rewriter
) {

    public enum Flag {
        /** Mutates the store; routed to the primary and replicated. */
        WRITE,
        /** Allowed before AUTH. */
        NO_AUTH,
        /** Allowed while the connection holds subscriptions. */
        PUBSUB_CONTEXT
    }

    /**
     * Turns a command into the form that is executed and replicated, for
     * example relative expiries into absolute ones.
     */
    @FunctionalInterface
    public interface Rewriter {
        Command rewrite(Command command, long nowMillis);
    }

    public CommandSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        flags = flags.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(flags);
    }

    public boolean has(Flag flag) {
        return flags.contains(flag);
    }

    public boolean keyed() {
        return firstKey >= 0;
    }

    public boolean arityMatches(Command command) {
        int n = command.argCount() + 1;
        return arity >= 0 ? n == arity : n >= -arity;
    }

    /** Key arguments of a command that already passed the arity check. */
    public List<Bytes> keys(Command command) {
        if (!keyed()) return List.of();
        int last = lastKey >= 0 ? lastKey : command.argCount() + lastKey;
        List<Bytes> keys = new ArrayList<>();
        for (int i = firstKey; i <= last; i += keyStep) {
            keys.add(command.arg(i));
        }
        return keys;
    }

    public Command rewrite(Command command, long nowMillis) {
        return rewriter == null ? command : rewriter.rewrite(command, nowMillis);
    }
}
