package io.slotkv.server.command;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.storage.KeyValueStore;
import io.slotkv.storage.KeyValueStore.SetCondition;

import java.util.ArrayList;
import java.util.List;

import static io.slotkv.server.command.CommandSpec.Flag.WRITE;

/**
 * String commands. SET accepts {@code EX s | PX ms | PXAT ms} and {@code NX | XX};
 * relative expiries are rewritten to PXAT before execution.
 */
final class StringCommands {

    private final KeyValueStore store;

    StringCommands(KeyValueStore store) {
        this.store = store;
    }

    void registerAll(CommandTable table) {
        table.registerKeyed("GET", 2, (s, c) -> Reply.bulk(store.get(c.arg(0))));
        table.registerRewritten("SET", -3, this::set, StringCommands::absoluteSet, WRITE);
        table.registerKeyed("APPEND", 3, (s, c) -> Reply.integer(store.append(c.arg(0), c.arg(1))), WRITE);
        table.registerKeyed("STRLEN", 2, (s, c) -> Reply.integer(store.strlen(c.arg(0))));
        table.registerKeyed("INCR", 2, (s, c) -> Reply.integer(store.incrBy(c.arg(0), 1)), WRITE);
        table.registerKeyed("DECR", 2, (s, c) -> Reply.integer(store.incrBy(c.arg(0), -1)), WRITE);
        table.registerKeyed("INCRBY", 3, (s, c) -> Reply.integer(store.incrBy(c.arg(0), Args.parseLong(c.arg(1)))), WRITE);
        table.registerMultiKey("MGET", -2, (s, c) -> mget(c));
    }

    /** Parsed SET options. */
    private record SetOptions(SetCondition condition, String expireUnit, long expireValue) {}

    private static SetOptions parseOptions(Command c) {
        SetCondition condition = SetCondition.ALWAYS;
        String unit = null;
        long value = -1;
        for (int i = 2; i < c.argCount(); i++) {
            String opt = c.arg(i).utf8().toUpperCase();
            switch (opt) {
                case "NX", "XX" -> {
                    if (condition != SetCondition.ALWAYS) throw new CommandException(CommandException.SYNTAX);
                    condition = opt.equals("NX") ? SetCondition.IF_ABSENT : SetCondition.IF_PRESENT;
                }
                case "EX", "PX", "PXAT" -> {
                    if (unit != null || i + 1 >= c.argCount()) throw new CommandException(CommandException.SYNTAX);
                    unit = opt;
                    value = Args.parseExpire(c.arg(++i), "set");
                }
                default -> throw new CommandException(CommandException.SYNTAX);
            }
        }
        return new SetOptions(condition, unit, value);
    }

    private static Command absoluteSet(Command c, long now) {
        SetOptions o = parseOptions(c);
        if (o.expireUnit() == null || o.expireUnit().equals("PXAT")) return c;

        long at = Args.deadline(now, o.expireValue(), o.expireUnit().equals("EX") ? 1000L : 1L, "set");
        List<Bytes> args = new ArrayList<>();
        args.add(c.arg(0));
        args.add(c.arg(1));
        if (o.condition() == SetCondition.IF_ABSENT) args.add(Bytes.of("NX"));
        if (o.condition() == SetCondition.IF_PRESENT) args.add(Bytes.of("XX"));
        args.add(Bytes.of("PXAT"));
        args.add(Bytes.of(at));
        return new Command("SET", args);
    }

    private Reply set(Session session, Command c) {
        SetOptions o = parseOptions(c);
        long expireAt = o.expireUnit() == null ? -1L : o.expireValue();
        boolean written = store.set(c.arg(0), c.arg(1), o.condition(), expireAt);
        return written ? Reply.OK : Reply.NULL;
    }

    private Reply mget(Command c) {
        List<Reply> out = new ArrayList<>(c.argCount());
        for (Bytes v : store.mget(c.args())) {
            out.add(Reply.bulk(v));
        }
        return new Reply.Array(out);
    }
}
