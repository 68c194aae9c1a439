package io.slotkv.server.command;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.storage.KeyValueStore;
import io.slotkv.storage.ScanPage;

import java.util.Locale;

import static io.slotkv.server.command.CommandSpec.Flag.WRITE;

final class SetCommands {

    private static final int DEFAULT_SCAN_COUNT = 10;

    private final KeyValueStore store;

    SetCommands(KeyValueStore store) {
        this.store = store;
    }

    void registerAll(CommandTable table) {
        table.registerKeyed("SADD", -3, (s, c) -> Reply.integer(
                store.sadd(c.arg(0), c.args().subList(1, c.argCount()))), WRITE);
        table.registerKeyed("SREM", -3, (s, c) -> Reply.integer(
                store.srem(c.arg(0), c.args().subList(1, c.argCount()))), WRITE);
        table.registerKeyed("SMEMBERS", 2, (s, c) -> Reply.bulkArray(store.smembers(c.arg(0))));
        table.registerKeyed("SCARD", 2, (s, c) -> Reply.integer(store.scard(c.arg(0))));
        table.registerKeyed("SISMEMBER", 3, (s, c) -> Reply.integer(store.sismember(c.arg(0), c.arg(1)) ? 1 : 0));
        table.registerKeyed("SSCAN", -3, (s, c) -> sscan(c));
    }

    /** SSCAN key cursor [MATCH pattern] [COUNT count] */
    private Reply sscan(Command c) {
        long cursor;
        try {
            cursor = Long.parseLong(c.arg(1).utf8());
        } catch (NumberFormatException e) {
            throw new CommandException("invalid cursor");
        }
        if (cursor < 0) throw new CommandException("invalid cursor");

        Bytes pattern = null;
        int count = DEFAULT_SCAN_COUNT;
        for (int i = 2; i < c.argCount(); i += 2) {
            if (i + 1 >= c.argCount()) throw new CommandException(CommandException.SYNTAX);
            String option = c.arg(i).utf8().toUpperCase(Locale.ROOT);
            switch (option) {
                case "MATCH" -> pattern = c.arg(i + 1);
                case "COUNT" -> {
                    long n = Args.parseLong(c.arg(i + 1));
                    if (n < 1) throw new CommandException(CommandException.SYNTAX);
                    count = (int) Math.min(n, Integer.MAX_VALUE);
                }
                default -> throw new CommandException(CommandException.SYNTAX);
            }
        }

        ScanPage page = store.sscan(c.arg(0), cursor, pattern, count);
        return Reply.array(Reply.bulk(Long.toString(page.cursor())), Reply.bulkArray(page.items()));
    }
}
