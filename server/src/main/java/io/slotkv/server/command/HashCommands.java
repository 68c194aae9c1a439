package io.slotkv.server.command;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.storage.KeyValueStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.slotkv.server.command.CommandSpec.Flag.WRITE;

final class HashCommands {

    private final KeyValueStore store;

    HashCommands(KeyValueStore store) {
        this.store = store;
    }

    void registerAll(CommandTable table) {
        table.registerKeyed("HSET", -4, this::hset, WRITE);
        table.registerKeyed("HGET", 3, (s, c) -> Reply.bulk(store.hget(c.arg(0), c.arg(1))));
        table.registerKeyed("HDEL", -3, (s, c) -> Reply.integer(
                store.hdel(c.arg(0), c.args().subList(1, c.argCount()))), WRITE);
        table.registerKeyed("HGETALL", 2, (s, c) -> hgetall(c));
        table.registerKeyed("HLEN", 2, (s, c) -> Reply.integer(store.hlen(c.arg(0))));
        table.registerKeyed("HEXISTS", 3, (s, c) -> Reply.integer(store.hexists(c.arg(0), c.arg(1)) ? 1 : 0));
        table.registerKeyed("HKEYS", 2, (s, c) -> Reply.bulkArray(store.hgetall(c.arg(0)).keySet()));
    }

    private Reply hset(Session session, Command c) {
        if ((c.argCount() - 1) % 2 != 0) throw CommandException.wrongArity(c.name());
        Map<Bytes, Bytes> fields = new LinkedHashMap<>();
        for (int i = 1; i < c.argCount(); i += 2) {
            fields.put(c.arg(i), c.arg(i + 1));
        }
        return Reply.integer(store.hset(c.arg(0), fields));
    }

    private Reply hgetall(Command c) {
        Map<Bytes, Bytes> fields = store.hgetall(c.arg(0));
        List<Reply> out = new ArrayList<>(fields.size() * 2);
        for (Map.Entry<Bytes, Bytes> e : fields.entrySet()) {
            out.add(new Reply.BulkString(e.getKey()));
            out.add(new Reply.BulkString(e.getValue()));
        }
        return new Reply.Array(out);
    }
}
