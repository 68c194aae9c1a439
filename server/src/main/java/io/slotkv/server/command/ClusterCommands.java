package io.slotkv.server.command;

import io.slotkv.core.HashSlots;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.server.cluster.ClusterConfig;
import io.slotkv.server.cluster.NodeAddress;
import io.slotkv.server.cluster.ShardDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * CLUSTER KEYSLOT | SLOTS | MYID: read-only view of the static slot table
 * for routing clients.
 */
final class ClusterCommands {

    private final ClusterConfig cluster;

    ClusterCommands(ClusterConfig cluster) {
        this.cluster = cluster;
    }

    void registerAll(CommandTable table) {
        table.register("CLUSTER", -2, this::cluster);
    }

    private Reply cluster(Session session, Command c) {
        String sub = c.arg(0).utf8().toUpperCase();
        switch (sub) {
            case "KEYSLOT":
                if (c.argCount() != 2) throw CommandException.wrongArity("cluster|keyslot");
                return Reply.integer(HashSlots.slotFor(c.arg(1)));
            case "SLOTS":
                if (c.argCount() != 1) throw CommandException.wrongArity("cluster|slots");
                return slots();
            case "MYID":
                if (c.argCount() != 1) throw CommandException.wrongArity("cluster|myid");
                return Reply.bulk(cluster.localNode().toString());
            default:
                throw new CommandException("unknown subcommand '" + c.arg(0).utf8() + "'. Try CLUSTER KEYSLOT, SLOTS or MYID.");
        }
    }

    private Reply slots() {
        List<Reply> out = new ArrayList<>();
        for (ShardDescriptor s : cluster.shards()) {
            List<Reply> entry = new ArrayList<>();
            entry.add(Reply.integer(s.range().startSlot()));
            entry.add(Reply.integer(s.range().endSlot()));
            for (NodeAddress n : s.nodes()) {
                entry.add(Reply.array(Reply.bulk(n.host()), Reply.integer(n.port())));
            }
            out.add(new Reply.Array(entry));
        }
        return new Reply.Array(out);
    }
}
