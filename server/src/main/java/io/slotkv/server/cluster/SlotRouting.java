package io.slotkv.server.cluster;

import io.slotkv.core.Bytes;
import io.slotkv.core.HashSlots;
import io.slotkv.core.resp.Reply;

import java.util.List;

/**
 * Decides whether a keyed command runs on this node.
 * <p>
 * Rules:
 *  - all keys must hash to one slot, otherwise CROSSSLOT;
 *  - a slot of the local shard runs here when the node is the primary,
 *    when the command is a read, or when it arrives on a replication link;
 *  - a write on a replica is redirected to the shard primary;
 *  - a slot of another shard is redirected to that shard's primary.
 */
public final class SlotRouting {

    /** Outcome of a routing decision; {@code redirect} is null when the command runs locally. */
    public record Route(int slot, ShardDescriptor shard, Reply.Error redirect) {
        public boolean local() {
            return redirect == null;
        }
    }

    private final ClusterConfig cluster;

    public SlotRouting(ClusterConfig cluster) {
        this.cluster = cluster;
    }

    public Route route(List<Bytes> keys, boolean write, boolean replicationLink) {
        int slot = HashSlots.slotFor(keys.get(0));
        for (int i = 1; i < keys.size(); i++) {
            if (HashSlots.slotFor(keys.get(i)) != slot) {
                return new Route(slot, null, crossSlot());
            }
        }
        ShardDescriptor owner = cluster.shardForSlot(slot);
        if (owner != cluster.localShard()) {
            return new Route(slot, owner, moved(slot, owner.primary()));
        }
        if (write && !cluster.localIsPrimary() && !replicationLink) {
            return new Route(slot, owner, moved(slot, owner.primary()));
        }
        return new Route(slot, owner, null);
    }

    public static Reply.Error moved(int slot, NodeAddress target) {
        return new Reply.Error("MOVED " + slot + " " + target);
    }

    public static Reply.Error crossSlot() {
        return new Reply.Error("CROSSSLOT Keys in request don't hash to the same slot");
    }
}
