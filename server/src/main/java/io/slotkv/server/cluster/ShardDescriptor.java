// file: server/src/main/java/io/slotkv/server/cluster/ShardDescriptor.java
package io.slotkv.server.cluster;

import io.slotkv.core.SlotRange;

import java.util.List;
import java.util.Objects;

/**
 * One shard of the static topology.
 *
 * A shard is:
 *  - shardId: stable identifier used in logs and by REPLICATE.
 *  - range:   inclusive slot range it serves.
 *  - nodes:   primary first, then replicas.
 */
public final class ShardDescriptor {

    private final String shardId;
    private final SlotRange range;
    private final List<NodeAddress> nodes;

    public ShardDescriptor(String shardId, SlotRange range, List<NodeAddress> nodes) {
        this.shardId = Objects.requireNonNull(shardId, "shardId");
        this.range = Objects.requireNonNull(range, "range");
        Objects.requireNonNull(nodes, "nodes");
        if (shardId.isBlank()) throw new IllegalArgumentException("shardId must not be blank");
        if (nodes.isEmpty()) throw new IllegalArgumentException("shard " + shardId + " has no nodes");
        this.nodes = List.copyOf(nodes);
    }

    public String shardId() {
        return shardId;
    }

    public SlotRange range() {
        return range;
    }

    public List<NodeAddress> nodes() {
        return nodes;
    }

    public NodeAddress primary() {
        return nodes.get(0);
    }

    public List<NodeAddress> replicas() {
        return nodes.subList(1, nodes.size());
    }

    public boolean contains(NodeAddress node) {
        return nodes.contains(node);
    }

    @Override
    public String toString() {
        return "Shard[" + shardId + "@" + primary() + " " + range + "]";
    }
}
