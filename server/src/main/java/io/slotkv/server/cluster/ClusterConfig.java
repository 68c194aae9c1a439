// file: server/src/main/java/io/slotkv/server/cluster/ClusterConfig.java
package io.slotkv.server.cluster;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.slotkv.core.HashSlots;
import io.slotkv.core.SlotRange;
import io.slotkv.server.dto.JsonConfig;
import io.slotkv.server.dto.JsonNode;
import io.slotkv.server.dto.JsonShard;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static cluster topology plus the settings of the local node.
 * <p>
 * Invariants checked at construction:
 *  - shard slot ranges are disjoint and together cover 0..16383,
 *  - every shard has at least one node and a node belongs to at most one shard,
 *  - the local node is part of the topology.
 * <p>
 * Immutable; built once at startup and shared by every component.
 */
public final class ClusterConfig {

    /** Node-level knobs that sit next to the topology in the JSON file. */
    public record Settings(
            Path snapshotDir,
            Duration snapshotInterval,
            Duration idleTimeout,
            int adminPortOffset,
            String requirePass,
            boolean notifyKeyspaceEvents,
            String replicationSecret
    ) {
        public Settings {
            Objects.requireNonNull(snapshotDir, "snapshotDir");
            Objects.requireNonNull(snapshotInterval, "snapshotInterval");
            Objects.requireNonNull(idleTimeout, "idleTimeout");
            if (snapshotInterval.isNegative()) throw new IllegalArgumentException("snapshotIntervalSeconds must be >= 0");
            if (idleTimeout.isNegative()) throw new IllegalArgumentException("idleTimeoutSeconds must be >= 0");
            if (adminPortOffset < 0) throw new IllegalArgumentException("adminPortOffset must be >= 0");
            if (requirePass != null && requirePass.isEmpty()) requirePass = null;
            if (replicationSecret != null && replicationSecret.isEmpty()) replicationSecret = null;
        }

        public static Settings defaults(Path snapshotDir) {
            return new Settings(snapshotDir, Duration.ofSeconds(60), Duration.ofSeconds(300), 1000, null, true, null);
        }

        public Settings withAdminPortOffset(int offset) {
            return new Settings(snapshotDir, snapshotInterval, idleTimeout, offset, requirePass, notifyKeyspaceEvents, replicationSecret);
        }

        public Settings withRequirePass(String password) {
            return new Settings(snapshotDir, snapshotInterval, idleTimeout, adminPortOffset, password, notifyKeyspaceEvents, replicationSecret);
        }

        public Settings withIdleTimeout(Duration timeout) {
            return new Settings(snapshotDir, snapshotInterval, timeout, adminPortOffset, requirePass, notifyKeyspaceEvents, replicationSecret);
        }

        public Settings withSnapshotInterval(Duration interval) {
            return new Settings(snapshotDir, interval, idleTimeout, adminPortOffset, requirePass, notifyKeyspaceEvents, replicationSecret);
        }

        public Settings withNotifyKeyspaceEvents(boolean on) {
            return new Settings(snapshotDir, snapshotInterval, idleTimeout, adminPortOffset, requirePass, on, replicationSecret);
        }

        public Settings withReplicationSecret(String secret) {
            return new Settings(snapshotDir, snapshotInterval, idleTimeout, adminPortOffset, requirePass, notifyKeyspaceEvents, secret);
        }
    }

    private final List<ShardDescriptor> shards;
    private final ShardDescriptor[] bySlot = new ShardDescriptor[HashSlots.SLOT_COUNT];
    private final NodeAddress localNode;
    private final ShardDescriptor localShard;
    private final Settings settings;

    public ClusterConfig(List<ShardDescriptor> shards, NodeAddress localNode, Settings settings) {
        if (shards == null || shards.isEmpty()) throw new IllegalArgumentException("shards must not be empty");
        this.localNode = Objects.requireNonNull(localNode, "localNode");
        this.settings = Objects.requireNonNull(settings, "settings");

        List<ShardDescriptor> sorted = new ArrayList<>(shards);
        sorted.sort(Comparator.comparing(ShardDescriptor::range));
        this.shards = List.copyOf(sorted);

        validateCoverage(this.shards);
        validateMembership(this.shards);

        for (ShardDescriptor s : this.shards) {
            for (int slot = s.range().startSlot(); slot <= s.range().endSlot(); slot++) {
                bySlot[slot] = s;
            }
        }
        this.localShard = this.shards.stream()
                .filter(s -> s.contains(localNode))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "local node %s is not part of any shard".formatted(localNode)));
    }

    /**
     * Load the topology and settings, then pick the local node by client port
     * (and host, when several nodes share the port).
     */
    public static ClusterConfig fromJsonFile(Path path, int localPort, String localHost) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        JsonConfig cfg;
        try {
            cfg = mapper.readValue(path.toFile(), JsonConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load ClusterConfig from " + path + ": " + e.getMessage(), e);
        }
        return fromJson(cfg, localPort, localHost);
    }

    static ClusterConfig fromJson(JsonConfig cfg, int localPort, String localHost) {
        if (cfg.slotCount != HashSlots.SLOT_COUNT) {
            throw new IllegalArgumentException("slotCount must be " + HashSlots.SLOT_COUNT + ", got " + cfg.slotCount);
        }
        if (cfg.shards == null || cfg.shards.isEmpty()) {
            throw new IllegalArgumentException("shards must not be empty");
        }
        if (cfg.snapshotDir == null || cfg.snapshotDir.isBlank()) {
            throw new IllegalArgumentException("snapshotDir must not be blank");
        }

        List<ShardDescriptor> shards = new ArrayList<>();
        for (JsonShard js : cfg.shards) {
            if (js.nodes == null) throw new IllegalArgumentException("shard " + js.shardId + " has no nodes");
            List<NodeAddress> nodes = new ArrayList<>();
            for (JsonNode jn : js.nodes) {
                nodes.add(new NodeAddress(jn.host, jn.port));
            }
            shards.add(new ShardDescriptor(
                    js.shardId,
                    new SlotRange(js.startSlot, js.endSlot),
                    nodes
            ));
        }

        var settings = new Settings(
                Path.of(cfg.snapshotDir),
                Duration.ofSeconds(cfg.snapshotIntervalSeconds),
                Duration.ofSeconds(cfg.idleTimeoutSeconds),
                cfg.adminPortOffset,
                cfg.requirePass,
                cfg.notifyKeyspaceEvents,
                cfg.replicationSecret
        );
        return new ClusterConfig(shards, resolveLocal(shards, localPort, localHost), settings);
    }

    private static NodeAddress resolveLocal(List<ShardDescriptor> shards, int port, String host) {
        List<NodeAddress> matches = new ArrayList<>();
        for (ShardDescriptor s : shards) {
            for (NodeAddress n : s.nodes()) {
                if (n.port() == port && (host == null || n.host().equals(host))) matches.add(n);
            }
        }
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("no node with port " + port
                    + (host == null ? "" : " and host " + host) + " in cluster config");
        }
        if (matches.size() > 1) {
            throw new IllegalArgumentException("port " + port + " matches " + matches + "; pass --host");
        }
        return matches.get(0);
    }

    private static void validateCoverage(List<ShardDescriptor> sorted) {
        int expectedStart = 0;
        for (ShardDescriptor s : sorted) {
            SlotRange r = s.range();
            if (r.startSlot() < expectedStart) {
                throw new IllegalArgumentException("shard " + s.shardId() + " " + r + " overlaps a previous shard");
            }
            if (r.startSlot() > expectedStart) {
                throw new IllegalArgumentException("slots " + expectedStart + "-" + (r.startSlot() - 1) + " are not assigned");
            }
            expectedStart = r.endSlot() + 1;
        }
        if (expectedStart != HashSlots.SLOT_COUNT) {
            throw new IllegalArgumentException("slots " + expectedStart + "-" + (HashSlots.SLOT_COUNT - 1) + " are not assigned");
        }
    }

    private static void validateMembership(List<ShardDescriptor> shards) {
        Set<String> ids = new HashSet<>();
        Set<NodeAddress> seen = new HashSet<>();
        for (ShardDescriptor s : shards) {
            if (!ids.add(s.shardId())) {
                throw new IllegalArgumentException("duplicate shardId " + s.shardId());
            }
            for (NodeAddress n : s.nodes()) {
                if (!seen.add(n)) {
                    throw new IllegalArgumentException("node " + n + " appears more than once");
                }
            }
        }
    }

    public List<ShardDescriptor> shards() {
        return shards;
    }

    public ShardDescriptor shardForSlot(int slot) {
        return bySlot[slot];
    }

    public ShardDescriptor shardById(String shardId) {
        for (ShardDescriptor s : shards) {
            if (s.shardId().equals(shardId)) return s;
        }
        return null;
    }

    public NodeAddress localNode() {
        return localNode;
    }

    public ShardDescriptor localShard() {
        return localShard;
    }

    public boolean localIsPrimary() {
        return localShard.primary().equals(localNode);
    }

    public Settings settings() {
        return settings;
    }
}
