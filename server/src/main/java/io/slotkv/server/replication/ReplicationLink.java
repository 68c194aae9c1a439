package io.slotkv.server.replication;

import io.slotkv.core.resp.Command;
import io.slotkv.server.cluster.ClusterConfig;
import io.slotkv.server.cluster.NodeAddress;
import io.slotkv.server.cluster.ShardDescriptor;
import io.slotkv.storage.KeyValueStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Primary-side fan-out of applied writes.
 * <p>
 * A primary owns one {@link ReplicaClient} per replica of its shard; a replica
 * owns none. {@link #propagate} must be called while the store lock is held
 * so that queue order equals apply order.
 * <p>
 * Expiry belongs to the primary: its store reports every lazily expired key,
 * which goes out as an explicit {@code DEL} ahead of whatever noticed it. A
 * replica's store runs in replica mode and never drops keys on its own clock.
 */
public final class ReplicationLink {
    private static final Logger log = Logger.getLogger(ReplicationLink.class.getName());

    private final List<ReplicaClient> clients;

    public ReplicationLink(ClusterConfig cluster, KeyValueStore store) {
        this(cluster, store, Duration.ofSeconds(5));
    }

    public ReplicationLink(ClusterConfig cluster, KeyValueStore store, Duration timeout) {
        List<ReplicaClient> list = new ArrayList<>();
        ShardDescriptor shard = cluster.localShard();
        String secret = cluster.settings().replicationSecret();
        if (cluster.localIsPrimary()) {
            store.expiryListener(key -> propagate(Command.ofBytes("DEL", key)));
            if (secret == null && !shard.replicas().isEmpty()) {
                log.warning("shard " + shard.shardId() + " lists replicas but no replicationSecret is set;"
                        + " writes will not be replicated");
            } else {
                for (NodeAddress replica : shard.replicas()) {
                    list.add(new ReplicaClient(replica, shard.shardId(), cluster.settings().requirePass(),
                            secret, store, timeout));
                }
            }
        } else {
            store.replicaMode(true);
        }
        this.clients = List.copyOf(list);
        if (!clients.isEmpty()) {
            log.info("replicating " + shard.shardId() + " to " + clients.size() + " replica(s)");
        }
    }

    public void propagate(Command command) {
        for (ReplicaClient c : clients) {
            c.enqueue(command);
        }
    }

    public List<ReplicaClient> clients() {
        return clients;
    }

    public void stop() {
        for (ReplicaClient c : clients) {
            c.stop();
        }
    }
}
