// file: server/src/main/java/io/slotkv/server/admin/AdminServer.java
package io.slotkv.server.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.slotkv.server.RequestLogger;
import io.slotkv.server.cluster.ClusterConfig;
import io.slotkv.server.cluster.NodeAddress;
import io.slotkv.server.cluster.ShardDescriptor;
import io.slotkv.server.dto.ClusterResponse;
import io.slotkv.server.dto.StatsResponse;
import io.slotkv.server.net.RespServer;
import io.slotkv.server.pubsub.PubSubRegistry;
import io.slotkv.storage.KeyValueStore;
import io.slotkv.storage.PersistenceException;
import io.slotkv.storage.PersistenceManager;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Map;

/**
 * Operator HTTP surface on {@code port + adminPortOffset}.
 *
 * Responsibilities:
 *  - Report health, topology and node statistics as JSON.
 *  - Trigger an on-demand snapshot.
 *  - Emit basic per-request logging.
 *
 * Path layout:
 *   - GET  /admin/health     {"status":"ok","port":..,"role":..}
 *   - GET  /admin/cluster    shard table with the local node's role
 *   - GET  /admin/stats      keys, connections, channels, last snapshot
 *   - POST /admin/snapshot   forces a snapshot, returns its file name
 */
public final class AdminServer {

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ClusterConfig cluster;
    private final KeyValueStore store;
    private final PubSubRegistry pubsub;
    private final PersistenceManager persistence;
    private final RespServer resp;

    public AdminServer(
            int port,
            ClusterConfig cluster,
            KeyValueStore store,
            PubSubRegistry pubsub,
            PersistenceManager persistence,
            RespServer resp
    ) {
        this.cluster = cluster;
        this.store = store;
        this.pubsub = pubsub;
        this.persistence = persistence;
        this.resp = resp;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        if (ex.isInIoThread()) {
            // snapshot and stats touch the store lock; keep them off the IO threads
            ex.dispatch(this::route);
            return;
        }
        long start = System.nanoTime();
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        int status;
        Throwable error = null;
        try {
            status = switch (path) {
                case "/admin/health" -> onlyGet(ex, method, () -> Map.of(
                        "status", "ok",
                        "port", cluster.localNode().port(),
                        "role", role()));
                case "/admin/cluster" -> onlyGet(ex, method, this::clusterView);
                case "/admin/stats" -> onlyGet(ex, method, this::stats);
                case "/admin/snapshot" -> snapshot(ex, method);
                default -> send(ex, 404, Map.of("error", "not found"));
            };
        } catch (RuntimeException e) {
            error = e;
            status = send(ex, 500, Map.of("error", e.getClass().getSimpleName(),
                    "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, path, status, totalMs, error);
    }

    @FunctionalInterface
    private interface Body {
        Object get();
    }

    private int onlyGet(HttpServerExchange ex, String method, Body body) {
        if (!"GET".equals(method)) {
            return send(ex, 405, Map.of("error", "method not allowed"));
        }
        return send(ex, 200, body.get());
    }

    private int snapshot(HttpServerExchange ex, String method) {
        if (!"POST".equals(method)) {
            return send(ex, 405, Map.of("error", "method not allowed"));
        }
        try {
            String file = persistence.snapshotNow();
            return send(ex, 200, Map.of("ok", true, "file", file));
        } catch (PersistenceException e) {
            return send(ex, 500, Map.of("ok", false, "error", String.valueOf(e.getMessage())));
        }
    }

    // ---------- bodies ----------

    private String role() {
        return cluster.localIsPrimary() ? "primary" : "replica";
    }

    private ClusterResponse clusterView() {
        var dto = new ClusterResponse();
        dto.localNode = cluster.localNode().toString();
        dto.localShardId = cluster.localShard().shardId();
        dto.role = role();
        dto.shards = new ArrayList<>();
        for (ShardDescriptor s : cluster.shards()) {
            var view = new ClusterResponse.ShardView();
            view.shardId = s.shardId();
            view.startSlot = s.range().startSlot();
            view.endSlot = s.range().endSlot();
            view.primary = s.primary().toString();
            view.replicas = s.replicas().stream().map(NodeAddress::toString).toList();
            dto.shards.add(view);
        }
        return dto;
    }

    private StatsResponse stats() {
        var dto = new StatsResponse();
        dto.node = cluster.localNode().toString();
        dto.shardId = cluster.localShard().shardId();
        dto.role = role();
        dto.keys = store.size();
        dto.connections = resp.connectionCount();
        dto.channels = pubsub.channelCount();
        dto.lastSnapshotMillis = persistence.lastSnapshotMillis();
        dto.snapshotFile = persistence.snapshotName();
        return dto;
    }

    // ---------- helpers ----------

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private int send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
            return code;
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
            return 500;
        }
    }
}
