package io.slotkv.server.dto;

/** GET /admin/stats body. */
public class StatsResponse {
    public String node;
    public String shardId;
    public String role;
    public long keys;
    public int connections;
    public int channels;
    public long lastSnapshotMillis;
    public String snapshotFile;
}
