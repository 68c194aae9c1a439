package io.slotkv.server.dto;

import java.util.List;

/** Jackson binding for the cluster JSON file. Missing fields keep these defaults. */
public class JsonConfig {
    public int slotCount = 16384;
    public String snapshotDir = "./data/snap";
    public long snapshotIntervalSeconds = 60;
    public long idleTimeoutSeconds = 300;
    public int adminPortOffset = 1000;
    public String requirePass;
    public boolean notifyKeyspaceEvents = true;
    public String replicationSecret;
    public List<JsonShard> shards;
}
