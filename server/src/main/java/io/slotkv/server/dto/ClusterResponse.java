package io.slotkv.server.dto;

import java.util.List;

/** GET /admin/cluster body: the static shard table as this node sees it. */
public class ClusterResponse {
    public String localNode;
    public String localShardId;
    public String role;
    public List<ShardView> shards;

    public static class ShardView {
        public String shardId;
        public int startSlot;
        public int endSlot;
        public String primary;
        public List<String> replicas;
    }
}
