package io.slotkv.server.dto;

import java.util.List;

public class JsonShard {
    public String shardId;
    public int startSlot;
    public int endSlot;
    /** First entry is the primary. */
    public List<JsonNode> nodes;
}
