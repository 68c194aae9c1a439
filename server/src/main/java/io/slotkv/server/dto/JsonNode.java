package io.slotkv.server.dto;

public class JsonNode {
    public String host;
    public int port;
}
