package io.slotkv.server.replication;

/** Forwarding a write to a replica failed. Logged by the link, never surfaced to clients. */
public class ReplicationException extends RuntimeException {

    public ReplicationException(String message) {
        super(message);
    }

    public ReplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
