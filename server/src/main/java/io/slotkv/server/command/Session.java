package io.slotkv.server.command;

import io.slotkv.core.resp.Reply;
import io.slotkv.server.pubsub.Subscriber;

/**
 * Per-connection state the command layer reads and updates.
 */
public interface Session {

    /** Remote address, for logs. */
    String peer();

    boolean authenticated();

    void authenticate();

    /** True once the peer identified itself as this node's primary with REPLICATE. */
    boolean replicationLink();

    void markReplicationLink();

    /** The connection as a pub/sub endpoint. */
    Subscriber subscriber();

    /** Queue an extra reply ahead of the one the current command returns. */
    void send(Reply reply);

    /** Close after the current reply has been written. */
    void closeAfterReply();
}
