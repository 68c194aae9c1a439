package io.slotkv.server.pubsub;

import io.slotkv.core.resp.Reply;

/**
 * Receiving end of a subscription, normally a client connection.
 */
public interface Subscriber {

    /** Identifier for logs. */
    String id();

    /**
     * Queue a push frame for delivery. Must not block.
     *
     * @return false when the frame was dropped because the outbound queue is full;
     *         the subscriber is expected to disconnect itself in that case
     */
    boolean push(Reply frame);
}
