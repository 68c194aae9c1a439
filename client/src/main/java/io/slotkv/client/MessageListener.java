package io.slotkv.client;

import io.slotkv.core.Bytes;

/** Callback for messages arriving on a subscription. Runs on the subscription's reader thread. */
@FunctionalInterface
public interface MessageListener {
    void onMessage(String channel, Bytes payload);
}
