package io.slotkv.server.pubsub;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Reply;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Node-local channel membership and fan-out.
 * <p>
 * Responsibilities:
 *  - Track channel -> subscribers and subscriber -> channels.
 *  - Deliver PUBLISH payloads as {@code ["message", channel, payload]} pushes.
 * <p>
 * Delivery only enqueues onto each subscriber's outbound queue, so a publisher
 * never waits on a slow subscriber. Publishes are serialized on this registry,
 * which keeps every subscriber's view of a channel in publish order.
 */
public final class PubSubRegistry {
    private static final Logger log = Logger.getLogger(PubSubRegistry.class.getName());

    private static final Bytes MESSAGE = Bytes.of("message");

    private final Map<Bytes, Set<Subscriber>> byChannel = new HashMap<>();
    private final Map<Subscriber, Set<Bytes>> bySubscriber = new HashMap<>();

    /** @return number of channels the subscriber is now subscribed to */
    public synchronized int subscribe(Subscriber subscriber, Bytes channel) {
        byChannel.computeIfAbsent(channel, c -> new LinkedHashSet<>()).add(subscriber);
        Set<Bytes> mine = bySubscriber.computeIfAbsent(subscriber, s -> new LinkedHashSet<>());
        mine.add(channel);
        return mine.size();
    }

    /** @return number of channels the subscriber remains subscribed to */
    public synchronized int unsubscribe(Subscriber subscriber, Bytes channel) {
        Set<Subscriber> members = byChannel.get(channel);
        if (members != null) {
            members.remove(subscriber);
            if (members.isEmpty()) byChannel.remove(channel);
        }
        Set<Bytes> mine = bySubscriber.get(subscriber);
        if (mine == null) return 0;
        mine.remove(channel);
        if (mine.isEmpty()) {
            bySubscriber.remove(subscriber);
            return 0;
        }
        return mine.size();
    }

    /** Drop every subscription of a subscriber. @return the channels it was subscribed to, in subscription order */
    public synchronized List<Bytes> unsubscribeAll(Subscriber subscriber) {
        Set<Bytes> mine = bySubscriber.remove(subscriber);
        if (mine == null) return List.of();
        for (Bytes channel : mine) {
            Set<Subscriber> members = byChannel.get(channel);
            if (members != null) {
                members.remove(subscriber);
                if (members.isEmpty()) byChannel.remove(channel);
            }
        }
        return new ArrayList<>(mine);
    }

    /** @return number of subscribers the message was queued for */
    public synchronized int publish(Bytes channel, Bytes message) {
        Set<Subscriber> members = byChannel.get(channel);
        if (members == null || members.isEmpty()) return 0;
        Reply frame = Reply.array(new Reply.BulkString(MESSAGE), new Reply.BulkString(channel), new Reply.BulkString(message));
        int delivered = 0;
        // copy: a subscriber that overflows disconnects and unsubscribes re-entrantly
        for (Subscriber s : List.copyOf(members)) {
            if (s.push(frame)) {
                delivered++;
            } else {
                log.warning("dropped message on " + channel + " for slow subscriber " + s.id());
            }
        }
        return delivered;
    }

    public synchronized int subscriptionCount(Subscriber subscriber) {
        Set<Bytes> mine = bySubscriber.get(subscriber);
        return mine == null ? 0 : mine.size();
    }

    public synchronized int channelCount() {
        return byChannel.size();
    }

    public synchronized int subscriberCount(Bytes channel) {
        Set<Subscriber> members = byChannel.get(channel);
        return members == null ? 0 : members.size();
    }
}
