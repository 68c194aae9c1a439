package io.slotkv.server.command;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.server.pubsub.PubSubRegistry;
import io.slotkv.server.pubsub.Subscriber;

import java.util.List;

import static io.slotkv.server.command.CommandSpec.Flag.PUBSUB_CONTEXT;

/**
 * SUBSCRIBE / UNSUBSCRIBE / PUBLISH. Node-local, never slot-routed.
 * <p>
 * SUBSCRIBE and UNSUBSCRIBE answer with one confirmation per channel: all but
 * the last are queued through {@link Session#send}, the last is the return value.
 */
final class PubSubCommands {

    private final PubSubRegistry registry;

    PubSubCommands(PubSubRegistry registry) {
        this.registry = registry;
    }

    void registerAll(CommandTable table) {
        table.register("SUBSCRIBE", -2, this::subscribe, PUBSUB_CONTEXT);
        table.register("UNSUBSCRIBE", -1, this::unsubscribe, PUBSUB_CONTEXT);
        table.register("PUBLISH", 3, (s, c) -> Reply.integer(registry.publish(c.arg(0), c.arg(1))));
    }

    private Reply subscribe(Session session, Command c) {
        Subscriber me = session.subscriber();
        Reply last = null;
        for (Bytes channel : c.args()) {
            if (last != null) session.send(last);
            int count = registry.subscribe(me, channel);
            last = confirmation("subscribe", channel, count);
        }
        return last;
    }

    private Reply unsubscribe(Session session, Command c) {
        Subscriber me = session.subscriber();
        if (c.argCount() == 0) {
            List<Bytes> dropped = registry.unsubscribeAll(me);
            if (dropped.isEmpty()) {
                return confirmation("unsubscribe", null, 0);
            }
            Reply last = null;
            for (int i = 0; i < dropped.size(); i++) {
                if (last != null) session.send(last);
                last = confirmation("unsubscribe", dropped.get(i), dropped.size() - i - 1);
            }
            return last;
        }
        Reply last = null;
        for (Bytes channel : c.args()) {
            if (last != null) session.send(last);
            int remaining = registry.unsubscribe(me, channel);
            last = confirmation("unsubscribe", channel, remaining);
        }
        return last;
    }

    static Reply confirmation(String kind, Bytes channel, long count) {
        return Reply.array(Reply.bulk(kind), Reply.bulk(channel), Reply.integer(count));
    }
}
