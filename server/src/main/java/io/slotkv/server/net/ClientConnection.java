package io.slotkv.server.net;

import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.ProtocolException;
import io.slotkv.core.resp.Reply;
import io.slotkv.core.resp.RespDecoder;
import io.slotkv.core.resp.RespEncoder;
import io.slotkv.server.command.CommandDispatcher;
import io.slotkv.server.command.Session;
import io.slotkv.server.pubsub.PubSubRegistry;
import io.slotkv.server.pubsub.Subscriber;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One client connection.
 * <p>
 * Threads:
 *  - reader: decodes frames, dispatches commands in arrival order and
 *    queues each reply;
 *  - writer: drains the outbound queue to the socket, flushing when the
 *    queue runs empty.
 * <p>
 * Replies and pub/sub pushes share the outbound queue, so a client sees them
 * in the order they were produced. Replies wait for room in the queue
 * (backpressure on the client's own reads); pushes never wait, and a
 * subscriber whose queue is full is disconnected.
 * <p>
 * States: CONNECTED -> CLOSED. Closing removes subscriptions, discards
 * queued output and closes the socket.
 */
public final class ClientConnection implements Session, Subscriber {
    private static final Logger log = Logger.getLogger(ClientConnection.class.getName());

    /** Sentinel: close the socket once everything queued before it is written. */
    private static final byte[] CLOSE = new byte[0];
    private static final int READ_BUFFER = 16 * 1024;

    private final Socket socket;
    private final String peer;
    private final CommandDispatcher dispatcher;
    private final PubSubRegistry pubsub;
    private final long idleMillis;
    private final BlockingQueue<byte[]> outbound;
    private final Consumer<ClientConnection> onClose;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final RespDecoder decoder = new RespDecoder();

    private final Thread reader;
    private final Thread writer;

    private volatile boolean authenticated;
    private volatile boolean replicationLink;
    private volatile boolean closeRequested;
    private long lastCommandMillis;

    public ClientConnection(
            Socket socket,
            CommandDispatcher dispatcher,
            PubSubRegistry pubsub,
            Duration idleTimeout,
            int maxQueuedFrames,
            Consumer<ClientConnection> onClose
    ) {
        this.socket = socket;
        this.peer = String.valueOf(socket.getRemoteSocketAddress());
        this.dispatcher = dispatcher;
        this.pubsub = pubsub;
        this.idleMillis = idleTimeout.toMillis();
        this.outbound = new LinkedBlockingQueue<>(maxQueuedFrames);
        this.onClose = onClose;
        this.reader = new Thread(this::readLoop, "conn-r-" + peer);
        this.writer = new Thread(this::writeLoop, "conn-w-" + peer);
        reader.setDaemon(true);
        writer.setDaemon(true);
    }

    public void start() {
        writer.start();
        reader.start();
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ---------- Session ----------

    @Override
    public String peer() {
        return peer;
    }

    @Override
    public boolean authenticated() {
        return authenticated;
    }

    @Override
    public void authenticate() {
        authenticated = true;
    }

    @Override
    public boolean replicationLink() {
        return replicationLink;
    }

    @Override
    public void markReplicationLink() {
        replicationLink = true;
    }

    @Override
    public Subscriber subscriber() {
        return this;
    }

    @Override
    public void send(Reply reply) {
        enqueueReply(RespEncoder.encode(reply));
    }

    @Override
    public void closeAfterReply() {
        closeRequested = true;
    }

    // ---------- Subscriber ----------

    @Override
    public String id() {
        return peer;
    }

    @Override
    public boolean push(Reply frame) {
        if (closed.get()) return false;
        if (outbound.offer(RespEncoder.encode(frame))) return true;
        log.warning("outbound queue full for subscriber " + peer + ", disconnecting");
        close();
        return false;
    }

    // ---------- reader ----------

    private void readLoop() {
        byte[] buf = new byte[READ_BUFFER];
        lastCommandMillis = System.currentTimeMillis();
        try {
            InputStream in = socket.getInputStream();
            if (idleMillis > 0) {
                socket.setSoTimeout((int) Math.min(idleMillis, 1000L));
            }
            while (!closed.get()) {
                int n;
                try {
                    n = in.read(buf);
                } catch (SocketTimeoutException timeout) {
                    if (idleExpired()) {
                        log.fine("closing idle connection " + peer);
                        break;
                    }
                    continue;
                }
                if (n < 0) break;
                decoder.feed(buf, 0, n);
                if (!drainFrames()) break;
                if (idleExpired()) {
                    log.fine("closing idle connection " + peer);
                    break;
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.log(Level.FINE, "read failed for " + peer, e);
            }
        } finally {
            if (!closed.get()) {
                enqueueClose();
            }
        }
    }

    /** @return false when the connection must stop reading */
    private boolean drainFrames() {
        while (true) {
            Reply frame;
            try {
                frame = decoder.next();
            } catch (ProtocolException e) {
                send(Reply.error("ERR Protocol error: " + e.getMessage()));
                if (e.fatal()) {
                    log.warning("protocol error from " + peer + ", closing: " + e.getMessage());
                    return false;
                }
                log.fine("protocol error from " + peer + ": " + e.getMessage());
                continue;
            }
            if (frame == null) return true;

            Command command;
            try {
                command = Command.fromFrame(frame);
            } catch (ProtocolException e) {
                send(Reply.error("ERR Protocol error: " + e.getMessage()));
                continue;
            }
            if (command == null) continue;

            lastCommandMillis = System.currentTimeMillis();
            Reply reply = dispatcher.dispatch(this, command);
            send(reply);
            if (closeRequested) return false;
        }
    }

    private boolean idleExpired() {
        if (idleMillis <= 0) return false;
        if (pubsub.subscriptionCount(this) > 0) return false;
        return System.currentTimeMillis() - lastCommandMillis >= idleMillis;
    }

    private void enqueueReply(byte[] frame) {
        if (closed.get()) return;
        try {
            outbound.put(frame);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
        }
    }

    private void enqueueClose() {
        // replies already queued are flushed before the socket closes
        if (!outbound.offer(CLOSE)) {
            close();
        }
    }

    // ---------- writer ----------

    private void writeLoop() {
        try {
            OutputStream out = new BufferedOutputStream(socket.getOutputStream(), 16 * 1024);
            while (!closed.get()) {
                byte[] frame = outbound.take();
                if (frame == CLOSE) {
                    out.flush();
                    break;
                }
                out.write(frame);
                if (outbound.isEmpty()) out.flush();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (!closed.get()) {
                log.log(Level.FINE, "write failed for " + peer, e);
            }
        } finally {
            close();
        }
    }

    // ---------- lifecycle ----------

    /** Idempotent; safe from any thread. */
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        pubsub.unsubscribeAll(this);
        outbound.clear();
        try {
            socket.close();
        } catch (IOException e) {
            log.log(Level.FINE, "close failed for " + peer, e);
        }
        if (Thread.currentThread() != writer) writer.interrupt();
        onClose.accept(this);
        log.fine("connection " + peer + " closed");
    }
}
