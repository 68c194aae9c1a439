package io.slotkv.server.net;

import io.slotkv.server.command.CommandDispatcher;
import io.slotkv.server.pubsub.PubSubRegistry;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * RESP listener: accepts sockets and hands each to its own {@link ClientConnection}.
 */
public final class RespServer {
    private static final Logger log = Logger.getLogger(RespServer.class.getName());

    static final int DEFAULT_MAX_QUEUED_FRAMES = 10_000;

    private final int port;
    private final CommandDispatcher dispatcher;
    private final PubSubRegistry pubsub;
    private final Duration idleTimeout;
    private final int maxQueuedFrames;
    private final Set<ClientConnection> connections = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private Thread acceptor;
    private volatile boolean running;

    public RespServer(int port, CommandDispatcher dispatcher, PubSubRegistry pubsub, Duration idleTimeout) {
        this(port, dispatcher, pubsub, idleTimeout, DEFAULT_MAX_QUEUED_FRAMES);
    }

    public RespServer(int port, CommandDispatcher dispatcher, PubSubRegistry pubsub,
                      Duration idleTimeout, int maxQueuedFrames) {
        this.port = port;
        this.dispatcher = dispatcher;
        this.pubsub = pubsub;
        this.idleTimeout = idleTimeout;
        this.maxQueuedFrames = maxQueuedFrames;
    }

    /**
     * Bind and start accepting.
     *
     * @throws IOException when the port cannot be bound
     */
    public void start() throws IOException {
        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        ss.bind(new InetSocketAddress(port));
        serverSocket = ss;
        running = true;
        acceptor = new Thread(this::acceptLoop, "resp-acceptor-" + port);
        acceptor.setDaemon(true);
        acceptor.start();
        log.info("RESP listener bound on port " + port);
    }

    public int connectionCount() {
        return connections.size();
    }

    /** Stop accepting and close every open connection. */
    public void stop() {
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                log.log(Level.FINE, "server socket close failed", e);
            }
        }
        for (ClientConnection c : List.copyOf(connections)) {
            c.close();
        }
        if (acceptor != null) {
            try {
                acceptor.join(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void acceptLoop() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (running) log.log(Level.WARNING, "accept failed", e);
                break;
            } catch (IOException e) {
                log.log(Level.WARNING, "accept failed", e);
                continue;
            }
            try {
                socket.setTcpNoDelay(true);
            } catch (SocketException e) {
                log.log(Level.FINE, "TCP_NODELAY not set", e);
            }
            var conn = new ClientConnection(socket, dispatcher, pubsub, idleTimeout, maxQueuedFrames, connections::remove);
            connections.add(conn);
            if (!running) {
                conn.close();
                break;
            }
            conn.start();
            log.fine("accepted " + conn.peer());
        }
    }
}
