// file: client/src/main/java/io/slotkv/client/RespConnection.java
package io.slotkv.client;

import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.ProtocolException;
import io.slotkv.core.resp.Reply;
import io.slotkv.core.resp.RespDecoder;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Blocking RESP connection: one request, one reply, on the calling thread.
 * <p>
 * Not thread-safe; callers serialize access (see {@link ClusterClient}).
 */
public final class RespConnection implements AutoCloseable {

    private final String host;
    private final int port;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final RespDecoder decoder = new RespDecoder();
    private final byte[] buf = new byte[8 * 1024];

    public RespConnection(String host, int port, Duration timeout) throws IOException {
        this.host = host;
        this.port = port;
        this.socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            socket.setSoTimeout((int) timeout.toMillis());
            socket.setTcpNoDelay(true);
            this.in = socket.getInputStream();
            this.out = socket.getOutputStream();
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    public String address() {
        return host + ":" + port;
    }

    public Reply call(String... parts) throws IOException {
        if (parts.length == 0) throw new IllegalArgumentException("empty command");
        String[] args = new String[parts.length - 1];
        System.arraycopy(parts, 1, args, 0, args.length);
        return call(Command.of(parts[0], args));
    }

    public Reply call(Command command) throws IOException {
        send(command);
        return read();
    }

    public void send(Command command) throws IOException {
        out.write(command.encode());
        out.flush();
    }

    /** Next frame from the server, blocking up to the socket timeout. */
    public Reply read() throws IOException {
        while (true) {
            Reply r;
            try {
                r = decoder.next();
            } catch (ProtocolException e) {
                throw new IOException("malformed reply from " + address() + ": " + e.getMessage(), e);
            }
            if (r != null) return r;
            int n = in.read(buf);
            if (n < 0) throw new IOException(address() + " closed the connection");
            decoder.feed(buf, 0, n);
        }
    }

    /** 0 disables the read timeout (used by long-lived subscriptions). */
    void readTimeout(int millis) throws IOException {
        socket.setSoTimeout(millis);
    }

    public boolean isClosed() {
        return socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
