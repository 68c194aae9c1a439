// file: client/src/main/java/io/slotkv/client/Cli.java
package io.slotkv.client;

import io.slotkv.core.resp.Reply;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Simple CLI for talking to a SlotKV cluster over RESP.
 *
 * Usage:
 *   slotkv-cli [--host h] [--port p] [--pass pw] <command> [args..]
 *
 * Keyed commands are routed to the slot owner, following MOVED redirects.
 * SUBSCRIBE stays attached to the given node and prints messages until killed.
 *
 * Examples:
 *   slotkv-cli set doc:1 hello
 *   slotkv-cli --port 7001 get doc:1
 *   slotkv-cli subscribe __keyspace@0__:doc:1
 */
public final class Cli {

    private static final String DEFAULT_HOST = "127.0.0.1";
    private static final int DEFAULT_PORT = 6379;

    /** Parsed command line. */
    record Options(String host, int port, String password, List<String> command) {}

    private Cli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** @return process exit code: 0 ok, 1 usage or error reply, 2 connection failure */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Options opts;
        try {
            opts = parse(args);
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println(usage());
            return 1;
        }

        try (var client = new ClusterClient(opts.host(), opts.port(), opts.password(), Duration.ofSeconds(5))) {
            String name = opts.command().get(0);
            if (name.equalsIgnoreCase("subscribe")) {
                return subscribe(client, opts, out);
            }
            Reply reply = client.call(opts.command().toArray(new String[0]));
            out.println(format(reply));
            return reply instanceof Reply.Error ? 1 : 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (ClusterClientException e) {
            err.println("error: " + e.getMessage());
            return 2;
        }
    }

    static Options parse(String[] args) {
        String host = DEFAULT_HOST;
        int port = DEFAULT_PORT;
        String password = null;

        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            switch (args[i]) {
                case "--host" -> host = value(args, i++);
                case "--port" -> {
                    String raw = value(args, i++);
                    try {
                        port = Integer.parseInt(raw);
                    } catch (NumberFormatException e) {
                        throw new CliException("invalid port: " + raw);
                    }
                }
                case "--pass" -> password = value(args, i++);
                default -> throw new CliException("unknown option: " + args[i]);
            }
            i++;
        }
        if (i >= args.length) {
            throw new CliException("missing command");
        }
        return new Options(host, port, password, List.of(Arrays.copyOfRange(args, i, args.length)));
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException(args[i] + " requires a value");
        }
        return args[i + 1];
    }

    private static int subscribe(ClusterClient client, Options opts, PrintStream out) {
        List<String> channels = opts.command().subList(1, opts.command().size());
        if (channels.isEmpty()) {
            throw new CliException("subscribe requires at least one channel");
        }
        String node = opts.host() + ":" + opts.port();
        List<ClusterClient.Subscription> subs = new ArrayList<>();
        for (String channel : channels) {
            subs.add(client.subscribe(node, channel, (ch, payload) -> {
                synchronized (out) {
                    out.println(ch + ": " + payload.utf8());
                }
            }));
            out.println("subscribed to " + channel);
        }
        var done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            subs.forEach(ClusterClient.Subscription::close);
            done.countDown();
        }));
        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }

    /** Human-readable rendering of a reply, one element per line for arrays. */
    static String format(Reply reply) {
        StringBuilder sb = new StringBuilder();
        format(reply, "", sb);
        return sb.toString();
    }

    private static void format(Reply reply, String indent, StringBuilder sb) {
        if (reply instanceof Reply.SimpleString s) {
            sb.append(s.value());
        } else if (reply instanceof Reply.Error e) {
            sb.append("(error) ").append(e.message());
        } else if (reply instanceof Reply.Integer n) {
            sb.append("(integer) ").append(n.value());
        } else if (reply instanceof Reply.BulkString b) {
            sb.append('"').append(b.utf8()).append('"');
        } else if (reply instanceof Reply.Null || reply instanceof Reply.NullArray) {
            sb.append("(nil)");
        } else if (reply instanceof Reply.Array a) {
            List<Reply> items = a.elements();
            if (items.isEmpty()) {
                sb.append("(empty array)");
                return;
            }
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append('\n').append(indent);
                String label = (i + 1) + ") ";
                sb.append(label);
                format(items.get(i), indent + " ".repeat(label.length()), sb);
            }
        }
    }

    static String usage() {
        return """
                Usage:
                  slotkv-cli [--host h] [--port p] [--pass pw] <command> [args..]

                Options:
                  --host   node to contact first (default: 127.0.0.1)
                  --port   its RESP port (default: 6379)
                  --pass   password sent with AUTH on every connection
                """;
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
