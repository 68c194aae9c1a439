// file: server/src/main/java/io/slotkv/server/ServerConfig.java
package io.slotkv.server;

/**
 * Per-node server configuration parsed from CLI args.
 *
 * Supports:
 *  - port:       client (RESP) port; also identifies the local node in the cluster file
 *  - host:       optional host to disambiguate nodes sharing a port
 *  - configPath: JSON cluster config (topology + node settings)
 *  - help:       print usage and exit
 */
public record ServerConfig(
        int port,
        String host,
        String configPath,
        boolean help
) {

    /**
     * CLI entry used by {@link Main}: prints a message and exits on bad input.
     */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig cfg;
        try {
            cfg = parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(usage());
            System.exit(1);
            return null;
        }
        if (cfg.help()) {
            System.out.println(usage());
            System.exit(0);
        }
        return cfg;
    }

    /**
     * Very small CLI parser.
     *
     * Usage: server <port> [options]
     *   --config, -c <path>   cluster JSON (default: cluster.json)
     *   --host <host>         local host name as written in the cluster JSON
     *   --help,   -h
     *
     * @throws IllegalArgumentException on a missing/invalid port or unknown option
     */
    public static ServerConfig parse(String[] args) {
        Integer port = null;
        String host = null;
        String configPath = "cluster.json";

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new ServerConfig(0, null, configPath, true);
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--host" -> {
                    ensureValue(args, i);
                    host = args[++i];
                }

                default -> {
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    if (port != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + args[i]);
                    }
                    port = parsePort(args[i]);
                }
            }
        }
        if (port == null) {
            throw new IllegalArgumentException("Missing port");
        }
        return new ServerConfig(port, host, configPath, false);
    }

    private static int parsePort(String raw) {
        int p;
        try {
            p = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + raw);
        }
        if (p <= 0 || p > 65535) {
            throw new IllegalArgumentException("Invalid port: " + raw);
        }
        return p;
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    static String usage() {
        return """
            Usage: server <port> [options]

            Options:
              --config, -c   Path to JSON cluster config (default: cluster.json)
              --host         Host of this node as listed in the cluster config
                             (only needed when several nodes share the port)
              --help,   -h   Show this help message
            """;
    }
}
