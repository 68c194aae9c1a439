// file: server/src/main/java/io/slotkv/server/Main.java
package io.slotkv.server;

import io.slotkv.server.cluster.ClusterConfig;
import io.slotkv.storage.PersistenceException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single SlotKV node.
 *
 * Responsibilities:
 *  - Load logging setup and parse the CLI.
 *  - Load the cluster config and pick the local node.
 *  - Start the node; exit with status 1 on any fatal startup error.
 *  - Install a shutdown hook that stops the node gracefully (final snapshot).
 *  - Exit with status 0 once a SHUTDOWN command has stopped the node.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);

        ClusterConfig cluster;
        try {
            cluster = ClusterConfig.fromJsonFile(Path.of(cfg.configPath()), cfg.port(), cfg.host());
        } catch (IllegalArgumentException e) {
            log.log(Level.SEVERE, "invalid cluster config: " + e.getMessage());
            System.exit(1);
            return;
        }

        var node = new SlotKvNode(cluster);
        try {
            node.start();
        } catch (PersistenceException e) {
            log.log(Level.SEVERE, "cannot restore snapshot", e);
            System.exit(1);
            return;
        } catch (IOException e) {
            log.log(Level.SEVERE, "cannot bind port " + cfg.port(), e);
            node.stop();
            System.exit(1);
            return;
        }

        node.onShutdown(() -> System.exit(0));

        var done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                node.stop();
            } finally {
                done.countDown();
            }
        }, "shutdown"));

        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("logging.properties not loaded: " + e.getMessage());
        }
    }
}
