// file: storage/src/main/java/io/slotkv/storage/FileSnapshotter.java
package io.slotkv.storage;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.Channels;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Snapshot implementation backed by a single file per node.
 * <p>
 * File name: {@code node-<startSlot>-<endSlot>-<port>.snap}, see {@link #fileName}.
 * Format: see {@link SnapshotCodec}.
 * <p>
 * Atomicity:
 *   - we write to "<name>.tmp" first and force it to disk,
 *   - then move it over "<name>" using ATOMIC_MOVE.
 * A crash at any point leaves either the old or the new file, never a mix.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());

    private final Path dir;
    private final String fileName;

    public FileSnapshotter(Path dir, String fileName) {
        this.dir = dir;
        this.fileName = fileName;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PersistenceException("cannot create snapshot directory " + dir, e);
        }
    }

    /** Canonical snapshot file name for the node owning the given slot range on the given port. */
    public static String fileName(int startSlot, int endSlot, int port) {
        return "node-" + startSlot + "-" + endSlot + "-" + port + ".snap";
    }

    public Path path() {
        return dir.resolve(fileName);
    }

    @Override
    public String name() {
        return fileName;
    }

    @Override
    public String writeSnapshot(SnapshotData snapshot) {
        Path dst = path();
        Path tmp = dir.resolve(fileName + ".tmp");

        try (FileChannel ch = FileChannel.open(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            var out = new BufferedOutputStream(Channels.newOutputStream(ch), 64 * 1024);
            SnapshotCodec.write(snapshot, out);
            out.flush();
            ch.force(true);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("snapshot write failed: " + tmp, e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("snapshot rename failed: " + dst, e);
        }
        return fileName;
    }

    @Override
    public SnapshotData loadLatest() {
        byte[] image;
        try {
            image = Files.readAllBytes(path());
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new PersistenceException("snapshot read failed: " + path(), e);
        }
        return SnapshotCodec.decode(image);
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.log(Level.FINE, "could not remove " + p, e);
        }
    }
}
