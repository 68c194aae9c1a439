package io.slotkv.storage;

/**
 * Snapshot could not be written or a persisted snapshot is unreadable.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
