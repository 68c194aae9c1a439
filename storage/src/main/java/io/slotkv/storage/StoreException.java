package io.slotkv.storage;

/**
 * A command could not be applied; the store is unchanged.
 * The message is user-facing (sent back after "ERR ").
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }
}
