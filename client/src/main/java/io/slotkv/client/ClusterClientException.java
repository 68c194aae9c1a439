package io.slotkv.client;

/**
 * Raised when the cluster cannot be reached or keeps redirecting a request.
 */
public class ClusterClientException extends RuntimeException {

    public ClusterClientException(String message) {
        super(message);
    }

    public ClusterClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
