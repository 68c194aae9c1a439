package io.slotkv.core.resp;

/**
 * Malformed RESP input.
 * <p>
 * Recoverable errors (fatal == false) leave the decoder positioned after the
 * offending line so the connection can continue. Fatal errors mean framing
 * is lost and the connection must be closed after reporting the error.
 */
public class ProtocolException extends RuntimeException {

    private final boolean fatal;

    public ProtocolException(String message, boolean fatal) {
        super(message);
        this.fatal = fatal;
    }

    public boolean fatal() {
        return fatal;
    }
}
