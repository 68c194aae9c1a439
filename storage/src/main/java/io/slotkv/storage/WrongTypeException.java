package io.slotkv.storage;

/**
 * Operation issued against a key holding an incompatible value shape.
 */
public final class WrongTypeException extends StoreException {

    public static final String MESSAGE = "Operation against a key holding the wrong kind of value";

    private final ValueType actual;

    public WrongTypeException(ValueType actual) {
        super(MESSAGE);
        this.actual = actual;
    }

    public ValueType actual() {
        return actual;
    }
}
