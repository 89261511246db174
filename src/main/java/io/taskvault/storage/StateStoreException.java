package io.taskvault.storage;

/**
 * The vault directory could not be read or written. Aborts the current cycle.
 */
public final class StateStoreException extends RuntimeException {
    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StateStoreException(String message) {
        super(message);
    }
}
