package io.possync.storage;

public class StoreConstraintException extends RuntimeException {
    public StoreConstraintException(String message) {
        super(message);
    }

    public StoreConstraintException(String message, Throwable cause) {
        super(message, cause);
    }
}
