package io.possync.sync;

public class SyncFailedException extends RuntimeException {
    public SyncFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
