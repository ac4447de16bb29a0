package io.possync.sync;

public class SyncConflictException extends RuntimeException {
    public SyncConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
