package io.possync.remote;

public abstract class RemoteException extends RuntimeException {
    protected RemoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
