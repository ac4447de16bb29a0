package io.possync.remote;

public class NetworkException extends RemoteException {
    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
