package io.possync.remote;

public class AuthorityException extends RemoteException {
    private final int status;
    private final String body;

    public AuthorityException(int status, String message, String body) {
        super(message, null);
        this.status = status;
        this.body = body == null ? "" : body;
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }

    public boolean isUnauthorized() {
        return status == 401 || status == 403;
    }

    public boolean isDuplicateIdentity() {
        return status == 409;
    }
}
