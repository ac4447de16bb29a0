package io.possync.auth;

import java.util.List;

public abstract class LoginRejectedException extends RuntimeException {
    private final List<LoginState> path;

    protected LoginRejectedException(String message, Throwable cause, List<LoginState> path) {
        super(message, cause);
        this.path = List.copyOf(path);
    }

    public List<LoginState> path() {
        return path;
    }
}
