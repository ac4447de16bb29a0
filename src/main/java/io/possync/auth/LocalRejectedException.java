package io.possync.auth;

import java.util.List;

public class LocalRejectedException extends LoginRejectedException {
    public LocalRejectedException(String message, Throwable cause, List<LoginState> path) {
        super(message, cause, path);
    }
}
