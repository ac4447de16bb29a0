package io.possync.auth;

import io.possync.remote.AuthorityException;

import java.util.List;

public class AuthorityRejectedException extends LoginRejectedException {
    public AuthorityRejectedException(String message, AuthorityException cause, List<LoginState> path) {
        super(message, cause, path);
    }

    public int status() {
        return ((AuthorityException) getCause()).status();
    }
}
