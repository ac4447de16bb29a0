package io.possync.auth;

public enum LoginState {
    IDLE,
    TRYING_REMOTE,
    AUTHENTICATED_REMOTE,
    TRYING_LOCAL,
    AUTHENTICATED_LOCAL,
    REJECTED
}
