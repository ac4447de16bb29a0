package io.possync.session;

public class ImpersonationDeniedException extends RuntimeException {
    public ImpersonationDeniedException(String message) {
        super(message);
    }
}
