package io.possync.remote;

import io.possync.model.Identity;

public record RegistrationResult(Identity identity, String message) {
    public static final String DEFAULT_MESSAGE = "Account created successfully! Please sign in to continue.";
}
