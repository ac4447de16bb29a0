package io.possync.auth;

import io.possync.health.HealthMonitor;
import io.possync.model.Identity;
import io.possync.model.Source;
import io.possync.observability.AuditLogger;
import io.possync.observability.AuditLogger.AuditEvent;
import io.possync.remote.AuthorityException;
import io.possync.remote.LoginResponse;
import io.possync.remote.RegistrationRequest;
import io.possync.remote.RemoteClient;
import io.possync.remote.RemoteException;
import io.possync.storage.LocalStore;
import io.possync.sync.SyncEngine;
import io.possync.sync.SyncOutcome;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a login against the remote authority first and the local store second.
 *
 * <p>The authority is always tried, whatever the cached health says. A clean {@code 401}/{@code 403}
 * is final. Any other remote failure is reported to the {@link HealthMonitor} and the credential is
 * checked locally instead. A remote success runs a forced sync before returning; that sync failing
 * does not fail the login.
 */
public final class CredentialVerifier {
    static final String OFFLINE_TOKEN_PREFIX = "offline_token_";
    static final String NO_SOURCE_ACCEPTED = "Neither the authority nor the local store accepted these credentials. "
            + "Please check your email and password, or create a new account.";

    private final RemoteClient remote;
    private final LocalStore store;
    private final HealthMonitor health;
    private final SyncEngine sync;
    private final AuditLogger audit;
    private final Clock clock;

    public CredentialVerifier(RemoteClient remote, LocalStore store, HealthMonitor health, SyncEngine sync,
                              AuditLogger audit, Clock clock) {
        this.remote = remote;
        this.store = store;
        this.health = health;
        this.sync = sync;
        this.audit = audit;
        this.clock = clock;
    }

    public LoginResult login(String email, String password) {
        validate(email, password);
        String normalized = Identity.normalizeEmail(email);
        List<LoginState> path = new ArrayList<>();
        path.add(LoginState.IDLE);
        path.add(LoginState.TRYING_REMOTE);

        RemoteException remoteFailure;
        try {
            LoginResponse response = remote.login(normalized, password);
            path.add(LoginState.AUTHENTICATED_REMOTE);
            SyncOutcome synced = null;
            String syncError = null;
            try {
                synced = sync.syncAll(true, response.token());
            } catch (RuntimeException e) {
                syncError = e.getMessage();
            }
            audit.log(AuditEvent.of("auth.login", normalized, "session", "success", AuditEvent.details(
                    "source", Source.REMOTE.wireName(),
                    "path", path,
                    "post_login_sync", synced != null && synced.synced(),
                    "sync_error", syncError
            )));
            return new LoginResult(response.identity().withoutCredential(), response.token(), Source.REMOTE,
                    path, synced, syncError);
        } catch (AuthorityException e) {
            if (e.isUnauthorized()) {
                path.add(LoginState.REJECTED);
                logRejected(normalized, path, "authority_rejected", e.status());
                String message = e.getMessage() == null || e.getMessage().isBlank()
                        ? "Invalid email or password"
                        : e.getMessage();
                throw new AuthorityRejectedException(message, e, path);
            }
            remoteFailure = e;
        } catch (RemoteException e) {
            remoteFailure = e;
        }

        health.reportFailure("login: " + remoteFailure.getMessage());
        path.add(LoginState.TRYING_LOCAL);
        Optional<Identity> local = store.verifyCredential(normalized, password);
        if (local.isEmpty()) {
            path.add(LoginState.REJECTED);
            logRejected(normalized, path, "local_rejected", null);
            throw new LocalRejectedException(NO_SOURCE_ACCEPTED, remoteFailure, path);
        }
        path.add(LoginState.AUTHENTICATED_LOCAL);
        audit.log(AuditEvent.of("auth.login", normalized, "session", "success", AuditEvent.details(
                "source", Source.LOCAL.wireName(),
                "path", path,
                "remote_error", remoteFailure.getMessage()
        )));
        return new LoginResult(local.get(), OFFLINE_TOKEN_PREFIX + clock.millis(), Source.LOCAL, path, null, null);
    }

    private void logRejected(String email, List<LoginState> path, String reason, Integer status) {
        audit.log(AuditEvent.of("auth.login", email, "session", "rejected", AuditEvent.details(
                "reason", reason,
                "status", status,
                "path", path
        )));
    }

    static void validate(String email, String password) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        if (!RegistrationRequest.EMAIL.matcher(email.trim()).matches()) {
            throw new IllegalArgumentException("Please enter a valid email address");
        }
        if (password == null || password.isBlank()) {
            throw new IllegalArgumentException("Password is required");
        }
    }
}
