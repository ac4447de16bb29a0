package io.possync.remote;

import io.possync.model.Identity;

/**
 * Calls against the remote authority. Every method either returns a usable value or throws a
 * {@link NetworkException} (nobody answered) or an {@link AuthorityException} (somebody answered no).
 */
public interface RemoteClient {
    LoginResponse login(String email, String password);

    RegistrationResult register(RegistrationRequest request);

    void logout(String token);

    Identity getProfile(String token);

    HealthResponse health();

    SyncPayload pullAll(String token);

    void setUnauthorizedListener(Runnable listener);
}
