package io.possync.runtime;

import io.possync.auth.CredentialVerifier;
import io.possync.auth.LoginResult;
import io.possync.config.EngineSettings;
import io.possync.config.PosSyncConfig;
import io.possync.health.HealthMonitor;
import io.possync.health.HealthStatus;
import io.possync.health.HealthView;
import io.possync.model.Identity;
import io.possync.model.Session;
import io.possync.model.Source;
import io.possync.model.Transaction;
import io.possync.model.TransactionLine;
import io.possync.observability.AuditLogger;
import io.possync.observability.AuditLogger.AuditEvent;
import io.possync.remote.AuthorityException;
import io.possync.remote.HttpRemoteClient;
import io.possync.remote.RegistrationRequest;
import io.possync.remote.RegistrationResult;
import io.possync.remote.RemoteClient;
import io.possync.remote.RemoteException;
import io.possync.session.SessionManager;
import io.possync.storage.Database;
import io.possync.storage.KeyValueStore;
import io.possync.storage.LocalStore;
import io.possync.sync.SyncEngine;
import io.possync.sync.SyncOutcome;
import io.possync.sync.SyncStatus;
import io.possync.util.Jsons;
import io.possync.util.Sleeper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application context: builds every component once, wires them together and exposes the operations
 * the point-of-sale front end calls.
 */
public final class PosSyncRuntime implements AutoCloseable {
    private final AuditLogger auditLogger;
    private final EngineSettings settings;
    private final LocalStore localStore;
    private final KeyValueStore stateStore;
    private final RemoteClient remote;
    private final HealthMonitor healthMonitor;
    private final SyncEngine syncEngine;
    private final SessionManager sessions;
    private final CredentialVerifier verifier;
    private final Object loginLock = new Object();

    public PosSyncRuntime(PosSyncConfig config) {
        this(config, null, Clock.systemUTC(), Sleeper.THREAD);
    }

    public PosSyncRuntime(PosSyncConfig config, RemoteClient remoteOverride, Clock clock, Sleeper sleeper) {
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        this.settings = loadSettings(config.settingsFile(), auditLogger);
        Database database = new Database(config);
        this.localStore = new LocalStore(database, clock, settings.seedDemoData());
        this.stateStore = new KeyValueStore(config.stateFile());
        this.remote = remoteOverride == null ? new HttpRemoteClient(settings, sleeper) : remoteOverride;
        this.healthMonitor = new HealthMonitor(remote, settings.healthRetryPolicy(), settings.healthCheckIntervalMs(),
                sleeper, clock, auditLogger);
        this.sessions = new SessionManager(stateStore, localStore, auditLogger, clock);
        this.syncEngine = new SyncEngine(remote, localStore, stateStore, healthMonitor, auditLogger, clock,
                settings.syncThrottle(), this::remoteToken);
        this.verifier = new CredentialVerifier(remote, localStore, healthMonitor, syncEngine, auditLogger, clock);
        this.remote.setUnauthorizedListener(this::onUnauthorized);
    }

    static EngineSettings loadSettings(Path file, AuditLogger audit) {
        EngineSettings defaults = EngineSettings.defaults();
        if (!Files.exists(file)) {
            audit.log(AuditEvent.system("settings.load", "settings", "defaults",
                    AuditEvent.details("config", file.toString())));
            return defaults;
        }
        try {
            EngineSettings.SettingsFile raw = Jsons.mapper().readValue(file.toFile(), EngineSettings.SettingsFile.class);
            EngineSettings resolved = EngineSettings.fromFile(raw, defaults);
            audit.log(AuditEvent.system("settings.load", "settings", "ok", AuditEvent.details(
                    "config", file.toString(),
                    "base_url", resolved.baseUrl(),
                    "changed", !resolved.equals(defaults)
            )));
            return resolved;
        } catch (IOException e) {
            audit.log(AuditEvent.system("settings.load", "settings", "invalid", AuditEvent.details(
                    "config", file.toString(),
                    "error", e.getMessage()
            )));
            return defaults;
        }
    }

    /**
     * Prepares the local store, restores the previous session and checks the authority. A restored
     * remote session whose token the authority now refuses is dropped; one that cannot be checked
     * because the authority is away is kept.
     */
    public StartupReport initialize() {
        localStore.ensureSchema();
        Optional<Session> restored = sessions.restore();
        HealthStatus health = healthMonitor.probe();
        boolean tokenVerified = false;
        if (restored.isPresent() && restored.get().source() == Source.REMOTE && health.healthy()) {
            try {
                Identity profile = remote.getProfile(restored.get().token());
                sessions.updateIdentity(profile);
                tokenVerified = true;
                syncEngine.syncInBackground(false);
            } catch (AuthorityException e) {
                if (e.isUnauthorized()) {
                    sessions.clear();
                } else {
                    healthMonitor.reportFailure("profile check: " + e.getMessage());
                }
            } catch (RemoteException e) {
                healthMonitor.reportFailure("profile check: " + e.getMessage());
            } catch (IllegalArgumentException e) {
                auditLogger.log(AuditEvent.system("session.profile_mismatch", "session", "failure",
                        AuditEvent.details("error", e.getMessage())));
            }
        }
        healthMonitor.start();
        return new StartupReport(sessions.getSession().orElse(null), health, tokenVerified);
    }

    public LoginResult login(String email, String password) {
        synchronized (loginLock) {
            LoginResult result = verifier.login(email, password);
            sessions.setSession(result.identity(), result.token(), result.source());
            return result;
        }
    }

    public RegistrationResult register(RegistrationRequest request) {
        try {
            RegistrationResult result = remote.register(request);
            auditLogger.log(AuditEvent.of("auth.register", result.identity().email(), "identity", "success",
                    AuditEvent.details("identity_id", result.identity().id())));
            return result;
        } catch (RemoteException e) {
            auditLogger.log(AuditEvent.of("auth.register", request.email(), "identity", "failure", AuditEvent.details(
                    "status", e instanceof AuthorityException authority ? authority.status() : null,
                    "error", e.getMessage()
            )));
            throw e;
        }
    }

    /**
     * Ends the session locally. The authority is told as well when the session came from it; that
     * call failing does not keep the session alive.
     */
    public void logout() {
        synchronized (loginLock) {
            Optional<Session> current = sessions.getSession();
            if (current.isEmpty()) {
                return;
            }
            Session session = current.get();
            if (session.source() == Source.REMOTE) {
                try {
                    remote.logout(session.token());
                } catch (RemoteException e) {
                    auditLogger.log(AuditEvent.of("auth.logout", session.originalIdentity().email(), "session",
                            "remote_failed", AuditEvent.details("error", e.getMessage())));
                }
            }
            sessions.clear();
        }
    }

    public Optional<Session> getSession() {
        return sessions.getSession();
    }

    public Session switchTo(String delegateEmail, String proof) {
        return sessions.switchTo(localStore.findIdentityByEmail(delegateEmail).orElse(null), proof);
    }

    public Session switchBack() {
        return sessions.switchBack();
    }

    public SyncOutcome forceSync() {
        return syncEngine.syncAll(true);
    }

    public SyncStatus getSyncStatus() {
        return syncEngine.getSyncStatus();
    }

    public HealthView getHealthStatus() {
        return healthMonitor.getStatus();
    }

    public HealthStatus probeHealth() {
        return healthMonitor.probe();
    }

    public Session refreshProfile() {
        Session session = sessions.getSession()
                .filter(s -> s.source() == Source.REMOTE)
                .orElseThrow(() -> new IllegalStateException("No remote session to refresh"));
        Identity profile = remote.getProfile(session.token());
        return sessions.updateIdentity(profile);
    }

    public Transaction recordLocalSale(Transaction transaction, List<TransactionLine> lines) {
        Session session = sessions.getSession()
                .orElseThrow(() -> new IllegalStateException("No active session"));
        Transaction stored = localStore.recordLocalSale(transaction, lines, session.identity().id());
        auditLogger.log(AuditEvent.of("sale.recorded_local", session.identity().email(), "sales/" + stored.id(),
                "pending_sync", AuditEvent.details(
                        "lines", lines.size(),
                        "total_amount", stored.totalAmount(),
                        "acting", session.isActing()
                )));
        return stored;
    }

    public LocalStore localStore() {
        return localStore;
    }

    public EngineSettings settings() {
        return settings;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    private String remoteToken() {
        return sessions.getSession()
                .filter(s -> s.source() == Source.REMOTE)
                .map(Session::token)
                .orElse(null);
    }

    private void onUnauthorized() {
        Optional<Session> current = sessions.getSession();
        if (current.isPresent() && current.get().source() == Source.REMOTE) {
            auditLogger.log(AuditEvent.of("session.invalidated", current.get().originalIdentity().email(), "session",
                    "unauthorized", Map.of()));
            sessions.clear();
        }
    }

    @Override
    public void close() {
        healthMonitor.close();
        syncEngine.close();
    }

    public record StartupReport(Session session, HealthStatus health, boolean tokenVerified) {
    }
}
