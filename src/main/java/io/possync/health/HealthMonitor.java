package io.possync.health;

import io.possync.model.Source;
import io.possync.observability.AuditLogger;
import io.possync.observability.AuditLogger.AuditEvent;
import io.possync.remote.AuthorityException;
import io.possync.remote.HealthResponse;
import io.possync.remote.RemoteClient;
import io.possync.remote.RemoteException;
import io.possync.util.RetryPolicy;
import io.possync.util.Sleeper;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Tracks whether the remote authority should be trusted.
 *
 * <p>A probe retries only on {@code 503} (the authority is still starting), with exponential
 * backoff, up to the configured attempt count. Every other failure ends the probe as
 * {@link AuthorityState#UNREACHABLE} at once. Probes never throw: failures become state.
 */
public final class HealthMonitor implements AutoCloseable {
    private final RemoteClient remote;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final AuditLogger audit;
    private final long intervalMs;
    private final Object probeLock = new Object();

    private AuthorityState state = AuthorityState.UNREACHABLE;
    private Source activeSource = Source.LOCAL;
    private Instant lastCheck;
    private String lastError;
    private String lastAuditError;
    private ScheduledExecutorService scheduler;

    public HealthMonitor(RemoteClient remote, RetryPolicy policy, long intervalMs, Sleeper sleeper, Clock clock,
                         AuditLogger audit) {
        this.remote = remote;
        this.policy = policy;
        this.intervalMs = intervalMs;
        this.sleeper = sleeper;
        this.clock = clock;
        this.audit = audit;
    }

    public HealthStatus probe() {
        synchronized (probeLock) {
            int attempt = 0;
            while (true) {
                attempt++;
                try {
                    HealthResponse response = remote.health();
                    AuthorityState next = response.isHealthy() ? AuthorityState.REACHABLE : AuthorityState.DEGRADED;
                    String detail = next == AuthorityState.REACHABLE
                            ? null
                            : "status=" + response.status() + ", database=" + response.database();
                    return record(new HealthStatus(next, response.databaseConnected(), clock.instant(), attempt, detail));
                } catch (AuthorityException e) {
                    if (e.status() == 503 && policy.hasAttemptAfter(attempt)) {
                        try {
                            sleeper.sleep(policy.delayAfterAttempt(attempt));
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            return record(unreachable(attempt, "probe interrupted"));
                        }
                        continue;
                    }
                    return record(unreachable(attempt, e.status() == 503
                            ? "authority still unavailable (503) after " + attempt + " attempts"
                            : "health returned HTTP " + e.status()));
                } catch (RemoteException e) {
                    return record(unreachable(attempt, e.getMessage()));
                } catch (RuntimeException e) {
                    return record(unreachable(attempt, "health probe failed: " + e));
                }
            }
        }
    }

    private HealthStatus unreachable(int attempts, String detail) {
        return new HealthStatus(AuthorityState.UNREACHABLE, false, clock.instant(), attempts, detail);
    }

    private HealthStatus record(HealthStatus status) {
        transition(status.state(), status.detail(), status.timestamp(), "probe", status.attempts());
        return status;
    }

    /**
     * Degrades the view after a remote call elsewhere in the engine failed. Does nothing when the
     * authority is already considered unreachable.
     */
    public void reportFailure(String cause) {
        transition(AuthorityState.UNREACHABLE, cause, clock.instant(), "report", 0);
    }

    private void transition(AuthorityState next, String detail, Instant at, String trigger, int attempts) {
        AuthorityState previous;
        Source previousSource;
        Source nextSource;
        synchronized (this) {
            previous = state;
            previousSource = activeSource;
            state = next;
            lastCheck = at;
            lastError = next.isHealthy() ? null : detail;
            if (next.isHealthy()) {
                activeSource = Source.REMOTE;
            } else if (previous.isHealthy()) {
                activeSource = Source.LOCAL;
            }
            nextSource = activeSource;
        }
        if (previous == next && previousSource == nextSource) {
            return;
        }
        String action;
        if (next.isHealthy() && !previous.isHealthy()) {
            action = "health.recovered";
        } else if (!next.isHealthy() && previous.isHealthy()) {
            action = "health.degraded";
        } else {
            action = "health.state_changed";
        }
        try {
            audit.log(AuditEvent.system(action, "authority", next.name().toLowerCase(Locale.ROOT), AuditEvent.details(
                    "from", previous.name(),
                    "to", next.name(),
                    "active_source", nextSource.wireName(),
                    "trigger", trigger,
                    "attempts", attempts,
                    "detail", detail
            )));
            synchronized (this) {
                lastAuditError = null;
            }
        } catch (RuntimeException e) {
            // Probes never throw; the state change above is already in effect.
            synchronized (this) {
                lastAuditError = action + ": " + e.getMessage();
            }
        }
    }

    public synchronized HealthView getStatus() {
        return new HealthView(activeSource, state.isHealthy(), state, lastCheck, lastError);
    }

    public synchronized String lastAuditError() {
        return lastAuditError;
    }

    public synchronized Source activeSource() {
        return activeSource;
    }

    public synchronized boolean isHealthy() {
        return state.isHealthy();
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "possync-health-monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::probe, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = scheduler;
            scheduler = null;
        }
        if (current == null) {
            return;
        }
        current.shutdownNow();
        try {
            current.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
