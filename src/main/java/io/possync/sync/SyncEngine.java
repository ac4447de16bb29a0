package io.possync.sync;

import io.possync.health.HealthMonitor;
import io.possync.model.EntityKind;
import io.possync.model.Transaction;
import io.possync.observability.AuditLogger;
import io.possync.observability.AuditLogger.AuditEvent;
import io.possync.remote.RemoteClient;
import io.possync.remote.RemoteException;
import io.possync.remote.SyncPayload;
import io.possync.storage.KeyValueStore;
import io.possync.storage.LocalStore;
import io.possync.storage.StoreConstraintException;
import io.possync.util.Jsons;
import io.possync.util.Timestamps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Pulls the authority's full dataset and merges it into the local store in one transaction.
 *
 * <p>Non-forced requests inside the throttle window are answered from the last result without a
 * network call. Requests arriving while a merge is running share that merge's future. Every real
 * attempt is written to {@code sync_runs} and the audit log, and a failed one degrades the
 * {@link HealthMonitor}.
 */
public final class SyncEngine implements AutoCloseable {
    public static final String LAST_SYNC_KEY = "last_sync_at";

    private final RemoteClient remote;
    private final LocalStore store;
    private final KeyValueStore state;
    private final HealthMonitor health;
    private final AuditLogger audit;
    private final Clock clock;
    private final Duration throttleWindow;
    private final Supplier<String> tokenSupplier;
    private final ExecutorService executor;

    private Instant lastSyncAt;
    private SyncOutcome lastResult;
    private String lastError;
    private CompletableFuture<SyncOutcome> inFlight;

    public SyncEngine(RemoteClient remote, LocalStore store, KeyValueStore state, HealthMonitor health,
                      AuditLogger audit, Clock clock, Duration throttleWindow, Supplier<String> tokenSupplier) {
        this.remote = remote;
        this.store = store;
        this.state = state;
        this.health = health;
        this.audit = audit;
        this.clock = clock;
        this.throttleWindow = throttleWindow;
        this.tokenSupplier = tokenSupplier;
        this.lastSyncAt = Timestamps.parseLenient(state.getString(LAST_SYNC_KEY).orElse(null));
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "possync-sync");
            t.setDaemon(true);
            return t;
        });
    }

    public SyncOutcome syncAll(boolean force) {
        return syncAll(force, tokenSupplier.get());
    }

    /**
     * Blocks until the merge this request maps to has finished.
     *
     * @throws SyncFailedException   when the pull failed
     * @throws SyncConflictException when the pulled data broke a local constraint
     */
    public SyncOutcome syncAll(boolean force, String token) {
        try {
            return submit(force, token).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SyncFailedException("Sync failed: " + cause, cause);
        }
    }

    public CompletableFuture<SyncOutcome> syncInBackground(boolean force) {
        return submit(force, tokenSupplier.get());
    }

    private synchronized CompletableFuture<SyncOutcome> submit(boolean force, String token) {
        if (inFlight != null) {
            return inFlight;
        }
        Instant now = clock.instant();
        if (!force && lastSyncAt != null && Duration.between(lastSyncAt, now).compareTo(throttleWindow) < 0) {
            return CompletableFuture.completedFuture(new SyncOutcome(false,
                    lastResult == null ? Map.of() : lastResult.counts(), lastSyncAt));
        }
        CompletableFuture<SyncOutcome> future = CompletableFuture.supplyAsync(() -> runSync(force, token), executor);
        inFlight = future;
        future.whenComplete((result, error) -> clearInFlight(future));
        return future;
    }

    private synchronized void clearInFlight(CompletableFuture<SyncOutcome> finished) {
        if (inFlight == finished) {
            inFlight = null;
        }
    }

    private SyncOutcome runSync(boolean force, String token) {
        long startedAtMs = clock.millis();
        SyncPayload payload;
        try {
            payload = remote.pullAll(token);
        } catch (RemoteException e) {
            SyncFailedException failure = new SyncFailedException("Sync failed: " + e.getMessage(), e);
            recordFailure(startedAtMs, force, failure);
            throw failure;
        }
        Map<EntityKind, Integer> counts = new EnumMap<>(EntityKind.class);
        try {
            store.inTransaction(c -> {
                for (EntityKind kind : EntityKind.MERGE_ORDER) {
                    List<?> rows = payload.rows(kind);
                    store.upsertBatch(c, kind, rows);
                    counts.put(kind, rows.size());
                }
                store.verifyLineTotals(c, payload.transactions().stream().map(Transaction::id).toList());
                return null;
            });
        } catch (StoreConstraintException e) {
            SyncConflictException conflict = new SyncConflictException("Sync merge rejected: " + e.getMessage(), e);
            recordFailure(startedAtMs, force, conflict);
            throw conflict;
        } catch (RuntimeException e) {
            recordFailure(startedAtMs, force, e);
            throw e;
        }

        Instant at = clock.instant();
        SyncOutcome outcome = new SyncOutcome(true, counts, at);
        state.putString(LAST_SYNC_KEY, at.toString());
        synchronized (this) {
            lastSyncAt = at;
            lastResult = outcome;
            lastError = null;
        }
        String countsJson = Jsons.toCompactJson(outcome.countsByTable());
        store.recordSyncRun(new LocalStore.SyncRun(startedAtMs, at.toEpochMilli(), force, "success", countsJson, null));
        audit.log(AuditEvent.system("sync.completed", "sync", "success", AuditEvent.details(
                "forced", force,
                "counts", outcome.countsByTable(),
                "duration_ms", at.toEpochMilli() - startedAtMs
        )));
        return outcome;
    }

    private void recordFailure(long startedAtMs, boolean force, RuntimeException failure) {
        String message = failure.getMessage();
        synchronized (this) {
            lastError = message;
        }
        health.reportFailure(message);
        try {
            store.recordSyncRun(new LocalStore.SyncRun(startedAtMs, clock.millis(), force,
                    failure instanceof SyncConflictException ? "conflict" : "failed", "{}", message));
            audit.log(AuditEvent.system("sync.failed", "sync", "failure", AuditEvent.details(
                    "forced", force,
                    "error_type", failure.getClass().getSimpleName(),
                    "error", message
            )));
        } catch (RuntimeException bookkeeping) {
            failure.addSuppressed(bookkeeping);
        }
    }

    public synchronized Instant lastSyncAt() {
        return lastSyncAt;
    }

    public SyncStatus getSyncStatus() {
        synchronized (this) {
            return new SyncStatus(lastSyncAt, health.activeSource(), health.isHealthy(), throttleWindow,
                    inFlight != null, lastResult, lastError);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
