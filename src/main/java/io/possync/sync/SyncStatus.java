package io.possync.sync;

import io.possync.model.Source;

import java.time.Duration;
import java.time.Instant;

public record SyncStatus(
        Instant lastSyncAt,
        Source activeSource,
        boolean healthy,
        Duration throttleWindow,
        boolean inFlight,
        SyncOutcome lastResult,
        String lastError
) {
}
