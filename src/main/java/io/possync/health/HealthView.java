package io.possync.health;

import io.possync.model.Source;

import java.time.Instant;

public record HealthView(
        Source activeSource,
        boolean healthy,
        AuthorityState state,
        Instant lastCheck,
        String lastError
) {
}
