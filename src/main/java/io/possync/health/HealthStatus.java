package io.possync.health;

import java.time.Instant;

public record HealthStatus(
        AuthorityState state,
        boolean databaseOk,
        Instant timestamp,
        int attempts,
        String detail
) {
    public boolean reachable() {
        return state != AuthorityState.UNREACHABLE;
    }

    public boolean healthy() {
        return state.isHealthy();
    }
}
