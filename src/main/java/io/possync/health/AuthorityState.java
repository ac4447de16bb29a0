package io.possync.health;

public enum AuthorityState {
    REACHABLE,
    DEGRADED,
    UNREACHABLE;

    public boolean isHealthy() {
        return switch (this) {
            case REACHABLE -> true;
            case DEGRADED, UNREACHABLE -> false;
        };
    }
}
