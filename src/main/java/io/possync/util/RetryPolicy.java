package io.possync.util;

public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseBackoffMs < 0L || maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("invalid backoff bounds: base=" + baseBackoffMs + ", max=" + maxBackoffMs);
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, 0L, 0L);
    }

    public boolean hasAttemptAfter(int attempt) {
        return attempt < maxAttempts;
    }

    public long delayAfterAttempt(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        return Math.min(backoff, maxBackoffMs);
    }
}
