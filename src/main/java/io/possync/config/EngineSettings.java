package io.possync.config;

import io.possync.util.RetryPolicy;

import java.net.URI;
import java.time.Duration;

public record EngineSettings(
        String baseUrl,
        long requestTimeoutMs,
        long connectTimeoutMs,
        long logoutTimeoutMs,
        long healthTimeoutMs,
        int healthProbeAttempts,
        long healthBaseBackoffMs,
        long healthMaxBackoffMs,
        long healthCheckIntervalMs,
        long syncThrottleMs,
        int requestMaxAttempts,
        long requestBaseBackoffMs,
        boolean seedDemoData
) {
    public static EngineSettings defaults() {
        return new EngineSettings(
                PosSyncConfig.DEFAULT_BASE_URL,
                PosSyncConfig.DEFAULT_REQUEST_TIMEOUT_MS,
                PosSyncConfig.DEFAULT_CONNECT_TIMEOUT_MS,
                PosSyncConfig.DEFAULT_LOGOUT_TIMEOUT_MS,
                PosSyncConfig.DEFAULT_HEALTH_TIMEOUT_MS,
                PosSyncConfig.DEFAULT_HEALTH_PROBE_ATTEMPTS,
                PosSyncConfig.DEFAULT_HEALTH_BASE_BACKOFF_MS,
                PosSyncConfig.DEFAULT_HEALTH_MAX_BACKOFF_MS,
                PosSyncConfig.DEFAULT_HEALTH_CHECK_INTERVAL_MS,
                PosSyncConfig.DEFAULT_SYNC_THROTTLE_MS,
                PosSyncConfig.DEFAULT_REQUEST_MAX_ATTEMPTS,
                PosSyncConfig.DEFAULT_REQUEST_BASE_BACKOFF_MS,
                true
        );
    }

    public static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        String baseUrl = sanitizeUrl(file.baseUrl(), defaults.baseUrl());
        long healthBase = sanitizeLong(file.healthBaseBackoffMs(), defaults.healthBaseBackoffMs(), 0L);
        long healthMax = sanitizeLong(file.healthMaxBackoffMs(), defaults.healthMaxBackoffMs(), healthBase);
        if (healthMax < healthBase) {
            healthMax = healthBase;
        }
        return new EngineSettings(
                baseUrl,
                sanitizeLong(file.requestTimeoutMs(), defaults.requestTimeoutMs(), 100L),
                sanitizeLong(file.connectTimeoutMs(), defaults.connectTimeoutMs(), 100L),
                sanitizeLong(file.logoutTimeoutMs(), defaults.logoutTimeoutMs(), 100L),
                sanitizeLong(file.healthTimeoutMs(), defaults.healthTimeoutMs(), 100L),
                sanitizeInt(file.healthProbeAttempts(), defaults.healthProbeAttempts(), 1),
                healthBase,
                healthMax,
                sanitizeLong(file.healthCheckIntervalMs(), defaults.healthCheckIntervalMs(), 1_000L),
                sanitizeLong(file.syncThrottleMs(), defaults.syncThrottleMs(), 0L),
                sanitizeInt(file.requestMaxAttempts(), defaults.requestMaxAttempts(), 1),
                sanitizeLong(file.requestBaseBackoffMs(), defaults.requestBaseBackoffMs(), 0L),
                file.seedDemoData() == null ? defaults.seedDemoData() : file.seedDemoData()
        );
    }

    public EngineSettings withBaseUrl(String url) {
        return new EngineSettings(sanitizeUrl(url, baseUrl), requestTimeoutMs, connectTimeoutMs, logoutTimeoutMs,
                healthTimeoutMs, healthProbeAttempts, healthBaseBackoffMs, healthMaxBackoffMs, healthCheckIntervalMs,
                syncThrottleMs, requestMaxAttempts, requestBaseBackoffMs, seedDemoData);
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration logoutTimeout() {
        return Duration.ofMillis(logoutTimeoutMs);
    }

    public Duration healthTimeout() {
        return Duration.ofMillis(healthTimeoutMs);
    }

    public Duration syncThrottle() {
        return Duration.ofMillis(syncThrottleMs);
    }

    public RetryPolicy healthRetryPolicy() {
        return new RetryPolicy(healthProbeAttempts, healthBaseBackoffMs, healthMaxBackoffMs);
    }

    public RetryPolicy requestRetryPolicy() {
        long max = Math.max(requestBaseBackoffMs, requestBaseBackoffMs * 8L);
        return new RetryPolicy(requestMaxAttempts, requestBaseBackoffMs, max);
    }

    private static String sanitizeUrl(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        try {
            URI uri = URI.create(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return fallback;
            }
            return value;
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    public record SettingsFile(
            String baseUrl,
            Long requestTimeoutMs,
            Long connectTimeoutMs,
            Long logoutTimeoutMs,
            Long healthTimeoutMs,
            Integer healthProbeAttempts,
            Long healthBaseBackoffMs,
            Long healthMaxBackoffMs,
            Long healthCheckIntervalMs,
            Long syncThrottleMs,
            Integer requestMaxAttempts,
            Long requestBaseBackoffMs,
            Boolean seedDemoData
    ) {
    }
}
