package io.possync.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class PosSyncConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_BASE_URL = "https://byd-pos-middleware.vercel.app";
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 15_000L;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_LOGOUT_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_HEALTH_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_HEALTH_PROBE_ATTEMPTS = 4;
    public static final long DEFAULT_HEALTH_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_HEALTH_MAX_BACKOFF_MS = 16_000L;
    public static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_SYNC_THROTTLE_MS = 60L * 60L * 1000L;
    public static final int DEFAULT_REQUEST_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_REQUEST_BASE_BACKOFF_MS = 500L;

    private final Path rootDir;

    public PosSyncConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static PosSyncConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new PosSyncConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("pos_system.db");
    }

    public Path stateFile() {
        return rootDir.resolve("session-state.json");
    }

    public Path settingsFile() {
        return rootDir.resolve("possync-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
