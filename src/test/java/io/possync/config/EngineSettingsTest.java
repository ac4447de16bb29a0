package io.possync.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class EngineSettingsTest {

    @Test
    void outOfRangeValuesFallBackPerField() {
        EngineSettings defaults = EngineSettings.defaults();
        EngineSettings.SettingsFile file = new EngineSettings.SettingsFile("not a url", 50L, 2_000L, null, null,
                2, 500L, 100L, 10L, 0L, 0, -1L, null);

        EngineSettings resolved = EngineSettings.fromFile(file, defaults);

        Assertions.assertEquals(defaults.baseUrl(), resolved.baseUrl());
        Assertions.assertEquals(defaults.requestTimeoutMs(), resolved.requestTimeoutMs());
        Assertions.assertEquals(2_000L, resolved.connectTimeoutMs());
        Assertions.assertEquals(2, resolved.healthProbeAttempts());
        Assertions.assertEquals(500L, resolved.healthBaseBackoffMs());
        Assertions.assertEquals(defaults.healthMaxBackoffMs(), resolved.healthMaxBackoffMs());
        Assertions.assertEquals(defaults.healthCheckIntervalMs(), resolved.healthCheckIntervalMs());
        Assertions.assertEquals(0L, resolved.syncThrottleMs());
        Assertions.assertEquals(defaults.requestMaxAttempts(), resolved.requestMaxAttempts());
        Assertions.assertEquals(defaults.requestBaseBackoffMs(), resolved.requestBaseBackoffMs());
        Assertions.assertTrue(resolved.seedDemoData());
        Assertions.assertSame(defaults, EngineSettings.fromFile(null, defaults));
    }

    @Test
    void defaultsMatchTheDeployedAuthority() {
        EngineSettings defaults = EngineSettings.defaults();
        Assertions.assertEquals("https://byd-pos-middleware.vercel.app", defaults.baseUrl());
        Assertions.assertEquals(4, defaults.healthRetryPolicy().maxAttempts());
        Assertions.assertEquals(3_600_000L, defaults.syncThrottle().toMillis());
        Assertions.assertEquals("http://10.0.2.2:3000", defaults.withBaseUrl("http://10.0.2.2:3000//").baseUrl());
        Assertions.assertEquals(defaults.baseUrl(), defaults.withBaseUrl("  ").baseUrl());
    }
}
