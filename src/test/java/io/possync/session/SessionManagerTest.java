package io.possync.session;

import io.possync.model.EntityKind;
import io.possync.model.Identity;
import io.possync.model.Role;
import io.possync.model.Session;
import io.possync.model.Source;
import io.possync.observability.AuditLogger;
import io.possync.storage.KeyValueStore;
import io.possync.storage.LocalStore;
import io.possync.support.Fixtures;
import io.possync.support.MutableClock;
import io.possync.support.TestDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

final class SessionManagerTest {

    @Test
    void cashierCannotSwitch() throws Exception {
        Path root = TestDirs.create("session-cashier");
        try {
            Harness h = new Harness(root);
            Session before = h.signIn("user-003", Source.LOCAL);
            Set<String> keysBefore = h.state.keys();
            String fileBefore = Files.readString(h.state.file());

            Assertions.assertThrows(ImpersonationDeniedException.class,
                    () -> h.sessions.switchTo(h.identity("user-004"), "password123"));

            Assertions.assertEquals(before, h.sessions.getSession().orElseThrow());
            Assertions.assertEquals(keysBefore, h.state.keys());
            Assertions.assertEquals(fileBefore, Files.readString(h.state.file()));
            Assertions.assertEquals("denied", h.audit.tail(1).get(0).path("result").asText());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void managerSwitchesToCashierAndBack() throws Exception {
        Path root = TestDirs.create("session-round-trip");
        try {
            Harness h = new Harness(root);
            Session original = h.signIn("user-002", Source.REMOTE);

            Session acting = h.sessions.switchTo(h.identity("user-003"), "password123");
            Assertions.assertEquals("user-003", acting.identity().id());
            Assertions.assertEquals("user-002", acting.originalIdentity().id());
            Assertions.assertEquals(original.token(), acting.token());
            Assertions.assertEquals(Source.REMOTE, acting.source());
            Assertions.assertEquals(original.createdAt(), acting.createdAt());
            Assertions.assertTrue(acting.isActing());
            Assertions.assertNull(acting.identity().passwordHash());

            Session restored = h.sessions.switchBack();
            Assertions.assertEquals(original, restored);
            Assertions.assertFalse(restored.isActing());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void restartWhileActingResumesTheSameSession() throws Exception {
        Path root = TestDirs.create("session-restart");
        try {
            Harness h = new Harness(root);
            Session original = h.signIn("user-001", Source.LOCAL);
            Session acting = h.sessions.switchTo(h.identity("user-005"), "password123");

            SessionManager restarted = new SessionManager(new KeyValueStore(h.state.file()), h.store, h.audit, h.clock);
            Assertions.assertEquals(acting, restarted.restore().orElseThrow());
            Assertions.assertEquals(original, restarted.switchBack());
            Assertions.assertEquals(original,
                    new SessionManager(new KeyValueStore(h.state.file()), h.store, h.audit, h.clock).restore().orElseThrow());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void actingIsOneLevelDeep() throws Exception {
        Path root = TestDirs.create("session-nested");
        try {
            Harness h = new Harness(root);
            h.signIn("user-001", Source.LOCAL);
            Session acting = h.sessions.switchTo(h.identity("user-002"), "password123");

            Assertions.assertThrows(ImpersonationDeniedException.class,
                    () -> h.sessions.switchTo(h.identity("user-003"), "password123"));
            Assertions.assertEquals(acting, h.sessions.getSession().orElseThrow());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void switchBackWithoutActingFails() throws Exception {
        Path root = TestDirs.create("session-switch-back");
        try {
            Harness h = new Harness(root);
            Assertions.assertThrows(IllegalStateException.class, h.sessions::switchBack);
            h.signIn("user-002", Source.LOCAL);
            IllegalStateException error = Assertions.assertThrows(IllegalStateException.class, h.sessions::switchBack);
            Assertions.assertEquals("Not acting as another identity", error.getMessage());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void managerStaysInsideCompanyAndBelowAdmin() throws Exception {
        Path root = TestDirs.create("session-company");
        try {
            Harness h = new Harness(root);
            h.store.upsertBatch(EntityKind.IDENTITY, List.of(
                    Fixtures.identity("user-900", "other@elsewhere.com", Role.CASHIER, "company-002", "store-900"),
                    Fixtures.identity("user-901", "off@techcorp.com", Role.CASHIER, "company-001", "store-001")));
            h.store.upsertBatch(EntityKind.IDENTITY, List.of(new Identity("user-901", "Off Duty", "off@techcorp.com",
                    null, Role.CASHIER, "company-001", "store-001", null, false, null)));
            Session before = h.signIn("user-002", Source.LOCAL);

            Assertions.assertThrows(ImpersonationDeniedException.class,
                    () -> h.sessions.switchTo(h.identity("user-900"), "password123"));
            Assertions.assertThrows(ImpersonationDeniedException.class,
                    () -> h.sessions.switchTo(h.identity("user-001"), "password123"));
            Assertions.assertThrows(ImpersonationDeniedException.class,
                    () -> h.sessions.switchTo(h.identity("user-901"), "password123"));
            Assertions.assertThrows(ImpersonationDeniedException.class,
                    () -> h.sessions.switchTo(h.identity("user-002"), "password123"));
            Assertions.assertThrows(ImpersonationDeniedException.class,
                    () -> h.sessions.switchTo(null, "password123"));
            Assertions.assertEquals(before, h.sessions.getSession().orElseThrow());

            Session acting = h.sessions.switchTo(h.identity("user-005"), "password123");
            Assertions.assertEquals(Role.MANAGER, acting.identity().role());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void wrongPasscodeIsDenied() throws Exception {
        Path root = TestDirs.create("session-passcode");
        try {
            Harness h = new Harness(root);
            Session before = h.signIn("user-002", Source.LOCAL);

            ImpersonationDeniedException error = Assertions.assertThrows(ImpersonationDeniedException.class,
                    () -> h.sessions.switchTo(h.identity("user-003"), "not-it"));
            Assertions.assertTrue(error.getMessage().startsWith("Invalid passcode"));
            Assertions.assertEquals(before, h.sessions.getSession().orElseThrow());
            Assertions.assertFalse(Files.readString(h.audit.file()).contains("not-it"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void clearForgetsEverything() throws Exception {
        Path root = TestDirs.create("session-clear");
        try {
            Harness h = new Harness(root);
            h.signIn("user-002", Source.REMOTE);
            h.state.putString("last_sync_at", "2026-10-19T07:00:00Z");

            h.sessions.clear();

            Assertions.assertTrue(h.sessions.getSession().isEmpty());
            Assertions.assertTrue(h.sessions.currentToken().isEmpty());
            Assertions.assertEquals(Set.of("last_sync_at"), new KeyValueStore(h.state.file()).keys());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void partialRecordIsDiscardedOnRestore() throws Exception {
        Path root = TestDirs.create("session-partial");
        try {
            Harness h = new Harness(root);
            h.state.putString(SessionManager.AUTH_TOKEN, "offline_token_1");

            Assertions.assertTrue(h.sessions.restore().isEmpty());
            Assertions.assertTrue(h.state.keys().isEmpty());
            Assertions.assertEquals("session.restore_discarded", h.audit.tail(1).get(0).path("action").asText());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void missingSourceIsInferredFromTheToken() throws Exception {
        Path root = TestDirs.create("session-infer");
        try {
            Harness h = new Harness(root);
            h.state.put(SessionManager.AUTH_USER, SessionManager.identityNode(h.identity("user-003")));
            h.state.putString(SessionManager.AUTH_TOKEN, "offline_token_1760860800000");

            Session restored = h.sessions.restore().orElseThrow();
            Assertions.assertEquals(Source.LOCAL, restored.source());
            Assertions.assertEquals(h.clock.instant(), restored.createdAt());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    private static final class Harness {
        final MutableClock clock = MutableClock.startingAt("2026-10-19T08:00:00Z");
        final LocalStore store;
        final KeyValueStore state;
        final AuditLogger audit;
        final SessionManager sessions;

        Harness(Path root) {
            store = Fixtures.seededStore(root, clock);
            state = new KeyValueStore(root.resolve("session-state.json"));
            audit = Fixtures.audit(root, clock);
            sessions = new SessionManager(state, store, audit, clock);
        }

        Identity identity(String id) {
            return store.findIdentityById(id).orElseThrow();
        }

        Session signIn(String id, Source source) {
            String token = source == Source.LOCAL ? "offline_token_" + clock.millis() : "jwt-" + id;
            return sessions.setSession(identity(id), token, source);
        }
    }
}
