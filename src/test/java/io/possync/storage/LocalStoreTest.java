package io.possync.storage;

import io.possync.model.CatalogItem;
import io.possync.model.DataScope;
import io.possync.model.EntityKind;
import io.possync.model.Identity;
import io.possync.model.MovementType;
import io.possync.model.Role;
import io.possync.model.StockMovement;
import io.possync.model.Transaction;
import io.possync.model.TransactionLine;
import io.possync.support.Fixtures;
import io.possync.support.MutableClock;
import io.possync.support.TestDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

final class LocalStoreTest {

    @Test
    void ensureSchemaIsIdempotentAndKeepsRows() throws Exception {
        Path root = TestDirs.create("schema");
        try {
            MutableClock clock = MutableClock.startingAt("2026-10-19T08:00:00Z");
            LocalStore store = Fixtures.seededStore(root, clock);
            Set<String> tables = store.database().tableNames();
            Assertions.assertTrue(tables.containsAll(Set.of("stores", "categories", "users", "products", "customers",
                    "sales", "sale_items", "inventory_movements", "sync_runs", "schema_migrations")));
            Assertions.assertEquals(5, store.countRows(EntityKind.IDENTITY));
            Assertions.assertEquals(14, store.countRows(EntityKind.CATALOG_ITEM));
            Assertions.assertEquals(5, store.listCategories().size());

            store.upsertBatch(EntityKind.CATEGORY, List.of(Fixtures.category("cat-900", "Seasonal")));
            String before = store.mirrorDigest();

            store.ensureSchema();
            LocalStore reopened = Fixtures.seededStore(root, clock);

            Assertions.assertEquals(tables, reopened.database().tableNames());
            Assertions.assertEquals(before, reopened.mirrorDigest());
            Assertions.assertEquals(6, reopened.countRows(EntityKind.CATEGORY));
            Assertions.assertEquals(1, reopened.database().listSchemaMigrations().size());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void seededAdministratorVerifiesOffline() throws Exception {
        Path root = TestDirs.create("credential");
        try {
            MutableClock clock = MutableClock.startingAt("2026-10-19T08:00:00Z");
            LocalStore store = Fixtures.seededStore(root, clock);

            Optional<Identity> admin = store.verifyCredential("  Admin@TechCorp.com ", "password123");
            Assertions.assertTrue(admin.isPresent());
            Assertions.assertEquals("user-001", admin.get().id());
            Assertions.assertEquals(Role.SUPER_ADMIN, admin.get().role());
            Assertions.assertNull(admin.get().passwordHash());
            Assertions.assertEquals(Instant.parse("2026-10-19T08:00:00Z"), admin.get().lastLoginAt());
            Assertions.assertEquals(Instant.parse("2026-10-19T08:00:00Z"),
                    store.findIdentityByEmail("admin@techcorp.com").orElseThrow().lastLoginAt());

            Assertions.assertTrue(store.verifyCredential("admin@techcorp.com", "password124").isEmpty());
            Assertions.assertTrue(store.verifyCredential("nobody@techcorp.com", "password123").isEmpty());
            Assertions.assertTrue(store.verifyCredential("admin@techcorp.com", "").isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void inactiveIdentityIsRefused() throws Exception {
        Path root = TestDirs.create("inactive");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            Identity jane = new Identity("user-004", "Jane Cashier", "jane@techcorp.com", "password123",
                    Role.CASHIER, "company-001", "store-001", null, false, null);
            store.upsertBatch(EntityKind.IDENTITY, List.of(jane));

            Assertions.assertTrue(store.verifyCredential("jane@techcorp.com", "password123").isEmpty());
            Assertions.assertFalse(store.verifyPasscode("user-004", "password123"));
            Assertions.assertTrue(store.verifyPasscode("user-003", "password123"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void identityUpsertKeepsCredentialWhenNoneIsDelivered() throws Exception {
        Path root = TestDirs.create("credential-keep");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            Identity renamed = new Identity("user-003", "John C.", "cashier@techcorp.com", null,
                    Role.CASHIER, "company-001", "store-001", null, true, null);
            store.upsertBatch(EntityKind.IDENTITY, List.of(renamed));

            Assertions.assertEquals("John C.", store.findIdentityById("user-003").orElseThrow().name());
            Assertions.assertTrue(store.verifyCredential("cashier@techcorp.com", "password123").isPresent());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void remoteIdentityReplacesSeededRowWithSameEmail() throws Exception {
        Path root = TestDirs.create("identity-remap");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            Identity remote = new Identity("42", "Store Manager", "manager@techcorp.com", "remote-secret",
                    Role.MANAGER, "company-001", "store-001", null, true, null);
            store.upsertBatch(EntityKind.IDENTITY, List.of(remote));

            Assertions.assertTrue(store.findIdentityById("user-002").isEmpty());
            Assertions.assertEquals("42", store.findIdentityByEmail("manager@techcorp.com").orElseThrow().id());
            Assertions.assertEquals(5, store.countRows(EntityKind.IDENTITY));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void readsAreScopedByRole() throws Exception {
        Path root = TestDirs.create("scope");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            store.upsertBatch(EntityKind.CATALOG_ITEM, List.of(Fixtures.item("prod-900", "store-002", 2.0, 10, 1)));

            Identity cashier = store.findIdentityById("user-003").orElseThrow();
            Identity branchManager = store.findIdentityById("user-005").orElseThrow();
            Identity admin = store.findIdentityById("user-001").orElseThrow();

            Assertions.assertEquals(14, store.listCatalogItems(cashier.scope()).size());
            Assertions.assertEquals(15, store.listCatalogItems(branchManager.scope()).size());
            Assertions.assertEquals(15, store.listCatalogItems(admin.scope()).size());
            Assertions.assertEquals(List.of("prod-900"), store.listCatalogItems(DataScope.store("store-002")).stream()
                    .map(CatalogItem::id).toList());
            Assertions.assertTrue(store.listCatalogItems(DataScope.store("store-404")).isEmpty());
            Assertions.assertEquals(4, store.listCounterparties(cashier.scope()).size());
            Assertions.assertEquals(5, store.listIdentities(admin.scope()).size());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void stockMovementsDriveLowStock() throws Exception {
        Path root = TestDirs.create("low-stock");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            DataScope main = DataScope.store("store-001");
            Assertions.assertTrue(store.findLowStock(main).isEmpty());

            StockMovement out = store.applyStockMovement(StockMovement.request(null, "prod-006", MovementType.OUT, -17,
                    "adjustment", null, "spoilage", "user-002"));
            Assertions.assertEquals(20, out.previousStock());
            Assertions.assertEquals(3, out.newStock());
            Assertions.assertEquals("store-001", out.storeId());
            Assertions.assertEquals(List.of("prod-006"), store.findLowStock(main).stream().map(CatalogItem::id).toList());

            store.applyStockMovement(StockMovement.request(null, "prod-006", MovementType.IN, 10,
                    "purchase", null, null, "user-002"));
            Assertions.assertTrue(store.findLowStock(main).isEmpty());
            Assertions.assertEquals(13, store.findCatalogItem("prod-006").orElseThrow().stockQuantity());
            Assertions.assertEquals(2, store.listStockMovements("prod-006").size());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void invalidStockMovementsChangeNothing() throws Exception {
        Path root = TestDirs.create("stock-reject");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            String before = store.mirrorDigest();

            IllegalStateException insufficient = Assertions.assertThrows(IllegalStateException.class,
                    () -> store.applyStockMovement(StockMovement.request(null, "prod-006", MovementType.OUT, -21,
                            null, null, null, "user-002")));
            Assertions.assertTrue(insufficient.getMessage().contains("Insufficient stock"));

            IllegalArgumentException unknown = Assertions.assertThrows(IllegalArgumentException.class,
                    () -> store.applyStockMovement(StockMovement.request(null, "prod-404", MovementType.IN, 1,
                            null, null, null, "user-002")));
            Assertions.assertEquals("Unknown catalog item: prod-404", unknown.getMessage());

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> store.applyStockMovement(StockMovement.request(null, "prod-006", MovementType.IN, -1,
                            null, null, null, "user-002")));
            Assertions.assertEquals(before, store.mirrorDigest());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void localSaleStaysPendingUntilTheAuthorityDeliversIt() throws Exception {
        Path root = TestDirs.create("local-sale");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            Transaction sale = Fixtures.sale("sale-100", "store-001", "user-003", 15.99);
            List<TransactionLine> lines = Fixtures.lines(
                    Fixtures.line("line-1", "sale-100", "prod-001", 2, 3.50),
                    Fixtures.line("line-2", "sale-100", "prod-005", 1, 8.99));

            Transaction stored = store.recordLocalSale(sale, lines, "user-003");
            Assertions.assertNotNull(stored.createdAt());
            Assertions.assertTrue(store.isPendingSync("sale-100"));
            Assertions.assertEquals(List.of("sale-100"),
                    store.listPendingTransactions().stream().map(Transaction::id).toList());
            Assertions.assertEquals(98, store.findCatalogItem("prod-001").orElseThrow().stockQuantity());
            Assertions.assertEquals(24, store.findCatalogItem("prod-005").orElseThrow().stockQuantity());
            Assertions.assertEquals(2, store.findTransactionLines("sale-100").size());
            Identity cashier = store.findIdentityById("user-003").orElseThrow();
            Assertions.assertEquals(List.of("sale-100"),
                    store.listTransactions(cashier.scope(), 10).stream().map(Transaction::id).toList());
            Assertions.assertTrue(store.listTransactions(DataScope.store("store-002"), 10).isEmpty());

            List<StockMovement> movements = store.listStockMovements("prod-001");
            Assertions.assertEquals(1, movements.size());
            Assertions.assertEquals(MovementType.SALE, movements.get(0).type());
            Assertions.assertEquals(-2, movements.get(0).delta());
            Assertions.assertEquals("sale-100", movements.get(0).referenceId());

            store.upsertBatch(EntityKind.TRANSACTION, List.of(sale));
            Assertions.assertFalse(store.isPendingSync("sale-100"));
            Assertions.assertTrue(store.listPendingTransactions().isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void localSaleRollsBackWhenStockRunsOut() throws Exception {
        Path root = TestDirs.create("local-sale-rollback");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            String before = store.mirrorDigest();
            Transaction sale = Fixtures.sale("sale-101", "store-001", "user-003", 3.50 + 9.50 * 30);
            List<TransactionLine> lines = Fixtures.lines(
                    Fixtures.line("line-1", "sale-101", "prod-001", 1, 3.50),
                    Fixtures.line("line-2", "sale-101", "prod-006", 30, 9.50));

            Assertions.assertThrows(IllegalStateException.class, () -> store.recordLocalSale(sale, lines, "user-003"));
            Assertions.assertEquals(before, store.mirrorDigest());
            Assertions.assertFalse(store.isPendingSync("sale-101"));

            Assertions.assertThrows(IllegalArgumentException.class, () -> store.recordLocalSale(
                    Fixtures.sale("sale-102", "store-001", "user-003", 10.0),
                    Fixtures.lines(Fixtures.line("line-3", "sale-102", "prod-001", 1, 3.50)), "user-003"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void mismatchedLineTotalsAreAConstraintViolation() throws Exception {
        Path root = TestDirs.create("line-totals");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            String before = store.mirrorDigest();
            Transaction sale = Fixtures.sale("sale-200", "store-001", "user-003", 20.00);
            TransactionLine line = Fixtures.line("sale-200:0", "sale-200", "prod-001", 2, 3.50);

            Assertions.assertThrows(StoreConstraintException.class, () -> store.inTransaction(c -> {
                store.upsertBatch(c, EntityKind.TRANSACTION, List.of(sale));
                store.upsertBatch(c, EntityKind.TRANSACTION_LINE, List.of(line));
                store.verifyLineTotals(c, List.of("sale-200"));
                return null;
            }));
            Assertions.assertEquals(before, store.mirrorDigest());

            TransactionLine orphan = Fixtures.line("x:0", "sale-404", "prod-001", 1, 3.50);
            Assertions.assertThrows(StoreConstraintException.class,
                    () -> store.upsertBatch(EntityKind.TRANSACTION_LINE, List.of(orphan)));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void syncRunsAreListedNewestFirst() throws Exception {
        Path root = TestDirs.create("sync-runs");
        try {
            LocalStore store = Fixtures.seededStore(root, MutableClock.startingAt("2026-10-19T08:00:00Z"));
            store.recordSyncRun(new LocalStore.SyncRun(1L, 2L, true, "success", "{\"users\":5}", null));
            store.recordSyncRun(new LocalStore.SyncRun(3L, 4L, false, "failed", null, "boom"));

            List<LocalStore.SyncRun> runs = store.listSyncRuns(10);
            Assertions.assertEquals(2, runs.size());
            Assertions.assertEquals("failed", runs.get(0).outcome());
            Assertions.assertEquals("{}", runs.get(0).countsJson());
            Assertions.assertEquals("boom", runs.get(0).error());
            Assertions.assertTrue(runs.get(1).forced());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }
}
