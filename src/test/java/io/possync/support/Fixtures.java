package io.possync.support;

import io.possync.config.PosSyncConfig;
import io.possync.model.CatalogItem;
import io.possync.model.Category;
import io.possync.model.Identity;
import io.possync.model.Role;
import io.possync.model.Transaction;
import io.possync.model.TransactionLine;
import io.possync.observability.AuditLogger;
import io.possync.storage.Database;
import io.possync.storage.LocalStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

public final class Fixtures {
    public static final String DEMO_PASSWORD = "password123";

    private Fixtures() {
    }

    public static LocalStore seededStore(Path root, Clock clock) {
        LocalStore store = new LocalStore(new Database(new PosSyncConfig(root)), clock, true);
        store.ensureSchema();
        return store;
    }

    public static AuditLogger audit(Path root, Clock clock) {
        return new AuditLogger(new PosSyncConfig(root).auditFile(), clock);
    }

    public static Identity identity(String id, String email, Role role, String companyId, String storeId) {
        return new Identity(id, email, email, DEMO_PASSWORD, role, companyId, storeId, null, true, null);
    }

    public static Category category(String id, String name) {
        return new Category(id, name, null, null, null, true, null, null);
    }

    public static CatalogItem item(String id, String storeId, double price, int stock, int minStock) {
        return new CatalogItem(id, "Item " + id, null, null, null, "cat-001", storeId, price, price / 2,
                stock, minStock, true, null, null);
    }

    public static Transaction sale(String id, String storeId, String cashierId, double subtotal) {
        return new Transaction(id, "R-" + id, storeId, cashierId, null, null, subtotal, 0.0, 0.0, subtotal,
                "cash", "completed", "completed", null, null, null);
    }

    public static TransactionLine line(String id, String saleId, String itemId, int quantity, double unitPrice) {
        return new TransactionLine(id, saleId, itemId, "Item " + itemId, quantity, unitPrice, quantity * unitPrice, null);
    }

    public static List<TransactionLine> lines(TransactionLine... lines) {
        return List.of(lines);
    }
}
