package io.possync.storage;

import io.possync.model.CatalogItem;
import io.possync.model.Category;
import io.possync.model.Counterparty;
import io.possync.model.DataScope;
import io.possync.model.EntityKind;
import io.possync.model.Identity;
import io.possync.model.MovementType;
import io.possync.model.Role;
import io.possync.model.StockMovement;
import io.possync.model.Store;
import io.possync.model.Transaction;
import io.possync.model.TransactionLine;
import io.possync.util.Hashing;
import io.possync.util.Timestamps;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Typed access to the mirrored point-of-sale tables.
 *
 * <p>Mirrored rows are written in two places only: {@link #upsertBatch(Connection, EntityKind, List)}
 * inside a sync merge, and the offline write path ({@link #recordLocalSale} and
 * {@link #applyStockMovement(StockMovement)}).
 */
public final class LocalStore {
    static final double LINE_TOTAL_TOLERANCE = 0.005;
    private static final int SQLITE_CONSTRAINT = 19;

    private final Database database;
    private final Clock clock;
    private final boolean seedDemoData;

    public LocalStore(Database database, Clock clock, boolean seedDemoData) {
        this.database = database;
        this.clock = clock;
        this.seedDemoData = seedDemoData;
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    public Database database() {
        return database;
    }

    public void ensureSchema() {
        database.init();
        if (seedDemoData && countRows(EntityKind.IDENTITY) == 0) {
            seed();
        }
    }

    boolean seed() {
        return inTransaction(c -> {
            if (countRows(c, EntityKind.IDENTITY) > 0) {
                return false;
            }
            String now = Timestamps.format(clock.instant());
            upsertStores(c, SeedData.stores(now));
            upsertCategories(c, SeedData.categories(now));
            upsertIdentities(c, SeedData.identities());
            upsertCatalogItems(c, SeedData.catalogItems(now));
            upsertCounterparties(c, SeedData.counterparties(now));
            return true;
        });
    }

    public <T> T inTransaction(SqlWork<T> work) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.run(c);
                c.commit();
                return out;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new StoreConstraintException("Local store constraint violated: " + e.getMessage(), e);
            }
            throw new RuntimeException("Failed local store transaction", e);
        }
    }

    static boolean isConstraintViolation(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && (sql.getErrorCode() & 0xff) == SQLITE_CONSTRAINT) {
                return true;
            }
        }
        String message = e.getMessage();
        return message != null && message.contains("SQLITE_CONSTRAINT");
    }

    // ---------------------------------------------------------------- credentials

    /**
     * Offline login check: active identity, exact credential match. Stamps {@code last_login_at} on
     * success and returns the identity without its credential.
     */
    public Optional<Identity> verifyCredential(String email, String password) {
        String normalized = Identity.normalizeEmail(email);
        if (normalized.isEmpty() || password == null || password.isEmpty()) {
            return Optional.empty();
        }
        Optional<Identity> stored = findIdentityWithCredential("email", normalized);
        if (stored.isEmpty() || !stored.get().active()
                || !Hashing.constantTimeEquals(stored.get().passwordHash(), password)) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE users SET last_login_at=? WHERE id=?")) {
            ps.setString(1, Timestamps.format(now));
            ps.setString(2, stored.get().id());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to stamp last login", e);
        }
        return Optional.of(stored.get().withLastLoginAt(now).withoutCredential());
    }

    public boolean verifyPasscode(String identityId, String proof) {
        if (identityId == null || proof == null || proof.isEmpty()) {
            return false;
        }
        return findIdentityWithCredential("id", identityId)
                .filter(Identity::active)
                .map(identity -> Hashing.constantTimeEquals(identity.passwordHash(), proof))
                .orElse(false);
    }

    // ---------------------------------------------------------------- batch upserts

    public int upsertBatch(EntityKind kind, List<?> rows) {
        return inTransaction(c -> upsertBatch(c, kind, rows));
    }

    public int upsertBatch(Connection c, EntityKind kind, List<?> rows) throws SQLException {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        return switch (kind) {
            case STORE -> upsertStores(c, castAll(rows, Store.class, kind));
            case CATEGORY -> upsertCategories(c, castAll(rows, Category.class, kind));
            case IDENTITY -> upsertIdentities(c, castAll(rows, Identity.class, kind));
            case CATALOG_ITEM -> upsertCatalogItems(c, castAll(rows, CatalogItem.class, kind));
            case COUNTERPARTY -> upsertCounterparties(c, castAll(rows, Counterparty.class, kind));
            case TRANSACTION -> upsertTransactions(c, castAll(rows, Transaction.class, kind));
            case TRANSACTION_LINE -> upsertTransactionLines(c, castAll(rows, TransactionLine.class, kind));
            case STOCK_MOVEMENT -> upsertStockMovements(c, castAll(rows, StockMovement.class, kind));
        };
    }

    private static <T> List<T> castAll(List<?> rows, Class<T> type, EntityKind kind) {
        List<T> out = new ArrayList<>(rows.size());
        for (Object row : rows) {
            if (!type.isInstance(row)) {
                throw new IllegalArgumentException("Row for " + kind + " is not a " + type.getSimpleName()
                        + ": " + (row == null ? "null" : row.getClass().getName()));
            }
            out.add(type.cast(row));
        }
        return out;
    }

    private int upsertStores(Connection c, List<Store> rows) throws SQLException {
        String sql = """
                INSERT INTO stores(id,company_id,name,address,phone,is_active,created_at,updated_at)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET company_id=excluded.company_id,name=excluded.name,
                address=excluded.address,phone=excluded.phone,is_active=excluded.is_active,
                created_at=excluded.created_at,updated_at=excluded.updated_at
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (Store s : rows) {
                ps.setString(1, s.id());
                ps.setString(2, s.companyId());
                ps.setString(3, s.name());
                ps.setString(4, s.address());
                ps.setString(5, s.phone());
                ps.setInt(6, s.active() ? 1 : 0);
                ps.setString(7, s.createdAt());
                ps.setString(8, s.updatedAt());
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    private int upsertCategories(Connection c, List<Category> rows) throws SQLException {
        String sql = """
                INSERT INTO categories(id,name,description,color,icon,is_active,created_at,updated_at)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET name=excluded.name,description=excluded.description,
                color=excluded.color,icon=excluded.icon,is_active=excluded.is_active,
                created_at=excluded.created_at,updated_at=excluded.updated_at
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (Category cat : rows) {
                ps.setString(1, cat.id());
                ps.setString(2, cat.name());
                ps.setString(3, cat.description());
                ps.setString(4, cat.color() == null ? "#3b82f6" : cat.color());
                ps.setString(5, cat.icon() == null ? "cube" : cat.icon());
                ps.setInt(6, cat.active() ? 1 : 0);
                ps.setString(7, cat.createdAt());
                ps.setString(8, cat.updatedAt());
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    /**
     * An incoming identity without a credential keeps the one already mirrored. A local row holding the
     * same email under another id (a seeded account, typically) is replaced by the incoming one, and
     * the sales and stock movements it made are handed over to the incoming id.
     */
    private int upsertIdentities(Connection c, List<Identity> rows) throws SQLException {
        Map<String, String> replaced = findReplacedIdentities(c, rows);
        try (PreparedStatement ps = c.prepareStatement("UPDATE users SET email=? WHERE id=?")) {
            for (String oldId : replaced.keySet()) {
                ps.setString(1, "replaced:" + oldId);
                ps.setString(2, oldId);
                ps.addBatch();
            }
            ps.executeBatch();
        }
        String sql = """
                INSERT INTO users(id,name,email,password_hash,role,company_id,store_id,phone,is_active,last_login_at,created_at,updated_at)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET name=excluded.name,email=excluded.email,
                password_hash=COALESCE(excluded.password_hash,users.password_hash),role=excluded.role,
                company_id=excluded.company_id,store_id=excluded.store_id,phone=excluded.phone,
                is_active=excluded.is_active,last_login_at=COALESCE(excluded.last_login_at,users.last_login_at),
                updated_at=excluded.updated_at
                """;
        String now = Timestamps.format(clock.instant());
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (Identity u : rows) {
                ps.setString(1, u.id());
                ps.setString(2, u.name() == null ? u.email() : u.name());
                ps.setString(3, u.email());
                ps.setString(4, u.passwordHash());
                ps.setString(5, u.role().wireName());
                ps.setString(6, u.companyId());
                ps.setString(7, u.storeId());
                ps.setString(8, u.phone());
                ps.setInt(9, u.active() ? 1 : 0);
                ps.setString(10, Timestamps.format(u.lastLoginAt()));
                ps.setString(11, now);
                ps.setString(12, now);
                ps.addBatch();
            }
            int count = sum(ps.executeBatch());
            handOver(c, replaced);
            return count;
        }
    }

    private Map<String, String> findReplacedIdentities(Connection c, List<Identity> rows) throws SQLException {
        Set<String> incomingIds = new HashSet<>();
        for (Identity u : rows) {
            incomingIds.add(u.id());
        }
        Map<String, String> replaced = new LinkedHashMap<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT id FROM users WHERE email=? AND id<>?")) {
            for (Identity u : rows) {
                ps.setString(1, u.email());
                ps.setString(2, u.id());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String oldId = rs.getString("id");
                        if (!incomingIds.contains(oldId)) {
                            replaced.put(oldId, u.id());
                        }
                    }
                }
            }
        }
        return replaced;
    }

    private void handOver(Connection c, Map<String, String> replaced) throws SQLException {
        if (replaced.isEmpty()) {
            return;
        }
        try (PreparedStatement sales = c.prepareStatement("UPDATE sales SET cashier_id=? WHERE cashier_id=?");
             PreparedStatement movements = c.prepareStatement(
                     "UPDATE inventory_movements SET created_by=? WHERE created_by=?");
             PreparedStatement delete = c.prepareStatement("DELETE FROM users WHERE id=?")) {
            for (Map.Entry<String, String> e : replaced.entrySet()) {
                sales.setString(1, e.getValue());
                sales.setString(2, e.getKey());
                sales.addBatch();
                movements.setString(1, e.getValue());
                movements.setString(2, e.getKey());
                movements.addBatch();
                delete.setString(1, e.getKey());
                delete.addBatch();
            }
            sales.executeBatch();
            movements.executeBatch();
            delete.executeBatch();
        }
    }

    private int upsertCatalogItems(Connection c, List<CatalogItem> rows) throws SQLException {
        String sql = """
                INSERT INTO products(id,name,description,sku,barcode,category_id,store_id,price,cost,stock_quantity,min_stock,is_active,created_at,updated_at)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET name=excluded.name,description=excluded.description,
                sku=excluded.sku,barcode=excluded.barcode,category_id=excluded.category_id,
                store_id=excluded.store_id,price=excluded.price,cost=excluded.cost,
                stock_quantity=excluded.stock_quantity,min_stock=excluded.min_stock,is_active=excluded.is_active,
                created_at=excluded.created_at,updated_at=excluded.updated_at
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (CatalogItem p : rows) {
                ps.setString(1, p.id());
                ps.setString(2, p.name());
                ps.setString(3, p.description());
                ps.setString(4, p.sku());
                ps.setString(5, p.barcode());
                ps.setString(6, p.categoryId());
                ps.setString(7, p.storeId());
                ps.setDouble(8, p.price());
                ps.setDouble(9, p.cost());
                ps.setInt(10, p.stockQuantity());
                ps.setInt(11, p.minStock());
                ps.setInt(12, p.active() ? 1 : 0);
                ps.setString(13, p.createdAt());
                ps.setString(14, p.updatedAt());
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    private int upsertCounterparties(Connection c, List<Counterparty> rows) throws SQLException {
        String sql = """
                INSERT INTO customers(id,name,email,phone,address,loyalty_points,total_spent,store_id,created_at,updated_at)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET name=excluded.name,email=excluded.email,phone=excluded.phone,
                address=excluded.address,loyalty_points=excluded.loyalty_points,total_spent=excluded.total_spent,
                store_id=excluded.store_id,created_at=excluded.created_at,updated_at=excluded.updated_at
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (Counterparty cp : rows) {
                ps.setString(1, cp.id());
                ps.setString(2, cp.name());
                ps.setString(3, cp.email());
                ps.setString(4, cp.phone());
                ps.setString(5, cp.address());
                ps.setInt(6, cp.loyaltyPoints());
                ps.setDouble(7, cp.totalSpent());
                ps.setString(8, cp.storeId());
                ps.setString(9, cp.createdAt());
                ps.setString(10, cp.updatedAt());
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    private int upsertTransactions(Connection c, List<Transaction> rows) throws SQLException {
        String sql = """
                INSERT INTO sales(id,receipt_number,store_id,cashier_id,customer_id,customer_name,subtotal,tax_amount,
                discount_amount,total_amount,payment_method,payment_status,status,notes,origin,pending_sync,created_at,updated_at)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,'remote',0,?,?)
                ON CONFLICT(id) DO UPDATE SET receipt_number=excluded.receipt_number,store_id=excluded.store_id,
                cashier_id=excluded.cashier_id,customer_id=excluded.customer_id,customer_name=excluded.customer_name,
                subtotal=excluded.subtotal,tax_amount=excluded.tax_amount,discount_amount=excluded.discount_amount,
                total_amount=excluded.total_amount,payment_method=excluded.payment_method,
                payment_status=excluded.payment_status,status=excluded.status,notes=excluded.notes,
                origin='remote',pending_sync=0,created_at=excluded.created_at,updated_at=excluded.updated_at
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (Transaction t : rows) {
                bindTransaction(ps, t);
                ps.setString(15, t.createdAt());
                ps.setString(16, t.updatedAt());
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    private static void bindTransaction(PreparedStatement ps, Transaction t) throws SQLException {
        ps.setString(1, t.id());
        ps.setString(2, t.receiptNumber());
        ps.setString(3, t.storeId());
        ps.setString(4, t.cashierId());
        ps.setString(5, t.customerId());
        ps.setString(6, t.customerName());
        ps.setDouble(7, t.subtotal());
        ps.setDouble(8, t.taxAmount());
        ps.setDouble(9, t.discountAmount());
        ps.setDouble(10, t.totalAmount());
        ps.setString(11, t.paymentMethod());
        ps.setString(12, t.paymentStatus() == null ? "completed" : t.paymentStatus());
        ps.setString(13, t.status() == null ? "completed" : t.status());
        ps.setString(14, t.notes());
    }

    /**
     * The delivered lines of a sale replace the lines stored for it, so a sale recorded offline takes on
     * the authority's line ids instead of counting twice.
     */
    private int upsertTransactionLines(Connection c, List<TransactionLine> rows) throws SQLException {
        Map<String, Set<String>> delivered = new LinkedHashMap<>();
        for (TransactionLine line : rows) {
            delivered.computeIfAbsent(line.transactionId(), k -> new HashSet<>()).add(line.id());
        }
        try (PreparedStatement select = c.prepareStatement("SELECT id FROM sale_items WHERE sale_id=?");
             PreparedStatement delete = c.prepareStatement("DELETE FROM sale_items WHERE id=?")) {
            for (Map.Entry<String, Set<String>> entry : delivered.entrySet()) {
                select.setString(1, entry.getKey());
                try (ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        String existing = rs.getString(1);
                        if (!entry.getValue().contains(existing)) {
                            delete.setString(1, existing);
                            delete.addBatch();
                        }
                    }
                }
            }
            delete.executeBatch();
        }
        String sql = """
                INSERT INTO sale_items(id,sale_id,product_id,product_name,quantity,unit_price,total_price,created_at)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET sale_id=excluded.sale_id,product_id=excluded.product_id,
                product_name=excluded.product_name,quantity=excluded.quantity,unit_price=excluded.unit_price,
                total_price=excluded.total_price,created_at=excluded.created_at
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (TransactionLine line : rows) {
                bindLine(ps, line);
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    private static void bindLine(PreparedStatement ps, TransactionLine line) throws SQLException {
        ps.setString(1, line.id());
        ps.setString(2, line.transactionId());
        ps.setString(3, line.catalogItemId());
        ps.setString(4, line.productName());
        ps.setInt(5, line.quantity());
        ps.setDouble(6, line.unitPrice());
        ps.setDouble(7, line.totalPrice());
        ps.setString(8, line.createdAt());
    }

    private int upsertStockMovements(Connection c, List<StockMovement> rows) throws SQLException {
        String sql = """
                INSERT INTO inventory_movements(id,product_id,store_id,movement_type,quantity,previous_stock,new_stock,
                reference_type,reference_id,notes,created_by,created_at)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET product_id=excluded.product_id,store_id=excluded.store_id,
                movement_type=excluded.movement_type,quantity=excluded.quantity,previous_stock=excluded.previous_stock,
                new_stock=excluded.new_stock,reference_type=excluded.reference_type,reference_id=excluded.reference_id,
                notes=excluded.notes,created_by=excluded.created_by,created_at=excluded.created_at
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (StockMovement m : rows) {
                bindMovement(ps, m);
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    private static void bindMovement(PreparedStatement ps, StockMovement m) throws SQLException {
        ps.setString(1, m.id());
        ps.setString(2, m.catalogItemId());
        ps.setString(3, m.storeId());
        ps.setString(4, m.type().wireName());
        ps.setInt(5, m.delta());
        ps.setInt(6, m.previousStock());
        ps.setInt(7, m.newStock());
        ps.setString(8, m.referenceType());
        ps.setString(9, m.referenceId());
        ps.setString(10, m.notes());
        ps.setString(11, m.createdBy());
        ps.setString(12, m.createdAt());
    }

    private static int sum(int[] counts) {
        int total = 0;
        for (int n : counts) {
            total += n == Statement.SUCCESS_NO_INFO ? 1 : Math.max(0, n);
        }
        return total;
    }

    public void verifyLineTotals(Connection c, Collection<String> transactionIds) throws SQLException {
        String sql = """
                SELECT s.subtotal, COALESCE(SUM(si.total_price),0) AS line_total, COUNT(si.id) AS line_count
                FROM sales s LEFT JOIN sale_items si ON si.sale_id=s.id
                WHERE s.id=? GROUP BY s.id
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (String id : transactionIds) {
                ps.setString(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next() || rs.getInt("line_count") == 0) {
                        continue;
                    }
                    double subtotal = rs.getDouble("subtotal");
                    double lineTotal = rs.getDouble("line_total");
                    if (Math.abs(subtotal - lineTotal) > LINE_TOTAL_TOLERANCE) {
                        throw new StoreConstraintException("Lines of transaction " + id + " sum to " + lineTotal
                                + " but its subtotal is " + subtotal);
                    }
                }
            }
        }
    }

    // ---------------------------------------------------------------- offline writes

    /**
     * Records a sale made while the authority was unreachable: the transaction, its lines and one
     * {@code sale} stock movement per line, all or nothing. The row stays {@code pending_sync} until a
     * sync delivers the same id.
     */
    public Transaction recordLocalSale(Transaction transaction, List<TransactionLine> lines, String actorId) {
        if (transaction == null || transaction.id() == null || transaction.id().isBlank()) {
            throw new IllegalArgumentException("transaction id is required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("a sale needs at least one line");
        }
        double lineTotal = 0.0;
        for (TransactionLine line : lines) {
            if (!transaction.id().equals(line.transactionId())) {
                throw new IllegalArgumentException("line " + line.id() + " does not belong to transaction " + transaction.id());
            }
            if (line.quantity() <= 0) {
                throw new IllegalArgumentException("line " + line.id() + " has a non-positive quantity");
            }
            lineTotal += line.totalPrice();
        }
        if (Math.abs(lineTotal - transaction.subtotal()) > LINE_TOTAL_TOLERANCE) {
            throw new IllegalArgumentException("lines sum to " + lineTotal + " but subtotal is " + transaction.subtotal());
        }
        String now = Timestamps.format(clock.instant());
        Transaction stored = new Transaction(transaction.id(), transaction.receiptNumber(), transaction.storeId(),
                transaction.cashierId(), transaction.customerId(), transaction.customerName(), transaction.subtotal(),
                transaction.taxAmount(), transaction.discountAmount(), transaction.totalAmount(),
                transaction.paymentMethod(), transaction.paymentStatus(), transaction.status(), transaction.notes(),
                transaction.createdAt() == null ? now : transaction.createdAt(),
                transaction.updatedAt() == null ? now : transaction.updatedAt());
        return inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO sales(id,receipt_number,store_id,cashier_id,customer_id,customer_name,subtotal,tax_amount,
                    discount_amount,total_amount,payment_method,payment_status,status,notes,origin,pending_sync,created_at,updated_at)
                    VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,'local',1,?,?)
                    """)) {
                bindTransaction(ps, stored);
                ps.setString(15, stored.createdAt());
                ps.setString(16, stored.updatedAt());
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO sale_items(id,sale_id,product_id,product_name,quantity,unit_price,total_price,created_at) VALUES(?,?,?,?,?,?,?,?)")) {
                for (TransactionLine line : lines) {
                    bindLine(ps, line.createdAt() == null
                            ? new TransactionLine(line.id(), line.transactionId(), line.catalogItemId(), line.productName(),
                            line.quantity(), line.unitPrice(), line.totalPrice(), now)
                            : line);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            for (TransactionLine line : lines) {
                applyStockMovement(c, StockMovement.request(UUID.randomUUID().toString(), line.catalogItemId(),
                        MovementType.SALE, -line.quantity(), "sale", stored.id(), null, actorId));
            }
            return stored;
        });
    }

    public StockMovement applyStockMovement(StockMovement request) {
        return inTransaction(c -> applyStockMovement(c, request));
    }

    private StockMovement applyStockMovement(Connection c, StockMovement request) throws SQLException {
        if (request.type() == null || !request.type().accepts(request.delta())) {
            throw new IllegalArgumentException("delta " + request.delta() + " is not valid for movement type " + request.type());
        }
        int previous;
        String storeId;
        try (PreparedStatement ps = c.prepareStatement("SELECT stock_quantity, store_id FROM products WHERE id=?")) {
            ps.setString(1, request.catalogItemId());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalArgumentException("Unknown catalog item: " + request.catalogItemId());
                }
                previous = rs.getInt(1);
                storeId = rs.getString(2);
            }
        }
        int next = previous + request.delta();
        if (next < 0) {
            throw new IllegalStateException("Insufficient stock for " + request.catalogItemId()
                    + ": have " + previous + ", change " + request.delta());
        }
        String now = Timestamps.format(clock.instant());
        try (PreparedStatement ps = c.prepareStatement("UPDATE products SET stock_quantity=?, updated_at=? WHERE id=?")) {
            ps.setInt(1, next);
            ps.setString(2, now);
            ps.setString(3, request.catalogItemId());
            ps.executeUpdate();
        }
        StockMovement applied = new StockMovement(
                request.id() == null ? UUID.randomUUID().toString() : request.id(),
                request.catalogItemId(),
                request.storeId() == null ? storeId : request.storeId(),
                request.type(),
                request.delta(),
                previous,
                next,
                request.referenceType(),
                request.referenceId(),
                request.notes(),
                request.createdBy(),
                request.createdAt() == null ? now : request.createdAt());
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO inventory_movements(id,product_id,store_id,movement_type,quantity,previous_stock,new_stock,
                reference_type,reference_id,notes,created_by,created_at) VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                """)) {
            bindMovement(ps, applied);
            ps.executeUpdate();
        }
        return applied;
    }

    // ---------------------------------------------------------------- reads

    public Optional<Identity> findIdentityById(String id) {
        return findIdentityWithCredential("id", id).map(Identity::withoutCredential);
    }

    public Optional<Identity> findIdentityByEmail(String email) {
        return findIdentityWithCredential("email", Identity.normalizeEmail(email)).map(Identity::withoutCredential);
    }

    private Optional<Identity> findIdentityWithCredential(String column, String value) {
        String sql = "SELECT * FROM users WHERE " + column + "=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, value);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapIdentity(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read identity", e);
        }
    }

    public List<Identity> listIdentities(DataScope scope) {
        List<Object> params = new ArrayList<>();
        String where = switch (scope.kind()) {
            case UNRESTRICTED -> "1=1";
            case COMPANY -> {
                params.add(scope.companyId());
                yield "company_id=?";
            }
            case STORE -> {
                params.add(scope.storeId());
                yield "store_id=?";
            }
        };
        List<Identity> out = new ArrayList<>();
        query("SELECT * FROM users WHERE " + where + " ORDER BY email", params,
                rs -> out.add(mapIdentity(rs).withoutCredential()), "Failed to list identities");
        return out;
    }

    public Optional<CatalogItem> findCatalogItem(String id) {
        List<CatalogItem> out = new ArrayList<>();
        query("SELECT * FROM products WHERE id=?", List.of(id), rs -> out.add(mapCatalogItem(rs)), "Failed to read catalog item");
        return out.stream().findFirst();
    }

    public List<CatalogItem> listCatalogItems(DataScope scope) {
        List<Object> params = new ArrayList<>();
        String where = storeScope(scope, "store_id", params);
        List<CatalogItem> out = new ArrayList<>();
        query("SELECT * FROM products WHERE is_active=1 AND " + where + " ORDER BY name", params,
                rs -> out.add(mapCatalogItem(rs)), "Failed to list catalog items");
        return out;
    }

    public List<CatalogItem> findLowStock(DataScope scope) {
        List<Object> params = new ArrayList<>();
        String where = storeScope(scope, "store_id", params);
        List<CatalogItem> out = new ArrayList<>();
        query("SELECT * FROM products WHERE is_active=1 AND stock_quantity<=min_stock AND " + where
                        + " ORDER BY stock_quantity ASC, name", params,
                rs -> out.add(mapCatalogItem(rs)), "Failed to list low stock items");
        return out;
    }

    public List<Category> listCategories() {
        List<Category> out = new ArrayList<>();
        query("SELECT * FROM categories WHERE is_active=1 ORDER BY name", List.of(), rs -> out.add(new Category(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("color"),
                rs.getString("icon"),
                rs.getInt("is_active") == 1,
                rs.getString("created_at"),
                rs.getString("updated_at")
        )), "Failed to list categories");
        return out;
    }

    public List<Counterparty> listCounterparties(DataScope scope) {
        List<Object> params = new ArrayList<>();
        String where = storeScope(scope, "store_id", params);
        List<Counterparty> out = new ArrayList<>();
        query("SELECT * FROM customers WHERE " + where + " ORDER BY name", params, rs -> out.add(new Counterparty(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("email"),
                rs.getString("phone"),
                rs.getString("address"),
                rs.getInt("loyalty_points"),
                rs.getDouble("total_spent"),
                rs.getString("store_id"),
                rs.getString("created_at"),
                rs.getString("updated_at")
        )), "Failed to list counterparties");
        return out;
    }

    public List<Transaction> listTransactions(DataScope scope, int limit) {
        List<Object> params = new ArrayList<>();
        String where = storeScope(scope, "store_id", params);
        params.add(Math.max(1, limit));
        List<Transaction> out = new ArrayList<>();
        query("SELECT * FROM sales WHERE " + where + " ORDER BY created_at DESC, id LIMIT ?", params,
                rs -> out.add(mapTransaction(rs)), "Failed to list transactions");
        return out;
    }

    public List<Transaction> listPendingTransactions() {
        List<Transaction> out = new ArrayList<>();
        query("SELECT * FROM sales WHERE pending_sync=1 ORDER BY created_at, id", List.of(),
                rs -> out.add(mapTransaction(rs)), "Failed to list pending transactions");
        return out;
    }

    public List<TransactionLine> findTransactionLines(String transactionId) {
        List<TransactionLine> out = new ArrayList<>();
        query("SELECT * FROM sale_items WHERE sale_id=? ORDER BY id", List.of(transactionId), rs -> out.add(new TransactionLine(
                rs.getString("id"),
                rs.getString("sale_id"),
                rs.getString("product_id"),
                rs.getString("product_name"),
                rs.getInt("quantity"),
                rs.getDouble("unit_price"),
                rs.getDouble("total_price"),
                rs.getString("created_at")
        )), "Failed to read transaction lines");
        return out;
    }

    public List<StockMovement> listStockMovements(String catalogItemId) {
        List<StockMovement> out = new ArrayList<>();
        query("SELECT * FROM inventory_movements WHERE product_id=? ORDER BY created_at, rowid", List.of(catalogItemId),
                rs -> out.add(new StockMovement(
                        rs.getString("id"),
                        rs.getString("product_id"),
                        rs.getString("store_id"),
                        MovementType.fromWire(rs.getString("movement_type")),
                        rs.getInt("quantity"),
                        rs.getInt("previous_stock"),
                        rs.getInt("new_stock"),
                        rs.getString("reference_type"),
                        rs.getString("reference_id"),
                        rs.getString("notes"),
                        rs.getString("created_by"),
                        rs.getString("created_at")
                )), "Failed to list stock movements");
        return out;
    }

    public int countRows(EntityKind kind) {
        try (Connection c = database.openConnection()) {
            return countRows(c, kind);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count " + kind.table(), e);
        }
    }

    private static int countRows(Connection c, EntityKind kind) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + kind.table())) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    public String mirrorDigest() {
        StringBuilder sb = new StringBuilder();
        try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
            for (EntityKind kind : EntityKind.values()) {
                sb.append('#').append(kind.table()).append('\n');
                try (ResultSet rs = st.executeQuery("SELECT * FROM " + kind.table() + " ORDER BY id")) {
                    ResultSetMetaData meta = rs.getMetaData();
                    while (rs.next()) {
                        for (int i = 1; i <= meta.getColumnCount(); i++) {
                            sb.append(meta.getColumnName(i)).append('=').append(rs.getString(i)).append('|');
                        }
                        sb.append('\n');
                    }
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to digest mirrored tables", e);
        }
        return Hashing.sha256Hex(sb.toString());
    }

    // ---------------------------------------------------------------- sync runs

    public void recordSyncRun(SyncRun run) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO sync_runs(started_at_ms,finished_at_ms,forced,outcome,counts,error) VALUES(?,?,?,?,?,?)")) {
            ps.setLong(1, run.startedAtMs());
            ps.setLong(2, run.finishedAtMs());
            ps.setInt(3, run.forced() ? 1 : 0);
            ps.setString(4, run.outcome());
            ps.setString(5, run.countsJson() == null ? "{}" : run.countsJson());
            if (run.error() == null) {
                ps.setNull(6, Types.VARCHAR);
            } else {
                ps.setString(6, run.error());
            }
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record sync run", e);
        }
    }

    public List<SyncRun> listSyncRuns(int limit) {
        List<SyncRun> out = new ArrayList<>();
        query("SELECT * FROM sync_runs ORDER BY id DESC LIMIT ?", List.of(Math.max(1, limit)), rs -> out.add(new SyncRun(
                rs.getLong("started_at_ms"),
                rs.getLong("finished_at_ms"),
                rs.getInt("forced") == 1,
                rs.getString("outcome"),
                rs.getString("counts"),
                rs.getString("error")
        )), "Failed to list sync runs");
        return out;
    }

    public record SyncRun(long startedAtMs, long finishedAtMs, boolean forced, String outcome,
                          String countsJson, String error) {
    }

    // ---------------------------------------------------------------- helpers

    @FunctionalInterface
    private interface RowHandler {
        void accept(ResultSet rs) throws SQLException;
    }

    private void query(String sql, List<?> params, RowHandler handler, String failure) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    handler.accept(rs);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException(failure, e);
        }
    }

    /**
     * Company scope covers the company's registered stores and any store its identities are bound to,
     * since a sync may deliver identities before the stores they reference.
     */
    private static String storeScope(DataScope scope, String column, List<Object> params) {
        return switch (scope.kind()) {
            case UNRESTRICTED -> "1=1";
            case COMPANY -> {
                params.add(scope.companyId());
                params.add(scope.companyId());
                yield "(" + column + " IN (SELECT id FROM stores WHERE company_id=?) OR "
                        + column + " IN (SELECT store_id FROM users WHERE company_id=? AND store_id IS NOT NULL))";
            }
            case STORE -> {
                params.add(scope.storeId());
                yield column + "=?";
            }
        };
    }

    private static Identity mapIdentity(ResultSet rs) throws SQLException {
        return new Identity(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("email"),
                rs.getString("password_hash"),
                Role.fromWire(rs.getString("role")),
                rs.getString("company_id"),
                rs.getString("store_id"),
                rs.getString("phone"),
                rs.getInt("is_active") == 1,
                Timestamps.parseLenient(rs.getString("last_login_at"))
        );
    }

    private static CatalogItem mapCatalogItem(ResultSet rs) throws SQLException {
        return new CatalogItem(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("sku"),
                rs.getString("barcode"),
                rs.getString("category_id"),
                rs.getString("store_id"),
                rs.getDouble("price"),
                rs.getDouble("cost"),
                rs.getInt("stock_quantity"),
                rs.getInt("min_stock"),
                rs.getInt("is_active") == 1,
                rs.getString("created_at"),
                rs.getString("updated_at")
        );
    }

    private static Transaction mapTransaction(ResultSet rs) throws SQLException {
        return new Transaction(
                rs.getString("id"),
                rs.getString("receipt_number"),
                rs.getString("store_id"),
                rs.getString("cashier_id"),
                rs.getString("customer_id"),
                rs.getString("customer_name"),
                rs.getDouble("subtotal"),
                rs.getDouble("tax_amount"),
                rs.getDouble("discount_amount"),
                rs.getDouble("total_amount"),
                rs.getString("payment_method"),
                rs.getString("payment_status"),
                rs.getString("status"),
                rs.getString("notes"),
                rs.getString("created_at"),
                rs.getString("updated_at")
        );
    }

    public boolean isPendingSync(String transactionId) {
        List<Boolean> out = new ArrayList<>();
        query("SELECT pending_sync FROM sales WHERE id=?", List.of(transactionId),
                rs -> out.add(rs.getInt(1) == 1), "Failed to read sync flag");
        return !out.isEmpty() && out.get(0);
    }
}
