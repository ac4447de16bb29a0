package io.possync.storage;

import io.possync.config.PosSyncConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Owns the embedded SQLite file: connections, schema, pragmas and versioned migrations.
 * {@link #init()} only ever creates what is missing, so it runs on every start.
 */
public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "possync.schema.migration.v1";
    private final PosSyncConfig config;
    private final String jdbcUrl;

    public Database(PosSyncConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys=ON");
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public Set<String> tableNames() {
        Set<String> out = new TreeSet<>();
        try (Connection c = openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT name FROM sqlite_master WHERE type='table' AND name NOT LIKE 'sqlite_%'")) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tables", e);
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS stores (
                        id TEXT PRIMARY KEY,
                        company_id TEXT,
                        name TEXT NOT NULL,
                        address TEXT,
                        phone TEXT,
                        is_active INTEGER NOT NULL DEFAULT 1,
                        created_at TEXT,
                        updated_at TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS categories (
                        id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        description TEXT,
                        color TEXT DEFAULT '#3b82f6',
                        icon TEXT DEFAULT 'cube',
                        is_active INTEGER NOT NULL DEFAULT 1,
                        created_at TEXT,
                        updated_at TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS users (
                        id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        email TEXT NOT NULL UNIQUE,
                        password_hash TEXT,
                        role TEXT NOT NULL CHECK (role IN ('super_admin','manager','cashier','supervisor','staff')),
                        company_id TEXT,
                        store_id TEXT,
                        phone TEXT,
                        is_active INTEGER NOT NULL DEFAULT 1,
                        last_login_at TEXT,
                        created_at TEXT,
                        updated_at TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS products (
                        id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        description TEXT,
                        sku TEXT,
                        barcode TEXT,
                        category_id TEXT,
                        store_id TEXT,
                        price REAL NOT NULL DEFAULT 0,
                        cost REAL NOT NULL DEFAULT 0,
                        stock_quantity INTEGER NOT NULL DEFAULT 0,
                        min_stock INTEGER NOT NULL DEFAULT 5,
                        is_active INTEGER NOT NULL DEFAULT 1,
                        created_at TEXT,
                        updated_at TEXT,
                        FOREIGN KEY(category_id) REFERENCES categories(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS customers (
                        id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        email TEXT,
                        phone TEXT,
                        address TEXT,
                        loyalty_points INTEGER NOT NULL DEFAULT 0,
                        total_spent REAL NOT NULL DEFAULT 0,
                        store_id TEXT,
                        created_at TEXT,
                        updated_at TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sales (
                        id TEXT PRIMARY KEY,
                        receipt_number TEXT NOT NULL UNIQUE,
                        store_id TEXT NOT NULL,
                        cashier_id TEXT NOT NULL,
                        customer_id TEXT,
                        customer_name TEXT,
                        subtotal REAL NOT NULL DEFAULT 0,
                        tax_amount REAL NOT NULL DEFAULT 0,
                        discount_amount REAL NOT NULL DEFAULT 0,
                        total_amount REAL NOT NULL,
                        payment_method TEXT NOT NULL,
                        payment_status TEXT NOT NULL DEFAULT 'completed',
                        status TEXT NOT NULL DEFAULT 'completed',
                        notes TEXT,
                        created_at TEXT,
                        updated_at TEXT,
                        FOREIGN KEY(cashier_id) REFERENCES users(id),
                        FOREIGN KEY(customer_id) REFERENCES customers(id)
                    )
                    """);
            ensureSalesColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sale_items (
                        id TEXT PRIMARY KEY,
                        sale_id TEXT NOT NULL,
                        product_id TEXT NOT NULL,
                        product_name TEXT NOT NULL,
                        quantity INTEGER NOT NULL CHECK (quantity > 0),
                        unit_price REAL NOT NULL,
                        total_price REAL NOT NULL,
                        created_at TEXT,
                        FOREIGN KEY(sale_id) REFERENCES sales(id),
                        FOREIGN KEY(product_id) REFERENCES products(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS inventory_movements (
                        id TEXT PRIMARY KEY,
                        product_id TEXT NOT NULL,
                        store_id TEXT,
                        movement_type TEXT NOT NULL CHECK (movement_type IN ('in','out','adjustment','transfer','sale')),
                        quantity INTEGER NOT NULL,
                        previous_stock INTEGER NOT NULL DEFAULT 0,
                        new_stock INTEGER NOT NULL DEFAULT 0,
                        reference_type TEXT,
                        reference_id TEXT,
                        notes TEXT,
                        created_by TEXT,
                        created_at TEXT,
                        FOREIGN KEY(product_id) REFERENCES products(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sync_runs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        started_at_ms INTEGER NOT NULL,
                        finished_at_ms INTEGER NOT NULL,
                        forced INTEGER NOT NULL,
                        outcome TEXT NOT NULL,
                        counts TEXT NOT NULL DEFAULT '{}',
                        error TEXT
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_users_email ON users(email)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_users_company ON users(company_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_products_store ON products(store_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_products_category ON products(category_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_products_barcode ON products(barcode)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sales_store_created ON sales(store_id, created_at)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sale_items_sale ON sale_items(sale_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_movements_product ON inventory_movements(product_id, created_at)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sync_runs_started ON sync_runs(started_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSalesColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(sales)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("origin")) {
                st.execute("ALTER TABLE sales ADD COLUMN origin TEXT NOT NULL DEFAULT 'remote'");
            }
            if (!columns.contains("pending_sync")) {
                st.execute("ALTER TABLE sales ADD COLUMN pending_sync INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261019_001_pending_local_sales",
                "Index local-origin sales awaiting reconciliation",
                List.of("CREATE INDEX IF NOT EXISTS idx_sales_pending ON sales(pending_sync, origin)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
