package io.possync.storage;

import io.possync.model.CatalogItem;
import io.possync.model.Category;
import io.possync.model.Counterparty;
import io.possync.model.Identity;
import io.possync.model.Role;
import io.possync.model.Store;

import java.util.List;

final class SeedData {
    static final String COMPANY_ID = "company-001";
    static final String MAIN_STORE = "store-001";
    static final String BRANCH_STORE = "store-002";
    static final String DEMO_CREDENTIAL = "password123";

    private SeedData() {
    }

    static List<Store> stores(String now) {
        return List.of(
                new Store(MAIN_STORE, COMPANY_ID, "Main Store", "123 Main Street, Downtown", "+1-555-0124", true, now, now),
                new Store(BRANCH_STORE, COMPANY_ID, "Branch Store", "456 Oak Avenue, Uptown", "+1-555-0125", true, now, now)
        );
    }

    static List<Identity> identities() {
        return List.of(
                identity("user-001", "Super Admin", "admin@techcorp.com", Role.SUPER_ADMIN, null, "+1-555-0100"),
                identity("user-002", "Store Manager", "manager@techcorp.com", Role.MANAGER, MAIN_STORE, "+1-555-0101"),
                identity("user-003", "John Cashier", "cashier@techcorp.com", Role.CASHIER, MAIN_STORE, "+1-555-0102"),
                identity("user-004", "Jane Cashier", "jane@techcorp.com", Role.CASHIER, MAIN_STORE, "+1-555-0103"),
                identity("user-005", "Mike Manager", "mike@techcorp.com", Role.MANAGER, BRANCH_STORE, "+1-555-0104")
        );
    }

    static List<Category> categories(String now) {
        return List.of(
                new Category("cat-001", "Beverages", "Hot and cold drinks", "#3b82f6", "cafe", true, now, now),
                new Category("cat-002", "Food", "Sandwiches, meals, and snacks", "#10b981", "restaurant", true, now, now),
                new Category("cat-003", "Bakery", "Fresh baked goods", "#f59e0b", "pizza", true, now, now),
                new Category("cat-004", "Retail", "Merchandise and retail items", "#8b5cf6", "bag", true, now, now),
                new Category("cat-005", "Office Supplies", "Pens, paper, and office items", "#6b7280", "briefcase", true, now, now)
        );
    }

    static List<CatalogItem> catalogItems(String now) {
        return List.of(
                item("prod-001", "Coffee - Americano", "Fresh brewed americano coffee", 3.50, 1.50, 100, 5, "1234567890123", "AME001", "cat-001", now),
                item("prod-002", "Coffee - Latte", "Creamy espresso with steamed milk", 4.25, 2.00, 80, 5, "1234567890124", "LAT001", "cat-001", now),
                item("prod-003", "Espresso", "Strong espresso shot", 2.75, 1.25, 120, 10, "1234567890125", "ESP001", "cat-001", now),
                item("prod-004", "Cappuccino", "Espresso with foam", 4.00, 1.75, 75, 5, "1234567890126", "CAP001", "cat-001", now),
                item("prod-005", "Club Sandwich", "Triple layer club sandwich", 8.99, 4.50, 25, 3, "1234567890127", "CLB001", "cat-002", now),
                item("prod-006", "Caesar Salad", "Fresh caesar salad with chicken", 9.50, 5.00, 20, 3, "1234567890128", "SAL001", "cat-002", now),
                item("prod-007", "Burger - Classic", "Classic beef burger with fries", 12.99, 6.50, 30, 5, "1234567890129", "BUR001", "cat-002", now),
                item("prod-008", "Croissant - Plain", "Fresh butter croissant", 3.25, 1.50, 40, 5, "1234567890130", "CRO001", "cat-003", now),
                item("prod-009", "Muffin - Blueberry", "Fresh blueberry muffin", 3.99, 1.75, 35, 5, "1234567890131", "MUF001", "cat-003", now),
                item("prod-010", "Danish - Apple", "Apple danish pastry", 4.50, 2.25, 25, 3, "1234567890132", "DAN001", "cat-003", now),
                item("prod-011", "T-Shirt - Logo", "Company logo t-shirt", 19.99, 8.00, 50, 10, "1234567890133", "TSH001", "cat-004", now),
                item("prod-012", "Coffee Mug", "Ceramic coffee mug", 12.99, 6.00, 30, 5, "1234567890134", "MUG001", "cat-004", now),
                item("prod-013", "Pen - Black", "Black ballpoint pen", 1.99, 0.50, 200, 20, "1234567890135", "PEN001", "cat-005", now),
                item("prod-014", "Notebook", "Spiral notebook", 4.99, 2.00, 100, 10, "1234567890136", "NOT001", "cat-005", now)
        );
    }

    static List<Counterparty> counterparties(String now) {
        return List.of(
                new Counterparty("cust-001", "John Smith", "john@email.com", "+1-555-1001", "123 Oak St", 0, 0.0, MAIN_STORE, now, now),
                new Counterparty("cust-002", "Sarah Johnson", "sarah@email.com", "+1-555-1002", "456 Pine Ave", 50, 150.00, MAIN_STORE, now, now),
                new Counterparty("cust-003", "Mike Brown", "mike@email.com", "+1-555-1003", "789 Elm Rd", 25, 75.50, MAIN_STORE, now, now),
                new Counterparty("cust-004", "Emily Davis", null, "+1-555-1004", null, 0, 0.0, MAIN_STORE, now, now)
        );
    }

    private static Identity identity(String id, String name, String email, Role role, String storeId, String phone) {
        return new Identity(id, name, email, DEMO_CREDENTIAL, role, COMPANY_ID, storeId, phone, true, null);
    }

    private static CatalogItem item(String id, String name, String description, double price, double cost,
                                    int stock, int minStock, String barcode, String sku, String categoryId, String now) {
        return new CatalogItem(id, name, description, sku, barcode, categoryId, MAIN_STORE, price, cost,
                stock, minStock, true, now, now);
    }
}
