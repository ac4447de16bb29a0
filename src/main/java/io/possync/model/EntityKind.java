package io.possync.model;

import java.util.List;

public enum EntityKind {
    STORE("stores"),
    CATEGORY("categories"),
    IDENTITY("users"),
    CATALOG_ITEM("products"),
    COUNTERPARTY("customers"),
    TRANSACTION("sales"),
    TRANSACTION_LINE("sale_items"),
    STOCK_MOVEMENT("inventory_movements");

    public static final List<EntityKind> MERGE_ORDER = List.of(
            STORE, CATEGORY, IDENTITY, CATALOG_ITEM, COUNTERPARTY, TRANSACTION, TRANSACTION_LINE
    );

    private final String table;

    EntityKind(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }
}
