package io.possync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import io.possync.model.CatalogItem;
import io.possync.model.Category;
import io.possync.model.Counterparty;
import io.possync.model.Identity;
import io.possync.model.Role;
import io.possync.model.Store;
import io.possync.model.Transaction;
import io.possync.model.TransactionLine;
import io.possync.util.Timestamps;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the authority's snake_case JSON into model records. Ids may arrive as numbers or strings and
 * are always kept as text. A few fields have legacy aliases ({@code default_price}, {@code min_stock_level},
 * {@code password}).
 */
public final class WireCodec {
    private WireCodec() {
    }

    public static Identity identity(JsonNode node) {
        String id = text(node, "id");
        String email = text(node, "email");
        if (id == null || email == null) {
            throw new IllegalArgumentException("user requires id and email");
        }
        return new Identity(
                id,
                text(node, "name"),
                email,
                text(node, "password_hash", "password"),
                Role.fromWire(text(node, "role")),
                text(node, "company_id"),
                text(node, "store_id"),
                text(node, "phone"),
                bool(node, true, "is_active", "active"),
                Timestamps.parseLenient(text(node, "last_login_at", "last_login"))
        );
    }

    public static Store store(JsonNode node) {
        return new Store(
                required(node, "id", "store"),
                text(node, "company_id"),
                required(node, "name", "store"),
                text(node, "address"),
                text(node, "phone"),
                bool(node, true, "is_active"),
                text(node, "created_at"),
                text(node, "updated_at")
        );
    }

    public static Category category(JsonNode node) {
        return new Category(
                required(node, "id", "category"),
                required(node, "name", "category"),
                text(node, "description"),
                text(node, "color"),
                text(node, "icon"),
                bool(node, true, "is_active"),
                text(node, "created_at"),
                text(node, "updated_at")
        );
    }

    public static CatalogItem catalogItem(JsonNode node) {
        return new CatalogItem(
                required(node, "id", "product"),
                required(node, "name", "product"),
                text(node, "description"),
                text(node, "sku"),
                text(node, "barcode"),
                text(node, "category_id"),
                text(node, "store_id"),
                number(node, 0.0, "price", "default_price"),
                number(node, 0.0, "cost"),
                (int) number(node, 0.0, "stock_quantity"),
                (int) number(node, 5.0, "min_stock", "min_stock_level"),
                bool(node, true, "is_active"),
                text(node, "created_at"),
                text(node, "updated_at")
        );
    }

    public static Counterparty counterparty(JsonNode node) {
        return new Counterparty(
                required(node, "id", "customer"),
                required(node, "name", "customer"),
                text(node, "email"),
                text(node, "phone"),
                text(node, "address"),
                (int) number(node, 0.0, "loyalty_points"),
                number(node, 0.0, "total_spent"),
                text(node, "store_id"),
                text(node, "created_at"),
                text(node, "updated_at")
        );
    }

    public static Transaction transaction(JsonNode node) {
        String id = required(node, "id", "sale");
        String receipt = text(node, "receipt_number");
        return new Transaction(
                id,
                receipt == null ? "R-" + id : receipt,
                required(node, "store_id", "sale"),
                required(node, "cashier_id", "sale"),
                text(node, "customer_id"),
                text(node, "customer_name"),
                number(node, 0.0, "subtotal"),
                number(node, 0.0, "tax_amount"),
                number(node, 0.0, "discount_amount"),
                number(node, 0.0, "total_amount"),
                defaultText(text(node, "payment_method"), "cash"),
                defaultText(text(node, "payment_status"), "completed"),
                defaultText(text(node, "status"), "completed"),
                text(node, "notes"),
                text(node, "created_at"),
                text(node, "updated_at")
        );
    }

    public static TransactionLine transactionLine(JsonNode node, String saleId, int index) {
        String owner = text(node, "sale_id");
        String id = text(node, "id");
        int quantity = (int) number(node, 0.0, "quantity");
        double unitPrice = number(node, 0.0, "unit_price");
        String productName = text(node, "product_name");
        return new TransactionLine(
                id == null ? (owner == null ? saleId : owner) + ":" + index : id,
                owner == null ? saleId : owner,
                required(node, "product_id", "sale item"),
                productName == null ? "" : productName,
                quantity,
                unitPrice,
                number(node, quantity * unitPrice, "total_price"),
                text(node, "created_at")
        );
    }

    public static SyncPayload payload(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("sync payload must be a JSON object");
        }
        JsonNode data = root.has("data") && root.get("data").isObject() ? root.get("data") : root;
        List<Store> stores = new ArrayList<>();
        for (JsonNode n : data.path("stores")) {
            stores.add(store(n));
        }
        List<Category> categories = new ArrayList<>();
        for (JsonNode n : data.path("categories")) {
            categories.add(category(n));
        }
        List<Identity> identities = new ArrayList<>();
        for (JsonNode n : data.path("users")) {
            identities.add(identity(n));
        }
        List<CatalogItem> items = new ArrayList<>();
        for (JsonNode n : data.path("products")) {
            items.add(catalogItem(n));
        }
        List<Counterparty> customers = new ArrayList<>();
        for (JsonNode n : data.path("customers")) {
            customers.add(counterparty(n));
        }
        List<Transaction> sales = new ArrayList<>();
        List<TransactionLine> lines = new ArrayList<>();
        for (JsonNode n : data.path("sales")) {
            Transaction sale = transaction(n);
            sales.add(sale);
            int index = 0;
            for (JsonNode line : n.path("items")) {
                lines.add(transactionLine(line, sale.id(), index++));
            }
        }
        int index = 0;
        for (JsonNode n : data.path("sale_items")) {
            String saleId = text(n, "sale_id");
            if (saleId == null) {
                throw new IllegalArgumentException("sale item requires sale_id");
            }
            lines.add(transactionLine(n, saleId, index++));
        }
        return new SyncPayload(stores, categories, identities, items, customers, sales, lines);
    }

    static String errorMessage(JsonNode body) {
        if (body == null) {
            return null;
        }
        String error = text(body, "error", "message");
        if (error != null) {
            return error;
        }
        JsonNode nested = body.path("error");
        return nested.isObject() ? text(nested, "message") : null;
    }

    private static String required(JsonNode node, String field, String entity) {
        String value = text(node, field);
        if (value == null) {
            throw new IllegalArgumentException(entity + " requires " + field);
        }
        return value;
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.isContainerNode()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    private static String defaultText(String value, String fallback) {
        return value == null ? fallback : value;
    }

    private static double number(JsonNode node, double fallback, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return value.asDouble();
            }
            if (value.isTextual()) {
                try {
                    return Double.parseDouble(value.asText().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("field " + field + " is not a number: " + value.asText(), e);
                }
            }
        }
        return fallback;
    }

    private static boolean bool(JsonNode node, boolean fallback, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isBoolean()) {
                return value.asBoolean();
            }
            if (value.isNumber()) {
                return value.asInt() != 0;
            }
            if (value.isTextual()) {
                String text = value.asText().trim();
                return text.equalsIgnoreCase("true") || text.equals("1");
            }
        }
        return fallback;
    }
}
