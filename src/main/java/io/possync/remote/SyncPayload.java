package io.possync.remote;

import io.possync.model.CatalogItem;
import io.possync.model.Category;
import io.possync.model.Counterparty;
import io.possync.model.EntityKind;
import io.possync.model.Identity;
import io.possync.model.Store;
import io.possync.model.Transaction;
import io.possync.model.TransactionLine;

import java.util.List;

public record SyncPayload(
        List<Store> stores,
        List<Category> categories,
        List<Identity> identities,
        List<CatalogItem> catalogItems,
        List<Counterparty> counterparties,
        List<Transaction> transactions,
        List<TransactionLine> transactionLines
) {
    public SyncPayload {
        stores = stores == null ? List.of() : List.copyOf(stores);
        categories = categories == null ? List.of() : List.copyOf(categories);
        identities = identities == null ? List.of() : List.copyOf(identities);
        catalogItems = catalogItems == null ? List.of() : List.copyOf(catalogItems);
        counterparties = counterparties == null ? List.of() : List.copyOf(counterparties);
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        transactionLines = transactionLines == null ? List.of() : List.copyOf(transactionLines);
    }

    public static SyncPayload empty() {
        return new SyncPayload(null, null, null, null, null, null, null);
    }

    public List<?> rows(EntityKind kind) {
        return switch (kind) {
            case STORE -> stores;
            case CATEGORY -> categories;
            case IDENTITY -> identities;
            case CATALOG_ITEM -> catalogItems;
            case COUNTERPARTY -> counterparties;
            case TRANSACTION -> transactions;
            case TRANSACTION_LINE -> transactionLines;
            case STOCK_MOVEMENT -> List.of();
        };
    }
}
