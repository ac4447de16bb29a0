package io.possync.model;

public record TransactionLine(
        String id,
        String transactionId,
        String catalogItemId,
        String productName,
        int quantity,
        double unitPrice,
        double totalPrice,
        String createdAt
) {
}
