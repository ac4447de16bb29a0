package io.possync.model;

public record Transaction(
        String id,
        String receiptNumber,
        String storeId,
        String cashierId,
        String customerId,
        String customerName,
        double subtotal,
        double taxAmount,
        double discountAmount,
        double totalAmount,
        String paymentMethod,
        String paymentStatus,
        String status,
        String notes,
        String createdAt,
        String updatedAt
) {
}
