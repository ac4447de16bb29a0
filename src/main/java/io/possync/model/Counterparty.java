package io.possync.model;

public record Counterparty(
        String id,
        String name,
        String email,
        String phone,
        String address,
        int loyaltyPoints,
        double totalSpent,
        String storeId,
        String createdAt,
        String updatedAt
) {
}
