package io.possync.model;

public record Store(
        String id,
        String companyId,
        String name,
        String address,
        String phone,
        boolean active,
        String createdAt,
        String updatedAt
) {
}
