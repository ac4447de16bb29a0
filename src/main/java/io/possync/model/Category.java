package io.possync.model;

public record Category(
        String id,
        String name,
        String description,
        String color,
        String icon,
        boolean active,
        String createdAt,
        String updatedAt
) {
}
