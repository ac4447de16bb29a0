package io.possync.model;

public record CatalogItem(
        String id,
        String name,
        String description,
        String sku,
        String barcode,
        String categoryId,
        String storeId,
        double price,
        double cost,
        int stockQuantity,
        int minStock,
        boolean active,
        String createdAt,
        String updatedAt
) {
    public boolean isLowStock() {
        return stockQuantity <= minStock;
    }
}
