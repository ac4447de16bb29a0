package io.possync.model;

public record StockMovement(
        String id,
        String catalogItemId,
        String storeId,
        MovementType type,
        int delta,
        int previousStock,
        int newStock,
        String referenceType,
        String referenceId,
        String notes,
        String createdBy,
        String createdAt
) {
    public static StockMovement request(String id, String catalogItemId, MovementType type, int delta,
                                        String referenceType, String referenceId, String notes, String createdBy) {
        return new StockMovement(id, catalogItemId, null, type, delta, 0, 0,
                referenceType, referenceId, notes, createdBy, null);
    }
}
