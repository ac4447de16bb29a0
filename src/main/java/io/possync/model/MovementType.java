package io.possync.model;

import java.util.Locale;

public enum MovementType {
    IN,
    OUT,
    ADJUSTMENT,
    TRANSFER,
    SALE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean accepts(int delta) {
        return switch (this) {
            case IN -> delta > 0;
            case OUT, SALE -> delta < 0;
            case ADJUSTMENT, TRANSFER -> delta != 0;
        };
    }

    public static MovementType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("movement type must not be blank");
        }
        return MovementType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
