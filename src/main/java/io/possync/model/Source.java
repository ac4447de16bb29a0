package io.possync.model;

import java.util.Locale;

public enum Source {
    REMOTE("remote"),
    LOCAL("local");

    private final String wireName;

    Source(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Source fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("source must not be blank");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (Source source : values()) {
            if (source.wireName.equals(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown source: " + raw);
    }
}
