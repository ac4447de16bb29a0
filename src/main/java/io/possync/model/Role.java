package io.possync.model;

import java.util.Locale;

public enum Role {
    SUPER_ADMIN("super_admin"),
    MANAGER("manager"),
    CASHIER("cashier"),
    SUPERVISOR("supervisor"),
    STAFF("staff");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean canActAsOthers() {
        return switch (this) {
            case SUPER_ADMIN, MANAGER -> true;
            case CASHIER, SUPERVISOR, STAFF -> false;
        };
    }

    public static Role fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Role role : values()) {
            if (role.wireName.equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + raw);
    }
}
