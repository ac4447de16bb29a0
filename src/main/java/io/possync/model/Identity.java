package io.possync.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

public record Identity(
        String id,
        String name,
        String email,
        String passwordHash,
        Role role,
        String companyId,
        String storeId,
        String phone,
        boolean active,
        Instant lastLoginAt
) {
    public Identity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(role, "role");
        email = normalizeEmail(email);
    }

    public static String normalizeEmail(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    public Identity withoutCredential() {
        if (passwordHash == null) {
            return this;
        }
        return new Identity(id, name, email, null, role, companyId, storeId, phone, active, lastLoginAt);
    }

    public Identity withLastLoginAt(Instant at) {
        return new Identity(id, name, email, passwordHash, role, companyId, storeId, phone, active, at);
    }

    public DataScope scope() {
        return DataScope.of(this);
    }
}
