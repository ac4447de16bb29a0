package io.possync.model;

public record DataScope(Kind kind, String companyId, String storeId) {
    public enum Kind {
        UNRESTRICTED,
        COMPANY,
        STORE
    }

    public static DataScope unrestricted() {
        return new DataScope(Kind.UNRESTRICTED, null, null);
    }

    public static DataScope company(String companyId) {
        if (companyId == null || companyId.isBlank()) {
            throw new IllegalArgumentException("companyId must not be blank");
        }
        return new DataScope(Kind.COMPANY, companyId, null);
    }

    public static DataScope store(String storeId) {
        if (storeId == null || storeId.isBlank()) {
            throw new IllegalArgumentException("storeId must not be blank");
        }
        return new DataScope(Kind.STORE, null, storeId);
    }

    public static DataScope of(Identity identity) {
        return switch (identity.role()) {
            case SUPER_ADMIN -> unrestricted();
            case MANAGER -> hasText(identity.companyId())
                    ? company(identity.companyId())
                    : storeOrNone(identity.storeId());
            case CASHIER, SUPERVISOR, STAFF -> storeOrNone(identity.storeId());
        };
    }

    private static DataScope storeOrNone(String storeId) {
        return hasText(storeId) ? store(storeId) : new DataScope(Kind.STORE, null, "");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
