package io.possync.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record Session(
        Identity identity,
        String token,
        Source source,
        Instant createdAt,
        List<Identity> actingStack
) {
    public Session {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(createdAt, "createdAt");
        actingStack = actingStack == null ? List.of() : List.copyOf(actingStack);
    }

    public boolean isActing() {
        return !actingStack.isEmpty();
    }

    public Identity originalIdentity() {
        return actingStack.isEmpty() ? identity : actingStack.get(0);
    }
}
