package io.possync.sync;

import io.possync.model.EntityKind;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

public record SyncOutcome(boolean synced, Map<EntityKind, Integer> counts, Instant at) {
    public SyncOutcome {
        counts = counts == null || counts.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(counts));
    }

    public int count(EntityKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    public Map<String, Integer> countsByTable() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (EntityKind kind : EntityKind.MERGE_ORDER) {
            out.put(kind.table(), count(kind));
        }
        return out;
    }
}
