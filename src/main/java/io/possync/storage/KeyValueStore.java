package io.possync.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.possync.util.Jsons;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Small durable key/value map backed by one JSON object file. Every mutation rewrites the whole file
 * through a temp file and a rename, so readers never observe a half-written state.
 */
public final class KeyValueStore {
    private final Path file;
    private final ObjectNode values;

    public KeyValueStore(Path file) {
        this.file = file;
        this.values = load(file);
    }

    public Path file() {
        return file;
    }

    public synchronized Optional<JsonNode> get(String key) {
        JsonNode node = values.get(key);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node.deepCopy());
    }

    public synchronized Optional<String> getString(String key) {
        JsonNode node = values.get(key);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return Optional.empty();
        }
        String text = node.asText("");
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public synchronized void put(String key, JsonNode value) {
        putAll(Map.of(key, value));
    }

    public synchronized void putString(String key, String value) {
        putAll(Map.of(key, Jsons.mapper().getNodeFactory().textNode(value)));
    }

    public synchronized void putAll(Map<String, ? extends JsonNode> entries) {
        ObjectNode next = values.deepCopy();
        for (Map.Entry<String, ? extends JsonNode> entry : entries.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isNull()) {
                next.remove(entry.getKey());
            } else {
                next.set(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        write(next);
        values.removeAll();
        values.setAll(next);
    }

    public synchronized void remove(String... keys) {
        ObjectNode next = values.deepCopy();
        for (String key : keys) {
            next.remove(key);
        }
        write(next);
        values.removeAll();
        values.setAll(next);
    }

    public synchronized Set<String> keys() {
        Set<String> out = new TreeSet<>();
        values.fieldNames().forEachRemaining(out::add);
        return out;
    }

    private void write(ObjectNode root) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Jsons.mapper().writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write key/value file: " + file, e);
        }
    }

    private static ObjectNode load(Path file) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        if (!Files.exists(file)) {
            return out;
        }
        try {
            JsonNode root = Jsons.mapper().readTree(file.toFile());
            if (root != null && root.isObject()) {
                out.setAll((ObjectNode) root);
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read key/value file: " + file, e);
        }
    }
}
