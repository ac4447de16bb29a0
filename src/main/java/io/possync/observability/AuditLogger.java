package io.possync.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.possync.security.SensitiveDataMasker;
import io.possync.util.Hashing;
import io.possync.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines event log. Each row carries the hash of the previous row so that edits to
 * the file are detectable; sensitive detail fields are masked before they are written.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path file() {
        return auditFile;
    }

    public synchronized List<JsonNode> tail(int limit) {
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            List<JsonNode> out = new ArrayList<>();
            int from = Math.max(0, lines.size() - Math.max(1, limit));
            for (String line : lines.subList(from, lines.size())) {
                if (!line.isBlank()) {
                    out.add(Jsons.mapper().readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    public synchronized IntegrityOutcome verifyIntegrity() {
        try {
            String expectedPrev = "";
            int checked = 0;
            int lineNo = 0;
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = Jsons.mapper().readTree(line);
                String hash = node.path("hash").asText("");
                if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                    return new IntegrityOutcome(false, checked, lineNo);
                }
                ObjectNode body = node.deepCopy();
                body.remove("hash");
                if (!Hashing.sha256Hex(Jsons.toCompactJson(body)).equals(hash)) {
                    return new IntegrityOutcome(false, checked, lineNo);
                }
                expectedPrev = hash;
                checked++;
            }
            return new IntegrityOutcome(true, checked, -1);
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            // A torn last line restarts the chain rather than blocking startup.
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record IntegrityOutcome(boolean ok, int checkedRows, int brokenAtLine) {
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result,
                                    Map<String, Object> details) {
            return new AuditEvent(action, actor == null || actor.isBlank() ? "system" : actor.trim(),
                    resource, result, details == null ? Map.of() : details);
        }

        public static AuditEvent system(String action, String resource, String result, Map<String, Object> details) {
            return of(action, "system", resource, result, details);
        }

        public static Map<String, Object> details(Object... keyValues) {
            if (keyValues.length % 2 != 0) {
                throw new IllegalArgumentException("details requires key/value pairs");
            }
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < keyValues.length; i += 2) {
                out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
            return out;
        }
    }
}
