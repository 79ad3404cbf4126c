package io.bundlemesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.bundlemesh.util.Hashing;
import io.bundlemesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines log of security-relevant events. Each row carries the
 * hash of the previous row, so a removed or edited line breaks the chain.
 * Rows hold ids, reasons and counts, never payload content.
 */
public final class AuditLogger {
    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            Files.writeString(auditFile, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
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

    /**
     * Recomputes the chain from the first row.
     */
    public synchronized ChainCheck verifyChain() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int checked = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            checked++;
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new ChainCheck(false, checked, "unparseable row");
            }
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return new ChainCheck(false, checked, "prev_hash mismatch");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", textOrNull(node, "timestamp"));
            row.put("action", textOrNull(node, "action"));
            row.put("actor", textOrNull(node, "actor"));
            row.put("resource", textOrNull(node, "resource"));
            row.put("result", textOrNull(node, "result"));
            row.put("details", Jsons.mapper().convertValue(node.path("details"), Map.class));
            row.put("prev_hash", expectedPrev);
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                return new ChainCheck(false, checked, "hash mismatch");
            }
            expectedPrev = hash;
        }
        return new ChainCheck(true, checked, "ok");
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
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
            throw new RuntimeException("Failed to read audit chain head: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record ChainCheck(boolean intact, int rows, String detail) {
    }
}
