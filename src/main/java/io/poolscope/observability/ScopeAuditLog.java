package io.poolscope.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.poolscope.security.SensitiveDataMasker;
import io.poolscope.util.Hashing;
import io.poolscope.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL record of scope writes. Each row carries the hash of the previous row, so
 * {@link #verify()} detects edited or dropped lines.
 */
public final class ScopeAuditLog {
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private final Path auditFile;
    private String previousHash;

    public ScopeAuditLog(Path auditFile) {
        this.auditFile = auditFile;
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

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("collection", event.collection());
        row.put("action", event.action());
        row.put("scope", event.scope());
        row.put("field", event.field());
        row.put("result", event.result());
        row.put("value", event.value() == null ? null : SensitiveDataMasker.maskedField(event.field(), event.value()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        String line = toCompactJson(row) + System.lineSeparator();
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

    public List<JsonNode> tail(int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        List<JsonNode> rows = new ArrayList<>();
        for (String line : readLines()) {
            rows.add(parse(line));
        }
        int from = Math.max(0, rows.size() - limit);
        return new ArrayList<>(rows.subList(from, rows.size()));
    }

    /**
     * Recomputes the hash chain over the stored text of each row, so values keep their exact
     * written form (decimal scale included).
     *
     * @return number of the first broken row (1-based), or 0 when the chain is intact
     */
    public int verify() {
        String expectedPrev = "";
        int lineNo = 0;
        for (String line : readLines()) {
            lineNo++;
            JsonNode row;
            try {
                row = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return lineNo;
            }
            String hash = row.path("hash").asText("");
            String hashSuffix = ",\"hash\":\"" + hash + "\"}";
            if (!expectedPrev.equals(row.path("prev_hash").asText("")) || !line.endsWith(hashSuffix)) {
                return lineNo;
            }
            String hashedBody = line.substring(0, line.length() - hashSuffix.length()) + "}";
            if (!Hashing.sha256Hex(hashedBody).equals(hash)) {
                return lineNo;
            }
            expectedPrev = hash;
        }
        return 0;
    }

    private List<String> readLines() {
        List<String> lines = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    lines.add(line.strip());
                }
            }
            return lines;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private JsonNode parse(String line) {
        try {
            return Jsons.mapper().readTree(line);
        } catch (IOException e) {
            throw new RuntimeException("Malformed audit row in " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        return parse(lines.get(lines.size() - 1)).path("hash").asText("");
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record AuditEvent(
            String collection,
            String action,
            String scope,
            String field,
            String result,
            JsonNode value
    ) {
        public static AuditEvent of(String collection, String action, String scope, String result) {
            return new AuditEvent(collection, action, scope, null, result, null);
        }

        public static AuditEvent ofField(String collection, String action, String scope, String field, String result, JsonNode value) {
            return new AuditEvent(collection, action, scope, field, result, value);
        }
    }
}
