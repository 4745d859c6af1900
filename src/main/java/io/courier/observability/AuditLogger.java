package io.courier.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.courier.security.SensitiveDataMasker;
import io.courier.util.Hashing;
import io.courier.util.Jsons;

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
 * Append-only JSONL audit trail. Each row carries the hash of the previous row,
 * and an HMAC signature when a signing secret is configured.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
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
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("conversation_id", event.conversationId());
        row.put("details", SensitiveDataMasker.masked(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
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

    public List<String> tail(int limit) {
        try {
            List<String> lines = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    lines.add(line);
                }
            }
            int from = Math.max(0, lines.size() - Math.max(1, limit));
            return List.copyOf(lines.subList(from, lines.size()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    /**
     * Recomputes the chain from the first row. Returns the 1-based line number
     * of the first broken row, or 0 when the chain is intact.
     */
    public int verify() {
        String prev = "";
        int lineNo = 0;
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                lineNo++;
                JsonNode node = Jsons.mapper().readTree(line);
                String hash = node.path("hash").asText("");
                if (!prev.equals(node.path("prev_hash").asText(""))) {
                    return lineNo;
                }
                Map<String, Object> row = Jsons.readMap(line);
                row.remove("hash");
                row.remove("signature");
                if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                    return lineNo;
                }
                prev = hash;
            }
            return 0;
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
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String taskId,
            String conversationId,
            Map<String, Object> details
    ) {
        public static AuditEvent task(String action, String actor, String taskId, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, "task/" + taskId, result, taskId, null, details == null ? Map.of() : details);
        }

        public static AuditEvent conversation(String action, String actor, String conversationId, String result,
                                              Map<String, Object> details) {
            return new AuditEvent(action, actor, "conversation/" + conversationId, result, null, conversationId,
                    details == null ? Map.of() : details);
        }
    }
}
