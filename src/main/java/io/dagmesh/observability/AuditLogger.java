package io.dagmesh.observability;

import io.dagmesh.util.Hashing;
import io.dagmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash-chained JSON-lines audit trail for mesh and engine activity.
 *
 * <p>Every row is kept in a bounded in-memory ring that backs event history queries. When an
 * audit file is configured and file output is enabled, rows are also appended there.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private final Deque<AuditRecord> recent;
    private volatile int capacity;
    private volatile boolean fileEnabled;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, int capacity, boolean fileEnabled) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.recent = new ArrayDeque<>();
        this.capacity = Math.max(1, capacity);
        this.fileEnabled = fileEnabled && auditFile != null;
        this.previousHash = "";
        if (auditFile != null) {
            try {
                Files.createDirectories(auditFile.getParent());
                if (!Files.exists(auditFile)) {
                    try {
                        Files.createFile(auditFile);
                    } catch (FileAlreadyExistsException ignored) {
                        // Another mesh in the same root created it first.
                    }
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
            }
            this.previousHash = loadLastHash();
        }
    }

    public static AuditLogger inMemory(int capacity) {
        return new AuditLogger(null, "default", capacity, false);
    }

    public synchronized AuditRecord log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        Instant now = Instant.now();
        row.put("timestamp", now.toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("workflow_id", event.workflowId());
        row.put("unit_id", event.unitId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        AuditRecord record = new AuditRecord(now, event, previousHash, rowHash);
        if (fileEnabled) {
            row.put("hash", rowHash);
            String line = Jsons.toCompactJson(row) + System.lineSeparator();
            try {
                Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            } catch (IOException e) {
                throw new RuntimeException("Failed to write audit log", e);
            }
        }
        previousHash = rowHash;
        recent.addLast(record);
        while (recent.size() > capacity) {
            recent.removeFirst();
        }
        return record;
    }

    public synchronized List<AuditRecord> recent(int limit) {
        int n = Math.max(0, Math.min(limit, recent.size()));
        List<AuditRecord> all = new ArrayList<>(recent);
        return List.copyOf(all.subList(all.size() - n, all.size()));
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized void reconfigure(int newCapacity, boolean enableFile) {
        this.capacity = Math.max(1, newCapacity);
        this.fileEnabled = enableFile && auditFile != null;
        while (recent.size() > capacity) {
            recent.removeFirst();
        }
    }

    public Path auditFile() {
        return auditFile;
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

    public record AuditRecord(Instant timestamp, AuditEvent event, String prevHash, String hash) {
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String workflowId,
            String unitId,
            Map<String, Object> details
    ) {
        public AuditEvent {
            details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }

        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, null, null, details);
        }

        public static AuditEvent ofWorkflow(
                String action,
                String actor,
                String workflowId,
                String unitId,
                String result,
                Map<String, Object> details
        ) {
            String resource = unitId == null ? "workflow/" + workflowId : "workflow/" + workflowId + "/" + unitId;
            return new AuditEvent(action, actor, resource, result, workflowId, unitId, details);
        }
    }
}
