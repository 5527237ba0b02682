package io.pairledger.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pairledger.util.Hashing;
import io.pairledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this(auditFile, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        this.previousHash = "";
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
        // Other agents append to the same file; chain onto whatever is last on disk.
        previousHash = loadLastHash();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
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
            log.error("Failed to write audit row {} for {}", event.action(), event.resource(), e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public IntegrityOutcome verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return new IntegrityOutcome(false, 0, 0, "unreadable: " + e.getMessage());
        }
        String expectedPrev = "";
        int checked = 0;
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                JsonNode node = Jsons.compact().readTree(line);
                if (!(node instanceof ObjectNode row)) {
                    return new IntegrityOutcome(false, checked, lineNo, "row is not a JSON object");
                }
                String hash = row.path("hash").asText("");
                String prev = row.path("prev_hash").asText("");
                if (!expectedPrev.equals(prev)) {
                    return new IntegrityOutcome(false, checked, lineNo, "prev_hash mismatch");
                }
                ObjectNode unsigned = row.deepCopy();
                unsigned.remove("hash");
                String recomputed = Hashing.sha256Hex(Jsons.compact().writeValueAsString(unsigned));
                if (!recomputed.equals(hash)) {
                    return new IntegrityOutcome(false, checked, lineNo, "hash mismatch");
                }
                expectedPrev = hash;
                checked++;
            } catch (IOException e) {
                return new IntegrityOutcome(false, checked, lineNo, "unparseable row: " + e.getMessage());
            }
        }
        return new IntegrityOutcome(true, checked, 0, "ok");
    }

    private String loadLastHash() {
        try {
            if (!Files.exists(auditFile)) {
                return "";
            }
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.compact().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            log.warn("Failed to read last audit hash from {}: {}", auditFile, e.getMessage());
            return previousHash == null ? "" : previousHash;
        }
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
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record IntegrityOutcome(boolean ok, int checkedRows, int firstBrokenLine, String message) {
    }
}
