package io.pairledger.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.pairledger.model.Ledger;
import io.pairledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public final class JsonFileLedgerStore implements LedgerStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileLedgerStore.class);

    private final Path ledgerFile;

    public JsonFileLedgerStore(Path ledgerFile) {
        this.ledgerFile = Objects.requireNonNull(ledgerFile, "ledgerFile");
    }

    @Override
    public Optional<Ledger> read() {
        if (!Files.exists(ledgerFile)) {
            log.info("{} not found; starting from an empty ledger", ledgerFile);
            return Optional.of(Ledger.empty());
        }
        try {
            String raw = Files.readString(ledgerFile, StandardCharsets.UTF_8);
            JsonNode root = Jsons.mapper().readTree(raw);
            if (root == null || !root.isObject()) {
                log.error("{} does not hold a JSON object with tasks and task_pairs", ledgerFile);
                return Optional.empty();
            }
            if (!isArrayOrMissing(root, "tasks") || !isArrayOrMissing(root, "task_pairs")) {
                log.error("{} has non-array tasks or task_pairs", ledgerFile);
                return Optional.empty();
            }
            return Optional.of(Jsons.mapper().treeToValue(root, Ledger.class));
        } catch (IOException | IllegalArgumentException e) {
            log.error("Error reading or parsing {}: {}", ledgerFile, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean write(Ledger ledger) {
        Objects.requireNonNull(ledger, "ledger");
        Path parent = ledgerFile.toAbsolutePath().getParent();
        Path temp = parent.resolve("." + ledgerFile.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(parent);
            Files.writeString(temp, Jsons.toJson(ledger), StandardCharsets.UTF_8);
            try {
                Files.move(temp, ledgerFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException atomicUnsupported) {
                Files.move(temp, ledgerFile, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Ledger written to {}", ledgerFile);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Error writing ledger to {}", ledgerFile, e);
            deleteQuietly(temp);
            return false;
        }
    }

    @Override
    public boolean exists() {
        return Files.exists(ledgerFile);
    }

    @Override
    public Path location() {
        return ledgerFile;
    }

    private static boolean isArrayOrMissing(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() || node.isArray();
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temp ledger file {}", temp, e);
        }
    }
}
