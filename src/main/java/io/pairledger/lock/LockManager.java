package io.pairledger.lock;

import com.fasterxml.jackson.databind.JsonNode;
import io.pairledger.model.LockRecord;
import io.pairledger.util.Jsons;
import io.pairledger.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public final class LockManager {
    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final Path lockFile;
    private final String agentId;
    private final Clock clock;

    public LockManager(Path lockFile, String agentId) {
        this(lockFile, agentId, Clock.systemUTC());
    }

    public LockManager(Path lockFile, String agentId, Clock clock) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        this.lockFile = Objects.requireNonNull(lockFile, "lockFile");
        this.agentId = agentId;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path lockFile() {
        return lockFile;
    }

    public String agentId() {
        return agentId;
    }

    public boolean acquire(Duration maxWait, Duration retryInterval, Duration staleTimeout) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        do {
            if (!Files.exists(lockFile)) {
                CreateResult created = tryCreate();
                if (created == CreateResult.CREATED) {
                    log.info("Lock acquired: {}", lockFile);
                    return true;
                }
                if (created == CreateResult.LOST_RACE) {
                    continue;
                }
            } else {
                Optional<LockRecord> holder = readHolder();
                if (holder.isPresent() && isStale(holder.get(), staleTimeout)) {
                    if (breakStaleLock(holder.get())) {
                        continue;
                    }
                } else if (holder.isEmpty()) {
                    log.warn("Lock file {} is unreadable or corrupt; treating it as held", lockFile);
                } else {
                    log.debug("Lock held by {} since {}; waiting", holder.get().agentId(), holder.get().timestamp());
                }
            }
            if (!pause(retryInterval, deadline)) {
                break;
            }
        } while (System.nanoTime() < deadline);
        log.warn("Failed to acquire lock {} within {}", lockFile, maxWait);
        return false;
    }

    // Deletes the lock only while it still names this agent.
    public boolean release() {
        if (!Files.exists(lockFile)) {
            log.info("No lock file to release: {}", lockFile);
            return false;
        }
        Optional<LockRecord> holder = readHolder();
        if (holder.isEmpty()) {
            log.error("Cannot confirm ownership of {}: lock file unreadable. Manual check may be needed", lockFile);
            return false;
        }
        if (!agentId.equals(holder.get().agentId())) {
            log.warn("Attempted to release lock held by {}; lock not released", holder.get().agentId());
            return false;
        }
        try {
            Files.deleteIfExists(lockFile);
            log.info("Lock released: {}", lockFile);
            return true;
        } catch (IOException e) {
            log.error("Failed to delete lock file {}. Manual check may be needed", lockFile, e);
            return false;
        }
    }

    public boolean isHeldByMe() {
        return readHolder().map(holder -> agentId.equals(holder.agentId())).orElse(false);
    }

    public LockInspection inspect(Duration staleTimeout) {
        if (!Files.exists(lockFile)) {
            return new LockInspection(lockFile.toString(), false, false, null, null, null, false);
        }
        Optional<LockRecord> holder = readHolder();
        if (holder.isEmpty()) {
            return new LockInspection(lockFile.toString(), true, false, null, null, null, false);
        }
        LockRecord record = holder.get();
        Long ageMs = record.timestamp() == null
                ? null
                : Duration.between(record.timestamp(), clock.instant()).toMillis();
        return new LockInspection(
                lockFile.toString(),
                true,
                true,
                record.agentId(),
                record.timestamp() == null ? null : record.timestamp().toString(),
                ageMs,
                isStale(record, staleTimeout)
        );
    }

    Optional<LockRecord> readHolder() {
        try {
            String raw = Files.readString(lockFile, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return Optional.empty();
            }
            JsonNode node = Jsons.mapper().readTree(raw);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            String holder = node.path("agent_id").asText(null);
            Optional<Instant> acquiredAt = Timestamps.parse(node.path("timestamp").asText(null));
            if (holder == null || acquiredAt.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new LockRecord(holder, acquiredAt.get()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.debug("Failed to read lock file {}: {}", lockFile, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isStale(LockRecord record, Duration staleTimeout) {
        if (record.timestamp() == null) {
            return false;
        }
        return Duration.between(record.timestamp(), clock.instant()).compareTo(staleTimeout) > 0;
    }

    private CreateResult tryCreate() {
        Path parent = lockFile.getParent();
        LockRecord record = new LockRecord(agentId, clock.instant());
        byte[] content = Jsons.toCompactJson(record).getBytes(StandardCharsets.UTF_8);
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(lockFile, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                out.write(content);
                out.flush();
            }
            return CreateResult.CREATED;
        } catch (FileAlreadyExistsException e) {
            log.debug("Another agent created {} first", lockFile);
            return CreateResult.LOST_RACE;
        } catch (IOException e) {
            log.warn("Error creating lock file {}: {}. Retrying", lockFile, e.getMessage());
            return CreateResult.FAILED;
        }
    }

    private boolean breakStaleLock(LockRecord stale) {
        log.warn("Found stale lock from {} acquired at {}; breaking it", stale.agentId(), stale.timestamp());
        // Re-read so a lock replaced since the staleness check is left alone.
        Optional<LockRecord> current = readHolder();
        if (current.isEmpty() || !current.get().equals(stale)) {
            log.info("Lock file {} changed while breaking a stale lock; re-checking", lockFile);
            return true;
        }
        try {
            Files.deleteIfExists(lockFile);
            log.info("Stale lock removed: {}", lockFile);
            return true;
        } catch (IOException e) {
            log.error("Failed to remove stale lock {}", lockFile, e);
            return false;
        }
    }

    private boolean pause(Duration retryInterval, long deadline) {
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0L) {
            return false;
        }
        long sleepNanos = Math.min(retryInterval.toNanos(), remainingNanos);
        try {
            Thread.sleep(Duration.ofNanos(sleepNanos).toMillis(), (int) (sleepNanos % 1_000_000L));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for lock {}", lockFile);
            return false;
        }
    }

    private enum CreateResult {
        CREATED,
        LOST_RACE,
        FAILED
    }

    public record LockInspection(
            String lockFile,
            boolean present,
            boolean readable,
            String holderAgentId,
            String acquiredAt,
            Long ageMs,
            boolean stale
    ) {
    }
}
