package io.pairledger.lock;

import com.fasterxml.jackson.databind.JsonNode;
import io.pairledger.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class LockManagerTest {
    private static final Duration STALE = Duration.ofSeconds(300);
    private static final Duration SHORT_WAIT = Duration.ofMillis(200);
    private static final Duration RETRY = Duration.ofMillis(20);

    @Test
    void acquireCreatesLockFileNamingHolder() throws Exception {
        Path root = Files.createTempDirectory("pairledger-lock-");
        try {
            Path lockFile = root.resolve("tasks.lock");
            LockManager lock = new LockManager(lockFile, "agent_A");

            Assertions.assertTrue(lock.acquire(SHORT_WAIT, RETRY, STALE));
            JsonNode content = Jsons.mapper().readTree(Files.readString(lockFile));
            Assertions.assertEquals("agent_A", content.path("agent_id").asText());
            Assertions.assertTrue(content.path("timestamp").asText().endsWith("Z"));
            Assertions.assertTrue(lock.isHeldByMe());

            Assertions.assertTrue(lock.release());
            Assertions.assertFalse(Files.exists(lockFile));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void secondAgentCannotAcquireFreshLock() throws Exception {
        Path root = Files.createTempDirectory("pairledger-lock-held-");
        try {
            Path lockFile = root.resolve("tasks.lock");
            LockManager a = new LockManager(lockFile, "agent_A");
            LockManager b = new LockManager(lockFile, "agent_B");

            Assertions.assertTrue(a.acquire(SHORT_WAIT, RETRY, STALE));
            Assertions.assertFalse(b.acquire(SHORT_WAIT, RETRY, STALE));
            Assertions.assertTrue(a.isHeldByMe());
            Assertions.assertFalse(b.isHeldByMe());

            Assertions.assertTrue(a.release());
            Assertions.assertTrue(b.acquire(SHORT_WAIT, RETRY, STALE));
            Assertions.assertTrue(b.release());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseLeavesForeignLockInPlace() throws Exception {
        Path root = Files.createTempDirectory("pairledger-lock-foreign-");
        try {
            Path lockFile = root.resolve("tasks.lock");
            LockManager a = new LockManager(lockFile, "agent_A");
            LockManager b = new LockManager(lockFile, "agent_B");

            Assertions.assertTrue(a.acquire(SHORT_WAIT, RETRY, STALE));
            Assertions.assertFalse(b.release());
            Assertions.assertTrue(Files.exists(lockFile));
            Assertions.assertTrue(a.isHeldByMe());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseWithoutLockFileReportsFalse() throws Exception {
        Path root = Files.createTempDirectory("pairledger-lock-missing-");
        try {
            LockManager lock = new LockManager(root.resolve("tasks.lock"), "agent_A");
            Assertions.assertFalse(lock.release());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleLockIsBrokenAndTaken() throws Exception {
        Path root = Files.createTempDirectory("pairledger-lock-stale-");
        try {
            Path lockFile = root.resolve("tasks.lock");
            Instant now = Instant.parse("2026-03-01T12:00:00Z");
            Clock clock = Clock.fixed(now, ZoneOffset.UTC);
            String oldStamp = now.minus(Duration.ofMinutes(10)).toString();
            Files.writeString(lockFile, "{\"agent_id\":\"agent_X\",\"timestamp\":\"" + oldStamp + "\"}",
                    StandardCharsets.UTF_8);

            LockManager lock = new LockManager(lockFile, "agent_A", clock);
            Assertions.assertTrue(lock.inspect(STALE).stale());
            Assertions.assertTrue(lock.acquire(SHORT_WAIT, RETRY, STALE));

            JsonNode content = Jsons.mapper().readTree(Files.readString(lockFile));
            Assertions.assertEquals("agent_A", content.path("agent_id").asText());
            Assertions.assertEquals(now.toString(), content.path("timestamp").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleLockWithOffsetTimestampIsRecognized() throws Exception {
        Path root = Files.createTempDirectory("pairledger-lock-offset-");
        try {
            Path lockFile = root.resolve("tasks.lock");
            Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
            Files.writeString(lockFile, "{\"agent_id\": \"agent_X\", \"timestamp\": \"2026-03-01T11:50:00+00:00\"}",
                    StandardCharsets.UTF_8);

            LockManager.LockInspection inspection = new LockManager(lockFile, "agent_A", clock).inspect(STALE);
            Assertions.assertTrue(inspection.present());
            Assertions.assertTrue(inspection.readable());
            Assertions.assertEquals("agent_X", inspection.holderAgentId());
            Assertions.assertEquals(600_000L, inspection.ageMs());
            Assertions.assertTrue(inspection.stale());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void freshLockOfAnotherAgentIsNotBroken() throws Exception {
        Path root = Files.createTempDirectory("pairledger-lock-fresh-");
        try {
            Path lockFile = root.resolve("tasks.lock");
            Instant now = Instant.parse("2026-03-01T12:00:00Z");
            Clock clock = Clock.fixed(now, ZoneOffset.UTC);
            Files.writeString(lockFile, "{\"agent_id\":\"agent_X\",\"timestamp\":\""
                    + now.minusSeconds(30) + "\"}", StandardCharsets.UTF_8);

            LockManager lock = new LockManager(lockFile, "agent_A", clock);
            Assertions.assertFalse(lock.acquire(SHORT_WAIT, RETRY, STALE));
            Assertions.assertFalse(lock.inspect(STALE).stale());
            Assertions.assertTrue(Files.readString(lockFile).contains("agent_X"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void corruptLockIsTreatedAsHeld() throws Exception {
        Path root = Files.createTempDirectory("pairledger-lock-corrupt-");
        try {
            Path lockFile = root.resolve("tasks.lock");
            Files.writeString(lockFile, "not json at all", StandardCharsets.UTF_8);

            LockManager lock = new LockManager(lockFile, "agent_A");
            Assertions.assertFalse(lock.acquire(SHORT_WAIT, RETRY, STALE));
            Assertions.assertFalse(lock.release());
            Assertions.assertTrue(Files.exists(lockFile));

            LockManager.LockInspection inspection = lock.inspect(STALE);
            Assertions.assertTrue(inspection.present());
            Assertions.assertFalse(inspection.readable());
            Assertions.assertFalse(inspection.stale());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentAgentsNeverHoldLockTogether() throws Exception {
        Path root = Files.createTempDirectory("pairledger-lock-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Path lockFile = root.resolve("tasks.lock");
            AtomicInteger inside = new AtomicInteger();
            AtomicInteger maxInside = new AtomicInteger();
            AtomicInteger acquisitions = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                LockManager lock = new LockManager(lockFile, "agent_" + i);
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int round = 0; round < 5; round++) {
                        if (lock.acquire(Duration.ofSeconds(10), Duration.ofMillis(5), STALE)) {
                            int now = inside.incrementAndGet();
                            maxInside.accumulateAndGet(now, Math::max);
                            acquisitions.incrementAndGet();
                            Thread.sleep(2);
                            inside.decrementAndGet();
                            Assertions.assertTrue(lock.release());
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
            Assertions.assertEquals(1, maxInside.get());
            Assertions.assertEquals(20, acquisitions.get());
            Assertions.assertFalse(Files.exists(lockFile));
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
