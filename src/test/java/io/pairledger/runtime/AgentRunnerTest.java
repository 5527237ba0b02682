package io.pairledger.runtime;

import io.pairledger.config.LedgerSettings;
import io.pairledger.config.PairLedgerConfig;
import io.pairledger.engine.PairStateMachine;
import io.pairledger.lock.LockManager;
import io.pairledger.model.Ledger;
import io.pairledger.model.PairStatus;
import io.pairledger.model.Task;
import io.pairledger.model.TaskStatus;
import io.pairledger.observability.AuditLogger;
import io.pairledger.storage.JsonFileLedgerStore;
import io.pairledger.worker.TaskWorker;
import io.pairledger.worker.WorkContext;
import io.pairledger.worker.WorkResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class AgentRunnerTest {
    private static final LedgerSettings FAST = new LedgerSettings(
            Duration.ofSeconds(300),
            Duration.ofMillis(200),
            Duration.ofMillis(20),
            Duration.ofMillis(200),
            Duration.ofMillis(20),
            Duration.ZERO,
            Duration.ZERO,
            Duration.ZERO,
            1.0d
    );

    @Test
    void twoAgentsCompletePairAndOpenNextOne() throws Exception {
        Path root = Files.createTempDirectory("pairledger-runner-pair-");
        try {
            PairLedgerConfig config = PairLedgerConfig.fromRoot(root.toString());
            LedgerAdmin admin = admin(config);
            admin.init(false);
            admin.createFullPair("build", "agent_A", "test", "agent_B", 1, "fp1");
            admin.createFullPair("package", "agent_A", "ship", "agent_B", 2, "fp2");
            admin.advanceNextPair(true);

            RecordingWorker worker = new RecordingWorker(WorkResult.completed("ok"));
            AgentRunner a = runner(config, "agent_A", worker);
            AgentRunner b = runner(config, "agent_B", worker);

            AgentRunner.CycleOutcome first = a.runCycle();
            Assertions.assertTrue(first.worked());
            Assertions.assertEquals(AgentRunner.CycleResult.FINALIZED, first.result());
            Assertions.assertEquals("fp1_t1", first.taskId());

            Ledger afterA = read(config);
            Assertions.assertEquals(TaskStatus.COMPLETED, afterA.findTask("fp1_t1").orElseThrow().getStatus());
            Assertions.assertEquals(PairStatus.READY, afterA.findPair("fp1_p").orElseThrow().getStatus());

            AgentRunner.CycleOutcome idleA = a.runCycle();
            Assertions.assertFalse(idleA.worked());
            Assertions.assertEquals(AgentRunner.CycleResult.NO_CLAIMABLE_TASK, idleA.result());

            AgentRunner.CycleOutcome second = b.runCycle();
            Assertions.assertEquals(AgentRunner.CycleResult.FINALIZED, second.result());
            Assertions.assertEquals("fp1_t2", second.taskId());

            Ledger afterB = read(config);
            Assertions.assertEquals(PairStatus.COMPLETED, afterB.findPair("fp1_p").orElseThrow().getStatus());
            Assertions.assertTrue(afterB.findPair("fp1_p").orElseThrow().isPairLock());
            Assertions.assertEquals(PairStatus.READY, afterB.findPair("fp2_p").orElseThrow().getStatus());
            Assertions.assertFalse(afterB.findPair("fp2_p").orElseThrow().isPairLock());

            Assertions.assertEquals(List.of("fp1_t1", "fp1_t2"), worker.taskIds);
            Assertions.assertFalse(Files.exists(config.lockFile()));
            Assertions.assertTrue(admin.verifyAudit().ok());
            Assertions.assertTrue(admin.validate().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void idleCyclesReleaseTheLock() throws Exception {
        Path root = Files.createTempDirectory("pairledger-runner-idle-");
        try {
            PairLedgerConfig config = PairLedgerConfig.fromRoot(root.toString());
            LedgerAdmin admin = admin(config);
            admin.init(false);
            admin.createFullPair("build", null, "test", null, 1, "fp1");

            AgentRunner runner = runner(config, "agent_A", new RecordingWorker(WorkResult.completed("ok")));
            AgentRunner.CycleOutcome outcome = runner.runCycle();
            Assertions.assertFalse(outcome.worked());
            Assertions.assertEquals(AgentRunner.CycleResult.NO_ACTIVE_PAIR, outcome.result());
            Assertions.assertFalse(Files.exists(config.lockFile()));

            Files.writeString(config.ledgerFile(), "{broken", StandardCharsets.UTF_8);
            AgentRunner.CycleOutcome unreadable = runner.runCycle();
            Assertions.assertFalse(unreadable.worked());
            Assertions.assertEquals(AgentRunner.CycleResult.LEDGER_UNREADABLE, unreadable.result());
            Assertions.assertFalse(Files.exists(config.lockFile()));
            Assertions.assertEquals("{broken", Files.readString(config.ledgerFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void contendedLockSkipsTheCycle() throws Exception {
        Path root = Files.createTempDirectory("pairledger-runner-nolock-");
        try {
            PairLedgerConfig config = PairLedgerConfig.fromRoot(root.toString());
            LedgerAdmin admin = admin(config);
            admin.init(false);
            admin.createFullPair("build", null, "test", null, 1, "fp1");
            admin.advanceNextPair(true);

            LockManager other = new LockManager(config.lockFile(), "agent_X");
            Assertions.assertTrue(other.acquire(FAST.agentMaxWait(), FAST.agentRetryInterval(), FAST.staleTimeout()));

            RecordingWorker worker = new RecordingWorker(WorkResult.completed("ok"));
            AgentRunner.CycleOutcome outcome = runner(config, "agent_A", worker).runCycle();
            Assertions.assertFalse(outcome.worked());
            Assertions.assertEquals(AgentRunner.CycleResult.NO_LOCK, outcome.result());
            Assertions.assertTrue(other.isHeldByMe());
            Assertions.assertTrue(worker.taskIds.isEmpty());
            Assertions.assertTrue(other.release());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reassignmentDuringWorkDiscardsResult() throws Exception {
        Path root = Files.createTempDirectory("pairledger-runner-superseded-");
        try {
            PairLedgerConfig config = PairLedgerConfig.fromRoot(root.toString());
            LedgerAdmin admin = admin(config);
            admin.init(false);
            admin.createFullPair("build", "agent_A", "test", "agent_B", 1, "fp1");
            admin.advanceNextPair(true);

            JsonFileLedgerStore store = new JsonFileLedgerStore(config.ledgerFile());
            TaskWorker reassigning = new TaskWorker() {
                @Override
                public String id() {
                    return "reassigning";
                }

                @Override
                public WorkResult perform(WorkContext context) {
                    Ledger ledger = store.read().orElseThrow();
                    Task task = ledger.findTask(context.taskId()).orElseThrow();
                    Assertions.assertEquals(TaskStatus.IN_PROGRESS, task.getStatus());
                    Assertions.assertEquals("agent_A", task.getAssignedTo());
                    Assertions.assertFalse(Files.exists(config.lockFile()));
                    task.setAssignedTo("agent_X");
                    Assertions.assertTrue(store.write(ledger));
                    return WorkResult.completed("done");
                }
            };

            AgentRunner.CycleOutcome outcome = runner(config, "agent_A", reassigning).runCycle();
            Assertions.assertTrue(outcome.worked());
            Assertions.assertEquals(AgentRunner.CycleResult.SUPERSEDED, outcome.result());

            Task task = read(config).findTask("fp1_t1").orElseThrow();
            Assertions.assertEquals(TaskStatus.IN_PROGRESS, task.getStatus());
            Assertions.assertEquals("agent_X", task.getAssignedTo());
            Assertions.assertFalse(Files.exists(config.lockFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lostLockAtFinalizeIsReportedAndLeavesForeignLock() throws Exception {
        Path root = Files.createTempDirectory("pairledger-runner-lostlock-");
        try {
            PairLedgerConfig config = PairLedgerConfig.fromRoot(root.toString());
            LedgerAdmin admin = admin(config);
            admin.init(false);
            admin.createFullPair("build", null, "test", null, 1, "fp1");
            admin.advanceNextPair(true);

            LockManager intruder = new LockManager(config.lockFile(), "agent_X");
            TaskWorker grabbing = new TaskWorker() {
                @Override
                public String id() {
                    return "grabbing";
                }

                @Override
                public WorkResult perform(WorkContext context) {
                    Assertions.assertTrue(intruder.acquire(FAST.agentMaxWait(), FAST.agentRetryInterval(),
                            FAST.staleTimeout()));
                    return WorkResult.completed("done");
                }
            };

            AgentRunner.CycleOutcome outcome = runner(config, "agent_A", grabbing).runCycle();
            Assertions.assertTrue(outcome.worked());
            Assertions.assertEquals(AgentRunner.CycleResult.FINALIZE_LOCK_LOST, outcome.result());
            Assertions.assertEquals("fp1_t1", outcome.taskId());
            Assertions.assertTrue(intruder.isHeldByMe());

            Task task = read(config).findTask("fp1_t1").orElseThrow();
            Assertions.assertEquals(TaskStatus.IN_PROGRESS, task.getStatus());
            Assertions.assertEquals("agent_A", task.getAssignedTo());
            Assertions.assertTrue(intruder.release());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void workerExceptionRecordsFailureAndReleasesLock() throws Exception {
        Path root = Files.createTempDirectory("pairledger-runner-throw-");
        try {
            PairLedgerConfig config = PairLedgerConfig.fromRoot(root.toString());
            LedgerAdmin admin = admin(config);
            admin.init(false);
            admin.createFullPair("build", null, "test", null, 1, "fp1");
            admin.createFullPair("next", null, "next", null, 2, "fp2");
            admin.advanceNextPair(true);

            TaskWorker throwing = new TaskWorker() {
                @Override
                public String id() {
                    return "throwing";
                }

                @Override
                public WorkResult perform(WorkContext context) throws Exception {
                    throw new IOException("disk on fire");
                }
            };

            AgentRunner.CycleOutcome outcome = runner(config, "agent_A", throwing).runCycle();
            Assertions.assertTrue(outcome.worked());
            Assertions.assertEquals(AgentRunner.CycleResult.FINALIZED, outcome.result());
            Assertions.assertFalse(Files.exists(config.lockFile()));

            Ledger ledger = read(config);
            Assertions.assertEquals(TaskStatus.FAILED, ledger.findTask("fp1_t1").orElseThrow().getStatus());
            Assertions.assertEquals(PairStatus.READY, ledger.findPair("fp1_p").orElseThrow().getStatus());
            Assertions.assertEquals(PairStatus.BLOCKED, ledger.findPair("fp2_p").orElseThrow().getStatus());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void boundedRunCountsWorkedCycles() throws Exception {
        Path root = Files.createTempDirectory("pairledger-runner-run-");
        try {
            PairLedgerConfig config = PairLedgerConfig.fromRoot(root.toString());
            LedgerAdmin admin = admin(config);
            admin.init(false);
            admin.createFullPair("build", null, "test", null, 1, "fp1");
            admin.advanceNextPair(true);

            RecordingWorker worker = new RecordingWorker(WorkResult.completed("ok"));
            AgentRunner.RunSummary summary = runner(config, "agent_A", worker).run(3, Duration.ZERO);

            Assertions.assertEquals(3, summary.cycles());
            Assertions.assertEquals(2, summary.workedCycles());
            Assertions.assertEquals(List.of("fp1_t1", "fp1_t2"), worker.taskIds);
            Assertions.assertEquals(PairStatus.COMPLETED, read(config).findPair("fp1_p").orElseThrow().getStatus());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runnerRequiresMatchingLockOwner() throws Exception {
        Path root = Files.createTempDirectory("pairledger-runner-owner-");
        try {
            PairLedgerConfig config = PairLedgerConfig.fromRoot(root.toString());
            Assertions.assertThrows(IllegalArgumentException.class, () -> new AgentRunner(
                    "agent_A",
                    new LockManager(config.lockFile(), "agent_B"),
                    new JsonFileLedgerStore(config.ledgerFile()),
                    new PairStateMachine(),
                    new RecordingWorker(WorkResult.completed("ok")),
                    null,
                    FAST));
        } finally {
            deleteRecursively(root);
        }
    }

    private static LedgerAdmin admin(PairLedgerConfig config) {
        return new LedgerAdmin(
                new LockManager(config.lockFile(), "cli_user_test"),
                new JsonFileLedgerStore(config.ledgerFile()),
                new PairStateMachine(),
                new AuditLogger(config.auditFile()),
                FAST
        );
    }

    private static AgentRunner runner(PairLedgerConfig config, String agentId, TaskWorker worker) {
        return AgentRunner.create(config, FAST, agentId, worker);
    }

    private static Ledger read(PairLedgerConfig config) {
        return new JsonFileLedgerStore(config.ledgerFile()).read().orElseThrow();
    }

    private static final class RecordingWorker implements TaskWorker {
        private final WorkResult result;
        private final List<String> taskIds = new ArrayList<>();

        private RecordingWorker(WorkResult result) {
            this.result = result;
        }

        @Override
        public String id() {
            return "recording";
        }

        @Override
        public WorkResult perform(WorkContext context) {
            taskIds.add(context.taskId());
            return result;
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
