package io.pairledger.runtime;

import io.pairledger.config.LedgerSettings;
import io.pairledger.config.PairLedgerConfig;
import io.pairledger.engine.PairStateMachine;
import io.pairledger.engine.PairStateMachine.AdvanceOutcome;
import io.pairledger.engine.PairStateMachine.FinalizeOutcome;
import io.pairledger.lock.LockManager;
import io.pairledger.model.Ledger;
import io.pairledger.model.Task;
import io.pairledger.model.TaskPair;
import io.pairledger.model.TaskStatus;
import io.pairledger.observability.AuditLogger;
import io.pairledger.observability.LoggingContext;
import io.pairledger.storage.JsonFileLedgerStore;
import io.pairledger.storage.LedgerStore;
import io.pairledger.worker.TaskWorker;
import io.pairledger.worker.WorkContext;
import io.pairledger.worker.WorkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One agent's claim, work, finalize loop.
 *
 * <p>A cycle holds the ledger lock twice: once to claim a task and once to
 * record its outcome. The lock is not held while the worker runs, so the
 * ledger is re-read and the assignment re-checked before the outcome is
 * written. Every exit path releases a lock this agent took.
 */
public final class AgentRunner {
    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final String agentId;
    private final LockManager lockManager;
    private final LedgerStore ledgerStore;
    private final PairStateMachine stateMachine;
    private final TaskWorker worker;
    private final AuditLogger auditLogger;
    private final LedgerSettings settings;

    public AgentRunner(
            String agentId,
            LockManager lockManager,
            LedgerStore ledgerStore,
            PairStateMachine stateMachine,
            TaskWorker worker,
            AuditLogger auditLogger,
            LedgerSettings settings
    ) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (!agentId.equals(lockManager.agentId())) {
            throw new IllegalArgumentException("lock manager belongs to '" + lockManager.agentId()
                    + "', not '" + agentId + "'");
        }
        this.agentId = agentId;
        this.lockManager = lockManager;
        this.ledgerStore = Objects.requireNonNull(ledgerStore, "ledgerStore");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.auditLogger = auditLogger;
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public static AgentRunner create(PairLedgerConfig config, LedgerSettings settings, String agentId, TaskWorker worker) {
        return new AgentRunner(
                agentId,
                new LockManager(config.lockFile(), agentId),
                new JsonFileLedgerStore(config.ledgerFile()),
                new PairStateMachine(),
                worker,
                new AuditLogger(config.auditFile()),
                settings
        );
    }

    public String agentId() {
        return agentId;
    }

    public RunSummary run(Integer cycles, Duration interval) {
        log.info("Agent {} starting run loop. Max cycles: {}. Interval: {}",
                agentId, cycles == null ? "infinite" : cycles, interval);
        int executed = 0;
        int worked = 0;
        while (cycles == null || executed < cycles) {
            try {
                CycleOutcome outcome = runCycle();
                if (outcome.worked()) {
                    worked++;
                }
                log.info("Cycle {}: {} ({})", executed + 1, outcome.result(), outcome.message());
            } catch (RuntimeException e) {
                log.error("Unhandled error in agent {} run loop", agentId, e);
            }
            executed++;
            if (cycles != null && executed >= cycles) {
                break;
            }
            if (!sleep(interval)) {
                log.warn("Agent {} interrupted; stopping run loop", agentId);
                break;
            }
        }
        log.info("Agent {} run loop finished after {} cycles ({} with work)", agentId, executed, worked);
        return new RunSummary(executed, worked);
    }

    public CycleOutcome runCycle() {
        try (LoggingContext ctx = LoggingContext.forAgent(agentId)) {
            if (!lockManager.acquire(settings.agentMaxWait(), settings.agentRetryInterval(), settings.staleTimeout())) {
                log.warn("Could not acquire lock. Will retry later.");
                return CycleOutcome.idle(CycleResult.NO_LOCK, "Could not acquire lock");
            }
            ClaimAttempt claim;
            try {
                claim = claimUnderLock();
            } catch (RuntimeException e) {
                log.error("Error while claiming a task", e);
                return CycleOutcome.idle(CycleResult.CLAIM_FAILED, "Error while claiming: " + e.getMessage());
            } finally {
                lockManager.release();
            }
            if (claim.outcome() != null) {
                return claim.outcome();
            }

            WorkContext context = claim.context();
            ctx.task(context.taskId());
            log.info("Lock released before performing work for task '{}'", context.taskId());
            WorkResult result = performWork(context);
            return finalizeWork(context, result);
        }
    }

    private ClaimAttempt claimUnderLock() {
        Optional<Ledger> read = ledgerStore.read();
        if (read.isEmpty()) {
            log.error("Ledger {} is unreadable; skipping this cycle", ledgerStore.location());
            return ClaimAttempt.skip(CycleOutcome.idle(CycleResult.LEDGER_UNREADABLE, "Ledger could not be read"));
        }
        Ledger ledger = read.get();
        Optional<TaskPair> activePair = stateMachine.findActivePair(ledger);
        if (activePair.isEmpty()) {
            log.info("No READY and unlocked task pairs found.");
            return ClaimAttempt.skip(CycleOutcome.idle(CycleResult.NO_ACTIVE_PAIR, "No active pair"));
        }
        TaskPair pair = activePair.get();
        log.debug("Found active pair: {} (seq {})", pair.getPairId(), pair.getSequenceIndex());
        Optional<Task> claimable = stateMachine.findClaimableTask(pair, ledger, agentId);
        if (claimable.isEmpty()) {
            log.info("No claimable PENDING task for {} in pair '{}'", agentId, pair.getPairId());
            return ClaimAttempt.skip(CycleOutcome.idle(CycleResult.NO_CLAIMABLE_TASK,
                    "No claimable task in pair " + pair.getPairId()));
        }
        Task task = claimable.get();
        stateMachine.claim(task, agentId);
        if (!ledgerStore.write(ledger)) {
            log.error("Failed to write claim of task '{}'; not performing work", task.getId());
            return ClaimAttempt.skip(CycleOutcome.idle(CycleResult.CLAIM_WRITE_FAILED,
                    "Claim of " + task.getId() + " could not be written"));
        }
        audit("task.claim", "task/" + task.getId(), "claimed", Map.of("pair_id", pair.getPairId()));
        log.info("Task '{}' claimed from pair '{}' and set to IN_PROGRESS", task.getId(), pair.getPairId());
        String pairId = task.getPairId() == null ? pair.getPairId() : task.getPairId();
        return ClaimAttempt.claimed(new WorkContext(agentId, task.getId(), pairId, task.getDescription()));
    }

    private WorkResult performWork(WorkContext context) {
        try {
            WorkResult result = worker.perform(context);
            if (result == null) {
                log.error("Worker {} returned no result for task '{}'; recording FAILED", worker.id(), context.taskId());
                return WorkResult.failed("worker returned no result");
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Work on task '{}' was interrupted; recording FAILED", context.taskId());
            return WorkResult.failed("interrupted");
        } catch (Exception e) {
            log.error("Worker {} threw while working on task '{}'; recording FAILED", worker.id(), context.taskId(), e);
            return WorkResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private CycleOutcome finalizeWork(WorkContext context, WorkResult result) {
        String taskId = context.taskId();
        TaskStatus finalStatus = result.status();
        if (!lockManager.acquire(settings.agentMaxWait(), settings.agentRetryInterval(), settings.staleTimeout())) {
            log.error("CRITICAL: Could not re-acquire lock to finalize task '{}'. Status: {}. "
                    + "Manual intervention may be needed.", taskId, finalStatus);
            return CycleOutcome.worked(CycleResult.FINALIZE_LOCK_LOST, taskId, context.pairId(),
                    "Work finished as " + finalStatus + " but could not be recorded");
        }
        try {
            Optional<Ledger> read = ledgerStore.read();
            if (read.isEmpty()) {
                log.error("CRITICAL: Could not read ledger to finalize task '{}' as {}", taskId, finalStatus);
                return CycleOutcome.worked(CycleResult.FINALIZE_FAILED, taskId, context.pairId(),
                        "Ledger unreadable at finalize");
            }
            Ledger ledger = read.get();
            Optional<Task> maybeTask = ledger.findTask(taskId);
            if (maybeTask.isEmpty()) {
                log.error("Task '{}' no longer found in ledger upon finalize", taskId);
                return CycleOutcome.worked(CycleResult.TASK_MISSING, taskId, context.pairId(),
                        "Task disappeared before finalize");
            }
            Task task = maybeTask.get();
            FinalizeOutcome finalized = stateMachine.finalizeTask(task, finalStatus, agentId);
            if (finalized == FinalizeOutcome.SUPERSEDED) {
                log.warn("Task '{}' was reassigned from {} to {} before finalization. Not updating.",
                        taskId, agentId, task.getAssignedTo());
                audit("task.finalize", "task/" + taskId, "superseded",
                        details("final_status", finalStatus.name(), "assigned_to", task.getAssignedTo()));
                return CycleOutcome.worked(CycleResult.SUPERSEDED, taskId, context.pairId(),
                        "Task reassigned to " + task.getAssignedTo() + "; result discarded");
            }
            if (finalized == FinalizeOutcome.REJECTED) {
                return CycleOutcome.worked(CycleResult.FINALIZE_FAILED, taskId, context.pairId(),
                        "Task is " + task.getStatus() + "; cannot record " + finalStatus);
            }

            Optional<TaskPair> pair = stateMachine.pairOf(task, ledger);
            AdvanceOutcome advance = pair
                    .map(p -> stateMachine.advanceIfPairComplete(p, ledger, agentId))
                    .orElse(null);
            boolean changed = finalized == FinalizeOutcome.APPLIED || (advance != null && advance.pairCompleted());
            if (changed && !ledgerStore.write(ledger)) {
                log.error("CRITICAL: Failed to write final status {} of task '{}'", finalStatus, taskId);
                return CycleOutcome.worked(CycleResult.FINALIZE_FAILED, taskId, context.pairId(),
                        "Final status could not be written");
            }
            auditFinalize(task, finalStatus, finalized, result, advance);
            log.info("Task '{}' finalized with status '{}'", taskId, finalStatus);
            return CycleOutcome.worked(CycleResult.FINALIZED, taskId, context.pairId(), describe(finalStatus, advance));
        } catch (RuntimeException e) {
            log.error("CRITICAL ERROR during task finalization for '{}'", taskId, e);
            return CycleOutcome.worked(CycleResult.FINALIZE_FAILED, taskId, context.pairId(),
                    "Finalize failed: " + e.getMessage());
        } finally {
            lockManager.release();
        }
    }

    private void auditFinalize(Task task, TaskStatus finalStatus, FinalizeOutcome finalized,
                               WorkResult result, AdvanceOutcome advance) {
        audit("task.finalize", "task/" + task.getId(), finalized == FinalizeOutcome.APPLIED ? "applied" : "unchanged",
                details("final_status", finalStatus.name(), "error", result.error()));
        if (advance != null && advance.pairCompleted()) {
            audit("pair.complete", "pair/" + advance.pairId(), "completed", Map.of());
            if (advance.advanced()) {
                audit("pair.advance", "pair/" + advance.advancedPairId(), "ready",
                        Map.of("after_pair_id", advance.pairId()));
            }
        }
    }

    private static String describe(TaskStatus finalStatus, AdvanceOutcome advance) {
        StringBuilder sb = new StringBuilder("Task finalized as ").append(finalStatus);
        if (advance != null && advance.pairCompleted()) {
            sb.append("; pair ").append(advance.pairId()).append(" COMPLETED");
            if (advance.advanced()) {
                sb.append("; pair ").append(advance.advancedPairId()).append(" READY");
            }
        }
        return sb.toString();
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(action, agentId, resource, result, details));
    }

    private static Map<String, Object> details(String k1, String v1, String k2, String v2) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(k1, v1);
        if (v2 != null) {
            out.put(k2, v2);
        }
        return out;
    }

    private static boolean sleep(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private record ClaimAttempt(WorkContext context, CycleOutcome outcome) {
        static ClaimAttempt claimed(WorkContext context) {
            return new ClaimAttempt(context, null);
        }

        static ClaimAttempt skip(CycleOutcome outcome) {
            return new ClaimAttempt(null, outcome);
        }
    }

    public enum CycleResult {
        NO_LOCK,
        LEDGER_UNREADABLE,
        NO_ACTIVE_PAIR,
        NO_CLAIMABLE_TASK,
        CLAIM_WRITE_FAILED,
        CLAIM_FAILED,
        FINALIZED,
        SUPERSEDED,
        TASK_MISSING,
        FINALIZE_LOCK_LOST,
        FINALIZE_FAILED
    }

    public record CycleOutcome(boolean worked, CycleResult result, String taskId, String pairId, String message) {
        static CycleOutcome idle(CycleResult result, String message) {
            return new CycleOutcome(false, result, null, null, message);
        }

        static CycleOutcome worked(CycleResult result, String taskId, String pairId, String message) {
            return new CycleOutcome(true, result, taskId, pairId, message);
        }
    }

    public record RunSummary(int cycles, int workedCycles) {
    }
}
