package io.pairledger.engine;

import io.pairledger.model.EventKind;
import io.pairledger.model.HistoryEvent;
import io.pairledger.model.Ledger;
import io.pairledger.model.PairStatus;
import io.pairledger.model.Task;
import io.pairledger.model.TaskPair;
import io.pairledger.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class PairStateMachine {
    private static final Logger log = LoggerFactory.getLogger(PairStateMachine.class);

    private final Clock clock;

    public PairStateMachine() {
        this(Clock.systemUTC());
    }

    public PairStateMachine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // Lowest sequence_index among READY unlocked pairs; ties keep ledger order.
    public Optional<TaskPair> findActivePair(Ledger ledger) {
        TaskPair best = null;
        for (TaskPair pair : ledger.getTaskPairs()) {
            if (pair == null || pair.getStatus() != PairStatus.READY || pair.isPairLock()) {
                continue;
            }
            if (best == null || pair.sequenceOrder() < best.sequenceOrder()) {
                best = pair;
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<Task> findClaimableTask(TaskPair activePair, Ledger ledger, String agentId) {
        for (String taskId : activePair.getTasks()) {
            Optional<Task> task = ledger.findTask(taskId);
            if (task.isEmpty()) {
                log.error("Task '{}' in pair '{}' not found in tasks list; skipping", taskId, activePair.getPairId());
                continue;
            }
            Task candidate = task.get();
            if (candidate.getStatus() == TaskStatus.PENDING
                    && candidate.acceptsAgent(agentId)
                    && candidate.isUnassigned()) {
                return task;
            }
        }
        return Optional.empty();
    }

    public void claim(Task task, String agentId) {
        requireAgent(agentId);
        if (task.getStatus() != TaskStatus.PENDING || !task.isUnassigned()) {
            throw new IllegalStateException("Task '" + task.getId() + "' is not claimable: status="
                    + task.getStatus() + " assigned_to=" + task.getAssignedTo());
        }
        task.setStatus(TaskStatus.IN_PROGRESS);
        task.setAssignedTo(agentId);
        task.appendHistory(HistoryEvent.of(now(), EventKind.ASSIGNED, agentId,
                "Assigned to and claimed by " + agentId));
    }

    // Only the current assignee may record an outcome.
    public FinalizeOutcome finalizeTask(Task task, TaskStatus finalStatus, String agentId) {
        requireAgent(agentId);
        if (finalStatus == null || !finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Final status must be COMPLETED or FAILED: " + finalStatus);
        }
        if (!agentId.equals(task.getAssignedTo())) {
            return FinalizeOutcome.SUPERSEDED;
        }
        TaskStatus current = task.getStatus();
        if (current == finalStatus) {
            return FinalizeOutcome.UNCHANGED;
        }
        if (!current.canTransitionTo(finalStatus)) {
            log.error("Rejected transition of task '{}' from {} to {}", task.getId(), current, finalStatus);
            return FinalizeOutcome.REJECTED;
        }
        task.setStatus(finalStatus);
        task.appendHistory(HistoryEvent.of(now(), EventKind.STATUS_CHANGED, agentId,
                "Status changed from " + current + " to " + finalStatus + " by " + agentId));
        return FinalizeOutcome.APPLIED;
    }

    public AdvanceOutcome advanceIfPairComplete(TaskPair pair, Ledger ledger, String actor) {
        if (pair.getStatus() == PairStatus.COMPLETED) {
            return AdvanceOutcome.notAdvanced(pair.getPairId());
        }
        if (!allTasksCompleted(pair, ledger)) {
            return AdvanceOutcome.notAdvanced(pair.getPairId());
        }
        if (!pair.getStatus().canTransitionTo(PairStatus.COMPLETED)) {
            log.error("Pair '{}' has all tasks COMPLETED but is {}; not completing it",
                    pair.getPairId(), pair.getStatus());
            return AdvanceOutcome.notAdvanced(pair.getPairId());
        }
        pair.setStatus(PairStatus.COMPLETED);
        pair.setPairLock(true);
        pair.appendHistory(HistoryEvent.of(now(), EventKind.STATUS_CHANGED, actor,
                "Pair status changed to COMPLETED by " + actor));
        log.info("All tasks in pair '{}' are COMPLETED", pair.getPairId());

        if (pair.getSequenceIndex() == null) {
            log.error("Completed pair '{}' has no sequence_index; cannot select the next pair", pair.getPairId());
            return new AdvanceOutcome(true, pair.getPairId(), null);
        }
        Optional<TaskPair> next = lowestBlocked(ledger, pair.getSequenceIndex());
        if (next.isEmpty()) {
            log.info("No BLOCKED pair after sequence {}; no further ready work", pair.getSequenceIndex());
            return new AdvanceOutcome(true, pair.getPairId(), null);
        }
        TaskPair opened = next.get();
        markReady(opened, actor, "Pair status changed to READY by " + actor + " (advancement)");
        log.info("Advanced pair '{}' (seq {}) to READY", opened.getPairId(), opened.getSequenceIndex());
        return new AdvanceOutcome(true, pair.getPairId(), opened.getPairId());
    }

    public Optional<TaskPair> pairOf(Task task, Ledger ledger) {
        Optional<TaskPair> byId = ledger.findPair(task.getPairId());
        if (byId.isPresent()) {
            return byId;
        }
        return ledger.getTaskPairs().stream()
                .filter(Objects::nonNull)
                .filter(pair -> pair.getTasks().contains(task.getId()))
                .findFirst();
    }

    public AdvanceSelection selectPairToAdvance(Ledger ledger, boolean force) {
        if (ledger.getTaskPairs().isEmpty()) {
            return AdvanceSelection.none("No task pairs exist in the ledger.");
        }
        if (force) {
            return lowestBlocked(ledger, Long.MIN_VALUE)
                    .map(AdvanceSelection::of)
                    .orElseGet(() -> AdvanceSelection.none("No suitable BLOCKED pair found to advance."));
        }
        long lastCompleted = Long.MIN_VALUE;
        boolean anyCompleted = false;
        for (TaskPair pair : ledger.getTaskPairs()) {
            if (pair != null && pair.getStatus() == PairStatus.COMPLETED && pair.getSequenceIndex() != null) {
                anyCompleted = true;
                lastCompleted = Math.max(lastCompleted, pair.getSequenceIndex());
            }
        }
        if (!anyCompleted) {
            return AdvanceSelection.none("No COMPLETED task pairs found to determine the next one. "
                    + "Use --force to advance the lowest BLOCKED pair.");
        }
        long after = lastCompleted;
        return lowestBlocked(ledger, after)
                .map(AdvanceSelection::of)
                .orElseGet(() -> AdvanceSelection.none(
                        "No suitable BLOCKED pair found to advance (after sequence " + after + ")."));
    }

    public void markReady(TaskPair pair, String actor, String details) {
        if (!pair.getStatus().canTransitionTo(PairStatus.READY)) {
            throw new IllegalStateException("Pair '" + pair.getPairId() + "' cannot become READY from "
                    + pair.getStatus());
        }
        pair.setStatus(PairStatus.READY);
        pair.setPairLock(false);
        pair.appendHistory(HistoryEvent.of(now(), EventKind.STATUS_CHANGED, actor, details));
    }

    public Task createTask(String taskId, String pairId, String agentPreference, String description, String actor) {
        Instant now = now();
        Task task = new Task(taskId, blankToNull(pairId), blankToNull(agentPreference), description, now);
        task.appendHistory(HistoryEvent.of(now, EventKind.CREATED, actor, "Task created by " + actor));
        return task;
    }

    public TaskPair createPair(String pairId, List<String> taskIds, int sequenceIndex,
                               PairStatus status, boolean pairLock, String actor) {
        if (taskIds.size() != 2) {
            throw new IllegalArgumentException("A pair links exactly two tasks, got " + taskIds.size());
        }
        if (taskIds.get(0).equals(taskIds.get(1))) {
            throw new IllegalArgumentException("A pair cannot link task '" + taskIds.get(0) + "' twice");
        }
        Instant now = now();
        TaskPair pair = new TaskPair(pairId, taskIds, status, pairLock, sequenceIndex, now);
        pair.appendHistory(HistoryEvent.of(now, EventKind.CREATED, actor, "Pair created by " + actor));
        return pair;
    }

    public void linkToPair(Task task, String pairId, String actor) {
        task.setPairId(pairId);
        task.appendHistory(HistoryEvent.of(now(), EventKind.UPDATED, actor, "Associated with pair_id " + pairId));
    }

    private boolean allTasksCompleted(TaskPair pair, Ledger ledger) {
        if (pair.getTasks().isEmpty()) {
            return false;
        }
        for (String taskId : pair.getTasks()) {
            Optional<Task> task = ledger.findTask(taskId);
            if (task.isEmpty() || task.get().getStatus() != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private Optional<TaskPair> lowestBlocked(Ledger ledger, long strictlyAbove) {
        TaskPair best = null;
        for (TaskPair pair : ledger.getTaskPairs()) {
            if (pair == null || pair.getStatus() != PairStatus.BLOCKED || pair.getSequenceIndex() == null) {
                continue;
            }
            if (pair.getSequenceIndex() <= strictlyAbove) {
                continue;
            }
            if (best == null || pair.getSequenceIndex() < best.getSequenceIndex()) {
                best = pair;
            }
        }
        return Optional.ofNullable(best);
    }

    private Instant now() {
        return clock.instant();
    }

    private static void requireAgent(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public enum FinalizeOutcome {
        APPLIED,
        UNCHANGED,
        SUPERSEDED,
        REJECTED
    }

    public record AdvanceOutcome(boolean pairCompleted, String pairId, String advancedPairId) {
        static AdvanceOutcome notAdvanced(String pairId) {
            return new AdvanceOutcome(false, pairId, null);
        }

        public boolean advanced() {
            return advancedPairId != null;
        }
    }

    public record AdvanceSelection(TaskPair pair, String message) {
        static AdvanceSelection of(TaskPair pair) {
            return new AdvanceSelection(pair, null);
        }

        static AdvanceSelection none(String message) {
            return new AdvanceSelection(null, message);
        }

        public Optional<TaskPair> candidate() {
            return Optional.ofNullable(pair);
        }
    }
}
