package io.pairledger.runtime;

import io.pairledger.config.LedgerSettings;
import io.pairledger.config.PairLedgerConfig;
import io.pairledger.engine.LedgerValidator;
import io.pairledger.engine.LedgerValidator.ValidationReport;
import io.pairledger.engine.PairStateMachine;
import io.pairledger.engine.PairStateMachine.AdvanceSelection;
import io.pairledger.lock.LockManager;
import io.pairledger.lock.LockManager.LockInspection;
import io.pairledger.model.Ledger;
import io.pairledger.model.PairStatus;
import io.pairledger.model.Task;
import io.pairledger.model.TaskPair;
import io.pairledger.observability.AuditLogger;
import io.pairledger.observability.AuditLogger.IntegrityOutcome;
import io.pairledger.storage.JsonFileLedgerStore;
import io.pairledger.storage.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

public final class LedgerAdmin {
    private static final Logger log = LoggerFactory.getLogger(LedgerAdmin.class);

    private final String actor;
    private final LockManager lockManager;
    private final LedgerStore ledgerStore;
    private final PairStateMachine stateMachine;
    private final LedgerValidator validator;
    private final AuditLogger auditLogger;
    private final LedgerSettings settings;
    private final List<AuditLogger.AuditEvent> pendingAudit = new ArrayList<>();

    public LedgerAdmin(
            LockManager lockManager,
            LedgerStore ledgerStore,
            PairStateMachine stateMachine,
            AuditLogger auditLogger,
            LedgerSettings settings
    ) {
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
        this.actor = lockManager.agentId();
        this.ledgerStore = Objects.requireNonNull(ledgerStore, "ledgerStore");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.validator = new LedgerValidator();
        this.auditLogger = auditLogger;
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public static LedgerAdmin create(PairLedgerConfig config, LedgerSettings settings) {
        return new LedgerAdmin(
                new LockManager(config.lockFile(), defaultActor()),
                new JsonFileLedgerStore(config.ledgerFile()),
                new PairStateMachine(),
                new AuditLogger(config.auditFile()),
                settings
        );
    }

    public static String defaultActor() {
        return "cli_user_" + ProcessHandle.current().pid();
    }

    public String actor() {
        return actor;
    }

    public synchronized InitOutcome init(boolean force) {
        pendingAudit.clear();
        return underLock(() -> {
            boolean existed = ledgerStore.exists();
            if (existed && !force) {
                throw new IllegalStateException("Ledger " + ledgerStore.location()
                        + " already exists. Use --force to overwrite.");
            }
            if (existed) {
                log.warn("Overwriting existing ledger {}", ledgerStore.location());
            }
            if (!ledgerStore.write(Ledger.empty())) {
                throw new IllegalStateException("Failed to write ledger " + ledgerStore.location());
            }
            audit("ledger.init", "ledger", existed ? "overwritten" : "created", Map.of());
            flushAudit();
            return new InitOutcome(ledgerStore.location().toString(), existed);
        });
    }

    public TaskOutcome addTask(String description, String agentPreference, String pairId, String taskId) {
        requireText("description", description);
        String id = isBlank(taskId) ? UUID.randomUUID().toString() : taskId.trim();
        return mutate(ledger -> {
            if (ledger.findTask(id).isPresent()) {
                throw new IllegalArgumentException("Task with ID '" + id + "' already exists.");
            }
            List<String> warnings = new ArrayList<>();
            if (!isBlank(pairId) && ledger.findPair(pairId.trim()).isEmpty()) {
                warnings.add("Pair '" + pairId.trim() + "' does not exist yet; task pair_id is orphaned until it is added.");
            }
            Task task = stateMachine.createTask(id, pairId, agentPreference, description, actor);
            ledger.getTasks().add(task);
            audit("task.add", "task/" + id, "created", details("pair_id", task.getPairId()));
            log.info("Task '{}' added", id);
            return new TaskOutcome(id, warnings);
        });
    }

    public PairOutcome addPair(String taskId1, String taskId2, int sequenceIndex,
                               String pairId, PairStatus status, Boolean pairLock) {
        requireText("task-id1", taskId1);
        requireText("task-id2", taskId2);
        if (taskId1.trim().equals(taskId2.trim())) {
            throw new IllegalArgumentException("A pair cannot link task '" + taskId1.trim() + "' twice.");
        }
        String id = isBlank(pairId) ? "pair_" + shortId(8) : pairId.trim();
        PairStatus initialStatus = status == null ? PairStatus.BLOCKED : status;
        boolean lock = pairLock == null ? initialStatus != PairStatus.READY : pairLock;
        return mutate(ledger -> {
            if (ledger.findPair(id).isPresent()) {
                throw new IllegalArgumentException("Pair with ID '" + id + "' already exists.");
            }
            List<String> warnings = new ArrayList<>();
            List<Task> members = new ArrayList<>();
            for (String taskId : List.of(taskId1.trim(), taskId2.trim())) {
                Task task = ledger.findTask(taskId).orElseThrow(
                        () -> new IllegalArgumentException("Task ID '" + taskId + "' not found."));
                if (!isBlank(task.getPairId()) && !id.equals(task.getPairId())) {
                    warnings.add("Task '" + taskId + "' was linked to pair '" + task.getPairId()
                            + "'; relinking to '" + id + "'.");
                }
                members.add(task);
            }
            for (TaskPair existing : ledger.getTaskPairs()) {
                if (existing != null && Objects.equals(existing.getSequenceIndex(), sequenceIndex)) {
                    warnings.add("Sequence index " + sequenceIndex + " is already used by pair '"
                            + existing.getPairId() + "'.");
                }
            }
            TaskPair pair = stateMachine.createPair(id, List.of(taskId1.trim(), taskId2.trim()),
                    sequenceIndex, initialStatus, lock, actor);
            ledger.getTaskPairs().add(pair);
            for (Task task : members) {
                stateMachine.linkToPair(task, id, actor);
            }
            audit("pair.add", "pair/" + id, "created", details("status", initialStatus.name()));
            log.info("Pair '{}' added at sequence {}", id, sequenceIndex);
            return new PairOutcome(id, sequenceIndex, initialStatus, warnings);
        });
    }

    public FullPairOutcome createFullPair(String description1, String agent1,
                                          String description2, String agent2,
                                          int sequenceIndex, String pairPrefix) {
        requireText("desc1", description1);
        requireText("desc2", description2);
        String prefix = isBlank(pairPrefix) ? "fp_" + shortId(4) : pairPrefix.trim();
        String taskId1 = prefix + "_t1";
        String taskId2 = prefix + "_t2";
        String pairId = prefix + "_p";
        return mutate(ledger -> {
            for (String taskId : List.of(taskId1, taskId2)) {
                if (ledger.findTask(taskId).isPresent()) {
                    throw new IllegalArgumentException("Task with ID '" + taskId + "' already exists.");
                }
            }
            if (ledger.findPair(pairId).isPresent()) {
                throw new IllegalArgumentException("Pair with ID '" + pairId + "' already exists.");
            }
            ledger.getTasks().add(stateMachine.createTask(taskId1, pairId, agent1, description1, actor));
            ledger.getTasks().add(stateMachine.createTask(taskId2, pairId, agent2, description2, actor));
            ledger.getTaskPairs().add(stateMachine.createPair(pairId, List.of(taskId1, taskId2),
                    sequenceIndex, PairStatus.BLOCKED, true, actor));
            audit("pair.create_full", "pair/" + pairId, "created",
                    details("tasks", taskId1 + "," + taskId2));
            log.info("Full pair '{}' created with tasks '{}' and '{}'", pairId, taskId1, taskId2);
            return new FullPairOutcome(pairId, taskId1, taskId2, sequenceIndex);
        });
    }

    public Object status(String pairId, String taskId) {
        if (!isBlank(pairId) && !isBlank(taskId)) {
            throw new IllegalArgumentException("Use either --pair-id or --task-id, not both.");
        }
        Ledger ledger = readOrThrow();
        if (!isBlank(pairId)) {
            TaskPair pair = ledger.findPair(pairId.trim()).orElseThrow(
                    () -> new IllegalArgumentException("Pair with ID '" + pairId.trim() + "' not found."));
            List<Object> tasks = new ArrayList<>();
            for (String id : pair.getTasks()) {
                Optional<Task> task = ledger.findTask(id);
                if (task.isPresent()) {
                    tasks.add(task.get());
                } else {
                    Map<String, String> missing = new LinkedHashMap<>();
                    missing.put("id", id);
                    missing.put("error", "Not Found");
                    tasks.add(missing);
                }
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("pair", pair);
            out.put("associated_tasks", tasks);
            return out;
        }
        if (!isBlank(taskId)) {
            return ledger.findTask(taskId.trim()).orElseThrow(
                    () -> new IllegalArgumentException("Task with ID '" + taskId.trim() + "' not found."));
        }
        return ledger;
    }

    public AdvanceOutcome advanceNextPair(boolean force) {
        return mutateIfChanged(ledger -> {
            AdvanceSelection selection = stateMachine.selectPairToAdvance(ledger, force);
            Optional<TaskPair> candidate = selection.candidate();
            if (candidate.isEmpty()) {
                log.info("{}", selection.message());
                return new Change<>(false, new AdvanceOutcome(false, null, null, selection.message()));
            }
            TaskPair pair = candidate.get();
            stateMachine.markReady(pair, actor, "Pair status manually changed to READY by " + actor
                    + (force ? " (forced)" : ""));
            audit("pair.advance", "pair/" + pair.getPairId(), "ready", details("forced", String.valueOf(force)));
            String message = "Pair '" + pair.getPairId() + "' (seq " + pair.getSequenceIndex()
                    + ") advanced to READY.";
            log.info(message);
            return new Change<>(true, new AdvanceOutcome(true, pair.getPairId(), pair.getSequenceIndex(), message));
        });
    }

    public ValidationReport validate() {
        Optional<Ledger> ledger = ledgerStore.read();
        if (ledger.isEmpty()) {
            return new ValidationReport(
                    List.of("Ledger " + ledgerStore.location() + " could not be read or is not valid JSON."),
                    List.of());
        }
        return validator.validate(ledger.get());
    }

    public LockInspection lockStatus() {
        return lockManager.inspect(settings.staleTimeout());
    }

    public IntegrityOutcome verifyAudit() {
        if (auditLogger == null) {
            return new IntegrityOutcome(true, 0, -1, "audit disabled");
        }
        return auditLogger.verify();
    }

    private <T> T mutate(Function<Ledger, T> action) {
        return mutateIfChanged(ledger -> new Change<>(true, action.apply(ledger)));
    }

    private synchronized <T> T mutateIfChanged(Function<Ledger, Change<T>> action) {
        pendingAudit.clear();
        return underLock(() -> {
            Ledger ledger = readOrThrow();
            Change<T> change = action.apply(ledger);
            if (change.changed() && !ledgerStore.write(ledger)) {
                pendingAudit.clear();
                throw new IllegalStateException("Failed to write ledger " + ledgerStore.location());
            }
            flushAudit();
            return change.result();
        });
    }

    private synchronized <T> T underLock(LockedAction<T> action) {
        if (!lockManager.acquire(settings.adminMaxWait(), settings.adminRetryInterval(), settings.staleTimeout())) {
            throw new IllegalStateException("Could not acquire lock " + lockManager.lockFile()
                    + " within " + settings.adminMaxWait() + ". Another process may be holding it.");
        }
        try {
            return action.run();
        } finally {
            lockManager.release();
        }
    }

    private Ledger readOrThrow() {
        return ledgerStore.read().orElseThrow(() -> new IllegalStateException(
                "Ledger " + ledgerStore.location() + " could not be read or is not valid JSON."));
    }

    // Rows are queued until the ledger write succeeds, then written while the lock is still held.
    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            pendingAudit.add(AuditLogger.AuditEvent.of(action, actor, resource, result, details));
        }
    }

    private void flushAudit() {
        for (AuditLogger.AuditEvent event : pendingAudit) {
            auditLogger.log(event);
        }
        pendingAudit.clear();
    }

    private static Map<String, Object> details(String key, String value) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (value != null) {
            out.put(key, value);
        }
        return out;
    }

    private static void requireText(String name, String value) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String shortId(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }

    @FunctionalInterface
    private interface LockedAction<T> {
        T run();
    }

    private record Change<T>(boolean changed, T result) {
    }

    public record InitOutcome(String ledgerFile, boolean overwritten) {
    }

    public record TaskOutcome(String taskId, List<String> warnings) {
    }

    public record PairOutcome(String pairId, int sequenceIndex, PairStatus status, List<String> warnings) {
    }

    public record FullPairOutcome(String pairId, String taskId1, String taskId2, int sequenceIndex) {
    }

    public record AdvanceOutcome(boolean advanced, String pairId, Integer sequenceIndex, String message) {
    }
}
