package io.pairledger.cli;

import io.pairledger.config.LedgerSettings;
import io.pairledger.config.PairLedgerConfig;
import io.pairledger.engine.LedgerValidator.ValidationReport;
import io.pairledger.model.PairStatus;
import io.pairledger.observability.AuditLogger.IntegrityOutcome;
import io.pairledger.runtime.AgentRunner;
import io.pairledger.runtime.LedgerAdmin;
import io.pairledger.storage.JsonFileLedgerStore;
import io.pairledger.util.Jsons;
import io.pairledger.worker.ScriptWorker;
import io.pairledger.worker.SimulatedWorker;
import io.pairledger.worker.TaskWorker;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "pairledger",
        mixinStandardHelpOptions = true,
        description = "Paired sequential task pipeline over a shared JSON ledger",
        subcommands = {
                PairLedgerCommand.InitCommand.class,
                PairLedgerCommand.AddTaskCommand.class,
                PairLedgerCommand.AddPairCommand.class,
                PairLedgerCommand.CreateFullPairCommand.class,
                PairLedgerCommand.StatusCommand.class,
                PairLedgerCommand.AdvanceNextPairCommand.class,
                PairLedgerCommand.ValidateCommand.class,
                PairLedgerCommand.AgentCommand.class,
                PairLedgerCommand.LockStatusCommand.class,
                PairLedgerCommand.AuditVerifyCommand.class
        }
)
public final class PairLedgerCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Data root directory holding ledger, lock and audit files", defaultValue = ".")
    String root;

    @Option(names = {"--task-file"}, description = "Ledger file path (default: <root>/tasks.json)")
    String taskFile;

    @Option(names = {"--lock-file"}, description = "Lock file path (default: <root>/tasks.lock)")
    String lockFile;

    @Option(names = {"--stale-timeout"}, description = "Seconds after which a lock is considered abandoned")
    Long staleTimeoutSeconds;

    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new PairLedgerCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException || ex instanceof IllegalStateException) {
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("error", ex.getMessage());
                commandLine.getOut().println(Jsons.toCompactJson(error));
                commandLine.getOut().flush();
                return 1;
            }
            throw ex;
        });
        return cmd;
    }

    @Override
    public void run() {
        out().println("Use subcommands: init | add-task | add-pair | create-full-pair | status | advance-next-pair | validate | agent | lock-status | audit-verify");
        out().flush();
    }

    PairLedgerConfig config() {
        return PairLedgerConfig.fromRoot(root, taskFile, lockFile);
    }

    LedgerSettings settings() {
        LedgerSettings settings = LedgerSettings.load(config().settingsFile());
        if (staleTimeoutSeconds != null) {
            if (staleTimeoutSeconds <= 0) {
                throw new IllegalArgumentException("--stale-timeout must be positive");
            }
            settings = settings.withStaleTimeout(Duration.ofSeconds(staleTimeoutSeconds));
        }
        return settings;
    }

    LedgerAdmin admin() {
        return LedgerAdmin.create(config(), settings());
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    void print(Object value) {
        PrintWriter out = out();
        out.println(Jsons.toJson(value));
        out.flush();
    }

    @Command(name = "init", description = "Write an empty ledger")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Option(names = {"--force"}, defaultValue = "false", description = "Overwrite an existing ledger")
        boolean force;

        @Override
        public Integer call() {
            parent.print(parent.admin().init(force));
            return 0;
        }
    }

    @Command(name = "add-task", description = "Add a PENDING task")
    static final class AddTaskCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Option(names = {"--desc"}, required = true, description = "Task description")
        String description;

        @Option(names = {"--agent-pref"}, description = "Agent id the task should be reserved for")
        String agentPreference;

        @Option(names = {"--pair-id"}, description = "Pair the task belongs to")
        String pairId;

        @Option(names = {"--task-id"}, description = "Task id (default: random UUID)")
        String taskId;

        @Override
        public Integer call() {
            parent.print(parent.admin().addTask(description, agentPreference, pairId, taskId));
            return 0;
        }
    }

    @Command(name = "add-pair", description = "Link two existing tasks into a pair")
    static final class AddPairCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Option(names = {"--task-id1"}, required = true, description = "First task id")
        String taskId1;

        @Option(names = {"--task-id2"}, required = true, description = "Second task id")
        String taskId2;

        @Option(names = {"--seq-idx"}, required = true, description = "Sequence index of the pair")
        int sequenceIndex;

        @Option(names = {"--pair-id"}, description = "Pair id (default: pair_<8 hex>)")
        String pairId;

        @Option(names = {"--status"}, description = "Initial status: BLOCKED|READY|COMPLETED (default BLOCKED)")
        String status;

        @Option(names = {"--lock"}, arity = "1", description = "Initial pair_lock (default: false for READY, true otherwise)")
        Boolean lock;

        @Override
        public Integer call() {
            PairStatus initial = status == null ? null : PairStatus.fromString(status);
            parent.print(parent.admin().addPair(taskId1, taskId2, sequenceIndex, pairId, initial, lock));
            return 0;
        }
    }

    @Command(name = "create-full-pair", description = "Create two tasks and the pair linking them")
    static final class CreateFullPairCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Option(names = {"--desc1"}, required = true, description = "Description of the first task")
        String description1;

        @Option(names = {"--desc2"}, required = true, description = "Description of the second task")
        String description2;

        @Option(names = {"--seq-idx"}, required = true, description = "Sequence index of the pair")
        int sequenceIndex;

        @Option(names = {"--agent1"}, description = "Agent preference of the first task")
        String agent1;

        @Option(names = {"--agent2"}, description = "Agent preference of the second task")
        String agent2;

        @Option(names = {"--pair-id"}, description = "Id prefix (default: fp_<4 hex>)")
        String prefix;

        @Override
        public Integer call() {
            parent.print(parent.admin().createFullPair(description1, agent1, description2, agent2, sequenceIndex, prefix));
            return 0;
        }
    }

    @Command(name = "status", description = "Show the ledger, one pair, or one task")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Option(names = {"--pair-id"}, description = "Show one pair and its tasks")
        String pairId;

        @Option(names = {"--task-id"}, description = "Show one task")
        String taskId;

        @Override
        public Integer call() {
            parent.print(parent.admin().status(pairId, taskId));
            return 0;
        }
    }

    @Command(name = "advance-next-pair", description = "Manually mark the next BLOCKED pair READY")
    static final class AdvanceNextPairCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Option(names = {"--force"}, defaultValue = "false",
                description = "Advance the lowest BLOCKED pair even without a COMPLETED predecessor")
        boolean force;

        @Override
        public Integer call() {
            LedgerAdmin.AdvanceOutcome outcome = parent.admin().advanceNextPair(force);
            parent.print(outcome);
            return outcome.advanced() ? 0 : 1;
        }
    }

    @Command(name = "validate", description = "Check ledger integrity")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Override
        public Integer call() {
            ValidationReport report = parent.admin().validate();
            parent.print(report.summary());
            return report.ok() ? 0 : 1;
        }
    }

    @Command(name = "agent", description = "Run an agent loop against the ledger")
    static final class AgentCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Parameters(index = "0", description = "Agent id")
        String agentId;

        @Option(names = {"--cycles"}, description = "Number of cycles to run (default: run until stopped)")
        Integer cycles;

        @Option(names = {"--interval"}, description = "Seconds between cycles")
        Double intervalSeconds;

        @Option(names = {"--max-wait"}, description = "Seconds to wait for the lock per attempt")
        Double maxWaitSeconds;

        @Option(names = {"--retry-interval"}, description = "Seconds between lock attempts")
        Double retryIntervalSeconds;

        @Option(names = {"--worker"}, defaultValue = "simulated", description = "Work executor: simulated|script")
        String worker;

        @Option(names = {"--script"}, arity = "1..*",
                description = "Command and arguments run per task by the script worker")
        List<String> script;

        @Option(names = {"--script-timeout"}, defaultValue = "300", description = "Script timeout in seconds")
        long scriptTimeoutSeconds;

        @Override
        public Integer call() {
            if (cycles != null && cycles < 0) {
                throw new IllegalArgumentException("--cycles must not be negative");
            }
            PairLedgerConfig config = parent.config();
            JsonFileLedgerStore store = new JsonFileLedgerStore(config.ledgerFile());
            if (!store.exists()) {
                throw new IllegalStateException("Ledger " + config.ledgerFile()
                        + " not found. Run 'init' first.");
            }
            if (store.read().isEmpty()) {
                throw new IllegalStateException("Ledger " + config.ledgerFile()
                        + " is corrupt or not a valid ledger. Fix it before starting an agent.");
            }
            LedgerSettings settings = parent.settings()
                    .withAgentLockWait(seconds(maxWaitSeconds), seconds(retryIntervalSeconds))
                    .withCycleInterval(seconds(intervalSeconds));
            AgentRunner runner = AgentRunner.create(config, settings, agentId, worker(settings));
            AgentRunner.RunSummary summary = runner.run(cycles, settings.cycleInterval());
            parent.print(summary);
            return 0;
        }

        private TaskWorker worker(LedgerSettings settings) {
            return switch (worker == null ? "" : worker.trim().toLowerCase()) {
                case "simulated" -> new SimulatedWorker(settings.workMin(), settings.workMax(), settings.workSuccessRatio());
                case "script" -> {
                    if (script == null || script.isEmpty() || script.get(0).isBlank()) {
                        throw new IllegalArgumentException("--script is required with --worker script");
                    }
                    yield new ScriptWorker(script, Duration.ofSeconds(scriptTimeoutSeconds).toMillis());
                }
                default -> throw new IllegalArgumentException("Unknown worker '" + worker + "'. Use simulated or script.");
            };
        }

        private static Duration seconds(Double value) {
            if (value == null) {
                return null;
            }
            if (value < 0) {
                throw new IllegalArgumentException("durations must not be negative: " + value);
            }
            return Duration.ofMillis(Math.round(value * 1000d));
        }
    }

    @Command(name = "lock-status", description = "Show the current lock holder and whether it is stale")
    static final class LockStatusCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Override
        public Integer call() {
            parent.print(parent.admin().lockStatus());
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        PairLedgerCommand parent;

        @Override
        public Integer call() {
            IntegrityOutcome out = parent.admin().verifyAudit();
            parent.print(out);
            return out.ok() ? 0 : 1;
        }
    }
}
