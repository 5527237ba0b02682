package io.pairledger.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public final class PairLedgerConfig {
    public static final String DEFAULT_TASK_FILE = "tasks.json";
    public static final String DEFAULT_LOCK_FILE = "tasks.lock";
    public static final String SETTINGS_FILE = "pairledger-settings.json";
    public static final Duration DEFAULT_STALE_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_AGENT_MAX_WAIT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_AGENT_RETRY_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_ADMIN_MAX_WAIT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_ADMIN_RETRY_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CYCLE_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_WORK_MIN = Duration.ofSeconds(1);
    public static final Duration DEFAULT_WORK_MAX = Duration.ofSeconds(3);
    public static final double DEFAULT_WORK_SUCCESS_RATIO = 0.9d;

    private final Path rootDir;
    private final Path ledgerFile;
    private final Path lockFile;

    public PairLedgerConfig(Path rootDir, Path ledgerFile, Path lockFile) {
        this.rootDir = rootDir;
        this.ledgerFile = ledgerFile;
        this.lockFile = lockFile;
    }

    public static PairLedgerConfig fromRoot(String root) {
        return fromRoot(root, null, null);
    }

    public static PairLedgerConfig fromRoot(String root, String taskFile, String lockFile) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(".")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new PairLedgerConfig(
                base,
                resolveFile(base, taskFile, DEFAULT_TASK_FILE),
                resolveFile(base, lockFile, DEFAULT_LOCK_FILE)
        );
    }

    private static Path resolveFile(Path base, String override, String fallback) {
        if (override == null || override.isBlank()) {
            return base.resolve(fallback);
        }
        return base.resolve(override.trim()).normalize();
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path ledgerFile() {
        return ledgerFile;
    }

    public Path lockFile() {
        return lockFile;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
