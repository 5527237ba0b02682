package io.pairledger.config;

import io.pairledger.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public record LedgerSettings(
        Duration staleTimeout,
        Duration agentMaxWait,
        Duration agentRetryInterval,
        Duration adminMaxWait,
        Duration adminRetryInterval,
        Duration cycleInterval,
        Duration workMin,
        Duration workMax,
        double workSuccessRatio
) {
    public LedgerSettings {
        requirePositive("staleTimeout", staleTimeout);
        requirePositive("agentMaxWait", agentMaxWait);
        requirePositive("agentRetryInterval", agentRetryInterval);
        requirePositive("adminMaxWait", adminMaxWait);
        requirePositive("adminRetryInterval", adminRetryInterval);
        requireNonNegative("cycleInterval", cycleInterval);
        requireNonNegative("workMin", workMin);
        requireNonNegative("workMax", workMax);
        if (workMax.compareTo(workMin) < 0) {
            throw new IllegalArgumentException("workMax must not be shorter than workMin");
        }
        if (workSuccessRatio < 0d || workSuccessRatio > 1d) {
            throw new IllegalArgumentException("workSuccessRatio must be within [0, 1]: " + workSuccessRatio);
        }
    }

    public static LedgerSettings defaults() {
        return new LedgerSettings(
                PairLedgerConfig.DEFAULT_STALE_TIMEOUT,
                PairLedgerConfig.DEFAULT_AGENT_MAX_WAIT,
                PairLedgerConfig.DEFAULT_AGENT_RETRY_INTERVAL,
                PairLedgerConfig.DEFAULT_ADMIN_MAX_WAIT,
                PairLedgerConfig.DEFAULT_ADMIN_RETRY_INTERVAL,
                PairLedgerConfig.DEFAULT_CYCLE_INTERVAL,
                PairLedgerConfig.DEFAULT_WORK_MIN,
                PairLedgerConfig.DEFAULT_WORK_MAX,
                PairLedgerConfig.DEFAULT_WORK_SUCCESS_RATIO
        );
    }

    public static LedgerSettings load(Path settingsFile) {
        LedgerSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    static LedgerSettings fromFile(SettingsFile file, LedgerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new LedgerSettings(
                millisOr(file.staleTimeoutMs(), defaults.staleTimeout()),
                millisOr(file.agentMaxWaitMs(), defaults.agentMaxWait()),
                millisOr(file.agentRetryIntervalMs(), defaults.agentRetryInterval()),
                millisOr(file.adminMaxWaitMs(), defaults.adminMaxWait()),
                millisOr(file.adminRetryIntervalMs(), defaults.adminRetryInterval()),
                millisOr(file.cycleIntervalMs(), defaults.cycleInterval()),
                millisOr(file.workMinMs(), defaults.workMin()),
                millisOr(file.workMaxMs(), defaults.workMax()),
                file.workSuccessRatio() == null ? defaults.workSuccessRatio() : file.workSuccessRatio()
        );
    }

    public LedgerSettings withStaleTimeout(Duration value) {
        return value == null ? this : new LedgerSettings(value, agentMaxWait, agentRetryInterval,
                adminMaxWait, adminRetryInterval, cycleInterval, workMin, workMax, workSuccessRatio);
    }

    public LedgerSettings withAgentLockWait(Duration maxWait, Duration retryInterval) {
        return new LedgerSettings(staleTimeout,
                maxWait == null ? agentMaxWait : maxWait,
                retryInterval == null ? agentRetryInterval : retryInterval,
                adminMaxWait, adminRetryInterval, cycleInterval, workMin, workMax, workSuccessRatio);
    }

    public LedgerSettings withCycleInterval(Duration value) {
        return value == null ? this : new LedgerSettings(staleTimeout, agentMaxWait, agentRetryInterval,
                adminMaxWait, adminRetryInterval, value, workMin, workMax, workSuccessRatio);
    }

    private static Duration millisOr(Long millis, Duration fallback) {
        return millis == null ? fallback : Duration.ofMillis(millis);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }

    record SettingsFile(
            Long staleTimeoutMs,
            Long agentMaxWaitMs,
            Long agentRetryIntervalMs,
            Long adminMaxWaitMs,
            Long adminRetryIntervalMs,
            Long cycleIntervalMs,
            Long workMinMs,
            Long workMaxMs,
            Double workSuccessRatio
    ) {
    }
}
