package io.pairledger.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

public final class SimulatedWorker implements TaskWorker {
    private static final Logger log = LoggerFactory.getLogger(SimulatedWorker.class);

    private final Duration minDuration;
    private final Duration maxDuration;
    private final double successRatio;
    private final Random random;

    public SimulatedWorker(Duration minDuration, Duration maxDuration, double successRatio) {
        this(minDuration, maxDuration, successRatio, new Random());
    }

    public SimulatedWorker(Duration minDuration, Duration maxDuration, double successRatio, Random random) {
        if (maxDuration.compareTo(minDuration) < 0) {
            throw new IllegalArgumentException("maxDuration must not be shorter than minDuration");
        }
        this.minDuration = minDuration;
        this.maxDuration = maxDuration;
        this.successRatio = successRatio;
        this.random = random;
    }

    @Override
    public String id() {
        return "simulated";
    }

    @Override
    public WorkResult perform(WorkContext context) throws InterruptedException {
        long spanMs = maxDuration.toMillis() - minDuration.toMillis();
        long sleepMs = minDuration.toMillis() + (spanMs <= 0L ? 0L : (long) (random.nextDouble() * spanMs));
        log.info("Starting work on task '{}': '{}'", context.taskId(), context.description());
        Thread.sleep(sleepMs);
        if (random.nextDouble() < successRatio) {
            log.info("Successfully completed task '{}' after {} ms", context.taskId(), sleepMs);
            return WorkResult.completed("simulated work took " + sleepMs + " ms");
        }
        log.warn("Failed to complete task '{}' after {} ms", context.taskId(), sleepMs);
        return WorkResult.failed("simulated failure");
    }
}
