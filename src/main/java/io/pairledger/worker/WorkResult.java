package io.pairledger.worker;

import io.pairledger.model.TaskStatus;

public record WorkResult(
        TaskStatus status,
        String output,
        String error
) {
    public WorkResult {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("work result must be COMPLETED or FAILED: " + status);
        }
    }

    public static WorkResult completed(String output) {
        return new WorkResult(TaskStatus.COMPLETED, output, null);
    }

    public static WorkResult failed(String error) {
        return new WorkResult(TaskStatus.FAILED, null, error);
    }

    public boolean succeeded() {
        return status == TaskStatus.COMPLETED;
    }
}
