package io.pairledger.model;

public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == IN_PROGRESS;
            case IN_PROGRESS -> next.isTerminal();
            case COMPLETED, FAILED -> false;
        };
    }
}
