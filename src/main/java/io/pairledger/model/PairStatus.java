package io.pairledger.model;

public enum PairStatus {
    BLOCKED,
    READY,
    COMPLETED;

    public boolean canTransitionTo(PairStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case BLOCKED -> next == READY;
            case READY -> next == COMPLETED;
            case COMPLETED -> false;
        };
    }

    public static PairStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Pair status cannot be empty");
        }
        for (PairStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown pair status: " + raw);
    }
}
