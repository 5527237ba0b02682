package io.pairledger.worker;

public record WorkContext(
        String agentId,
        String taskId,
        String pairId,
        String description
) {
}
