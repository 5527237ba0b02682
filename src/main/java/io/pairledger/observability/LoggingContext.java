package io.pairledger.observability;

import org.slf4j.MDC;

public final class LoggingContext implements AutoCloseable {
    public static final String AGENT_ID = "agentId";
    public static final String TASK_ID = "taskId";

    private final String previousAgentId;
    private final String previousTaskId;

    private LoggingContext(String agentId) {
        this.previousAgentId = MDC.get(AGENT_ID);
        this.previousTaskId = MDC.get(TASK_ID);
        MDC.put(AGENT_ID, agentId);
        MDC.remove(TASK_ID);
    }

    public static LoggingContext forAgent(String agentId) {
        return new LoggingContext(agentId);
    }

    public LoggingContext task(String taskId) {
        if (taskId == null) {
            MDC.remove(TASK_ID);
        } else {
            MDC.put(TASK_ID, taskId);
        }
        return this;
    }

    @Override
    public void close() {
        restore(AGENT_ID, previousAgentId);
        restore(TASK_ID, previousTaskId);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
