package io.pairledger.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.pairledger.util.LenientInstantDeserializer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"id", "pair_id", "agent_preference", "description", "status", "assigned_to",
        "created_at", "updated_at", "history"})
public final class Task {
    private String id;
    @JsonProperty("pair_id")
    private String pairId;
    @JsonProperty("agent_preference")
    private String agentPreference;
    private String description;
    private TaskStatus status = TaskStatus.PENDING;
    @JsonProperty("assigned_to")
    private String assignedTo;
    @JsonProperty("created_at")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant createdAt;
    @JsonProperty("updated_at")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant updatedAt;
    private List<HistoryEvent> history = new ArrayList<>();

    public Task() {
    }

    public Task(String id, String pairId, String agentPreference, String description, Instant createdAt) {
        this.id = id;
        this.pairId = pairId;
        this.agentPreference = agentPreference;
        this.description = description;
        this.status = TaskStatus.PENDING;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPairId() {
        return pairId;
    }

    public void setPairId(String pairId) {
        this.pairId = pairId;
    }

    public String getAgentPreference() {
        return agentPreference;
    }

    public void setAgentPreference(String agentPreference) {
        this.agentPreference = agentPreference;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public void setAssignedTo(String assignedTo) {
        this.assignedTo = assignedTo;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public List<HistoryEvent> getHistory() {
        return history;
    }

    public void setHistory(List<HistoryEvent> history) {
        this.history = history == null ? new ArrayList<>() : new ArrayList<>(history);
    }

    @JsonIgnore
    public boolean isUnassigned() {
        return assignedTo == null || assignedTo.isBlank();
    }

    public boolean acceptsAgent(String agentId) {
        return agentPreference == null || agentPreference.isBlank() || agentPreference.equals(agentId);
    }

    public void appendHistory(HistoryEvent event) {
        history.add(event);
        updatedAt = event.timestamp();
    }
}
