package io.pairledger.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.pairledger.util.LenientInstantDeserializer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"pair_id", "tasks", "status", "pair_lock", "sequence_index", "history",
        "created_at", "updated_at"})
public final class TaskPair {
    @JsonProperty("pair_id")
    private String pairId;
    private List<String> tasks = new ArrayList<>();
    private PairStatus status = PairStatus.BLOCKED;
    @JsonProperty("pair_lock")
    private boolean pairLock;
    @JsonProperty("sequence_index")
    private Integer sequenceIndex;
    private List<HistoryEvent> history = new ArrayList<>();
    @JsonProperty("created_at")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant createdAt;
    @JsonProperty("updated_at")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant updatedAt;

    public TaskPair() {
    }

    public TaskPair(String pairId, List<String> tasks, PairStatus status, boolean pairLock,
                    int sequenceIndex, Instant createdAt) {
        this.pairId = pairId;
        this.tasks = new ArrayList<>(tasks);
        this.status = status;
        this.pairLock = pairLock;
        this.sequenceIndex = sequenceIndex;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getPairId() {
        return pairId;
    }

    public void setPairId(String pairId) {
        this.pairId = pairId;
    }

    public List<String> getTasks() {
        return tasks;
    }

    public void setTasks(List<String> tasks) {
        this.tasks = tasks == null ? new ArrayList<>() : new ArrayList<>(tasks);
    }

    public PairStatus getStatus() {
        return status;
    }

    public void setStatus(PairStatus status) {
        this.status = status;
    }

    public boolean isPairLock() {
        return pairLock;
    }

    public void setPairLock(boolean pairLock) {
        this.pairLock = pairLock;
    }

    public Integer getSequenceIndex() {
        return sequenceIndex;
    }

    public void setSequenceIndex(Integer sequenceIndex) {
        this.sequenceIndex = sequenceIndex;
    }

    public List<HistoryEvent> getHistory() {
        return history;
    }

    public void setHistory(List<HistoryEvent> history) {
        this.history = history == null ? new ArrayList<>() : new ArrayList<>(history);
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

    public long sequenceOrder() {
        return sequenceIndex == null ? Long.MAX_VALUE : sequenceIndex.longValue();
    }

    public void appendHistory(HistoryEvent event) {
        history.add(event);
        updatedAt = event.timestamp();
    }
}
