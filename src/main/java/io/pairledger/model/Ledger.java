package io.pairledger.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@JsonPropertyOrder({"task_pairs", "tasks"})
public final class Ledger {
    @JsonProperty("task_pairs")
    private List<TaskPair> taskPairs = new ArrayList<>();
    private List<Task> tasks = new ArrayList<>();

    public static Ledger empty() {
        return new Ledger();
    }

    public List<TaskPair> getTaskPairs() {
        return taskPairs;
    }

    public void setTaskPairs(List<TaskPair> taskPairs) {
        this.taskPairs = taskPairs == null ? new ArrayList<>() : new ArrayList<>(taskPairs);
    }

    public List<Task> getTasks() {
        return tasks;
    }

    public void setTasks(List<Task> tasks) {
        this.tasks = tasks == null ? new ArrayList<>() : new ArrayList<>(tasks);
    }

    public Optional<Task> findTask(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return tasks.stream()
                .filter(Objects::nonNull)
                .filter(task -> taskId.equals(task.getId()))
                .findFirst();
    }

    public Optional<TaskPair> findPair(String pairId) {
        if (pairId == null) {
            return Optional.empty();
        }
        return taskPairs.stream()
                .filter(Objects::nonNull)
                .filter(pair -> pairId.equals(pair.getPairId()))
                .findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return tasks.isEmpty() && taskPairs.isEmpty();
    }
}
