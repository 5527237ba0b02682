package io.pairledger.engine;

import io.pairledger.model.Ledger;
import io.pairledger.model.PairStatus;
import io.pairledger.model.Task;
import io.pairledger.model.TaskPair;
import io.pairledger.model.TaskStatus;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public final class LedgerValidator {

    public ValidationReport validate(Ledger ledger) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Set<String> pairIds = new HashSet<>();
        for (TaskPair pair : ledger.getTaskPairs()) {
            if (pair != null && pair.getPairId() != null && !pair.getPairId().isBlank()) {
                pairIds.add(pair.getPairId());
            }
        }

        Set<String> taskIds = new HashSet<>();
        for (Task task : ledger.getTasks()) {
            if (task == null) {
                errors.add("Invalid task entry found (null)");
                continue;
            }
            String taskId = task.getId();
            if (taskId == null || taskId.isBlank()) {
                errors.add("Task found with missing ID: " + describe(task));
            } else if (!taskIds.add(taskId)) {
                errors.add("Duplicate task ID: " + taskId);
            }
            if (task.getPairId() != null && !task.getPairId().isBlank() && !pairIds.contains(task.getPairId())) {
                errors.add("Task '" + taskId + "' has orphaned pair_id '" + task.getPairId() + "' (pair does not exist).");
            }
            if (task.getStatus() == null) {
                errors.add("Task '" + taskId + "' has no status.");
            } else if (task.getStatus() == TaskStatus.IN_PROGRESS && task.isUnassigned()) {
                warnings.add("Task '" + taskId + "' is IN_PROGRESS but has no assigned_to.");
            } else if (task.getStatus() == TaskStatus.PENDING && !task.isUnassigned()) {
                warnings.add("Task '" + taskId + "' is PENDING but assigned to '" + task.getAssignedTo() + "'.");
            }
        }

        Set<String> seenPairIds = new HashSet<>();
        Map<Integer, List<String>> bySequence = new TreeMap<>();
        int readyCount = 0;
        for (TaskPair pair : ledger.getTaskPairs()) {
            if (pair == null) {
                errors.add("Invalid task_pair entry found (null)");
                continue;
            }
            String pairId = pair.getPairId();
            if (pairId == null || pairId.isBlank()) {
                errors.add("Task pair found with missing pair_id: tasks=" + pair.getTasks());
            } else if (!seenPairIds.add(pairId)) {
                errors.add("Duplicate pair ID: " + pairId);
            }
            if (pair.getSequenceIndex() == null) {
                errors.add("Pair '" + pairId + "' has missing sequence_index.");
            } else {
                bySequence.computeIfAbsent(pair.getSequenceIndex(), ignored -> new ArrayList<>()).add(pairId);
            }
            List<String> refs = pair.getTasks();
            if (refs == null || refs.size() != 2) {
                errors.add("Pair '" + pairId + "' tasks field is not a list of two task IDs (found "
                        + (refs == null ? 0 : refs.size()) + ").");
            } else if (refs.get(0) != null && refs.get(0).equals(refs.get(1))) {
                errors.add("Pair '" + pairId + "' references task '" + refs.get(0) + "' twice.");
            }
            if (refs != null) {
                for (String taskId : refs) {
                    if (!taskIds.contains(taskId)) {
                        errors.add("Pair '" + pairId + "' references non-existent task ID: " + taskId);
                    }
                }
            }
            if (pair.getStatus() == null) {
                errors.add("Pair '" + pairId + "' has no status.");
            } else if (pair.getStatus() == PairStatus.READY && !pair.isPairLock()) {
                readyCount++;
            }
        }

        Integer previous = null;
        for (Map.Entry<Integer, List<String>> entry : bySequence.entrySet()) {
            if (entry.getValue().size() > 1) {
                warnings.add("Duplicate sequence_index: " + entry.getKey() + " used by pairs: "
                        + String.join(", ", entry.getValue()) + ". This may cause non-deterministic ordering.");
            }
            if (previous != null && (long) entry.getKey() - previous > 1L) {
                warnings.add("Sequence gap between " + previous + " and " + entry.getKey() + ".");
            }
            previous = entry.getKey();
        }
        if (readyCount > 1) {
            warnings.add(readyCount + " pairs are READY and unlocked; only the lowest sequence_index is active.");
        }
        return new ValidationReport(errors, warnings);
    }

    private static String describe(Task task) {
        String description = task.getDescription() == null ? "" : task.getDescription();
        return description.length() > 50 ? description.substring(0, 50) : description;
    }

    public record ValidationReport(List<String> errors, List<String> warnings) {
        public ValidationReport {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean ok() {
            return errors.isEmpty();
        }

        public boolean clean() {
            return errors.isEmpty() && warnings.isEmpty();
        }

        public Map<String, Object> summary() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("ok", ok());
            out.put("errors", errors);
            out.put("warnings", warnings);
            if (clean()) {
                out.put("message", "Validation successful: No errors or warnings found.");
            } else if (ok()) {
                out.put("message", "Validation successful: No errors found, but there are warnings.");
            } else {
                out.put("message", "Validation errors found.");
            }
            return out;
        }
    }
}
