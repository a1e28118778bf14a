package io.dagmesh.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.util.Jsons;

import java.time.Instant;

/**
 * Read-only view of one unit of work: a DAG node or a scheduled task. Unknown ids are answered
 * with {@link #unknown(String)} instead of an error.
 */
public record TaskState(
        String taskId,
        String workflowId,
        String status,
        int attempts,
        String lastError,
        JsonNode output,
        Instant startedAt,
        Instant finishedAt
) {
    public static final String UNKNOWN = "unknown";

    public TaskState {
        output = Jsons.copy(output);
    }

    public static TaskState unknown(String taskId) {
        return new TaskState(taskId, null, UNKNOWN, 0, null, null, null, null);
    }

    public boolean known() {
        return !UNKNOWN.equals(status);
    }
}
