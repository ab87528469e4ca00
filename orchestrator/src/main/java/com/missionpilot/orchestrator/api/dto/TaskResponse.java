package com.missionpilot.orchestrator.api.dto;

import com.missionpilot.orchestrator.model.EscalationTier;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.model.TaskState;
import com.missionpilot.orchestrator.model.TaskTag;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only view of one plan task returned by GET /missions/{id}/tasks.
 *
 * number is the plan-local id that dependsOn refers to.
 */
public record TaskResponse(
        UUID           id,
        int            number,
        String         description,
        List<Integer>  dependsOn,
        Set<TaskTag>   tags,
        TaskState      state,
        TaskOrigin     origin,
        EscalationTier escalationTier,
        int            retryCount,
        int            attempts,
        String         result,
        Instant        updatedAt
) {
    public static TaskResponse from(Task t) {
        return new TaskResponse(
                t.getId(),
                t.getNumber(),
                t.getDescription(),
                t.getDependencies().stream().sorted().toList(),
                t.getTags(),
                t.getState(),
                t.getOrigin(),
                t.getEscalationTier(),
                t.getRetryCount(),
                t.getAttempts(),
                t.getResult(),
                t.getUpdatedAt()
        );
    }
}
