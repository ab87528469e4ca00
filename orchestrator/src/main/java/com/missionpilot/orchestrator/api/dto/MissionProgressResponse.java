package com.missionpilot.orchestrator.api.dto;

import com.missionpilot.orchestrator.model.EscalationTier;
import com.missionpilot.orchestrator.model.MissionState;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskState;
import com.missionpilot.orchestrator.service.MissionProgress;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for GET /missions/{id}/progress.
 *
 * tier1Rounds counts corrective re-attempts, tier2Rounds research units.
 * busyMillis is time spent inside worker and research units; startedAt is
 * null for tasks that never ran.
 */
public record MissionProgressResponse(
        UUID                 missionId,
        MissionState         state,
        boolean              paused,
        int                  totalTasks,
        Map<TaskState, Long> tasksByState,
        double               completion,
        long                 elapsedMillis,
        List<TaskProgressResponse> tasks
) {
    public record TaskProgressResponse(
            UUID           id,
            int            number,
            TaskState      state,
            EscalationTier escalationTier,
            int            attempts,
            int            tier1Rounds,
            long           tier2Rounds,
            Instant        startedAt,
            long           busyMillis
    ) {}

    public static MissionProgressResponse from(MissionProgress p, Instant now) {
        Instant end = p.mission().getFinishedAt() != null ? p.mission().getFinishedAt() : now;
        return new MissionProgressResponse(
                p.mission().getId(),
                p.mission().getState(),
                p.paused(),
                p.tasks().size(),
                p.countsByState(),
                p.completion(),
                Math.max(0, Duration.between(p.mission().getCreatedAt(), end).toMillis()),
                p.tasks().stream().map(t -> task(t, now)).toList()
        );
    }

    private static TaskProgressResponse task(MissionProgress.TaskProgress p, Instant now) {
        Task t = p.task();
        return new TaskProgressResponse(
                t.getId(),
                t.getNumber(),
                t.getState(),
                t.getEscalationTier(),
                t.getAttempts(),
                t.getRetryCount(),
                p.researchRounds(),
                t.getStartedAt(),
                t.busyTime(now).toMillis()
        );
    }
}
