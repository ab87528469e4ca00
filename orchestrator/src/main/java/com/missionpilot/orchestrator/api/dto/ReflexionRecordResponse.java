package com.missionpilot.orchestrator.api.dto;

import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.ReflexionRecord;

import java.time.Instant;

/**
 * One episodic memory entry, returned by GET /missions/{id}/tasks/{taskId}/reflections
 * in the order it was recorded.
 */
public record ReflexionRecordResponse(
        long           id,
        RecordCategory category,
        String         action,
        String         observation,
        double         evaluationScore,
        String         reflectionText,
        Instant        timestamp
) {
    public static ReflexionRecordResponse from(ReflexionRecord r) {
        return new ReflexionRecordResponse(
                r.getId() == null ? 0L : r.getId(),
                r.getCategory(),
                r.getAction(),
                r.getObservation(),
                r.getEvaluationScore(),
                r.getReflectionText(),
                r.getTimestamp()
        );
    }
}
