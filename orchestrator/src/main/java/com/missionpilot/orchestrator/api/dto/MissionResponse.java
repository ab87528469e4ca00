package com.missionpilot.orchestrator.api.dto;

import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.model.MissionState;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /missions and GET /missions/{id}.
 * failureReason is set for FAILED missions (invalid plan, stall).
 */
public record MissionResponse(
        UUID         id,
        MissionState state,
        String       primeDirective,
        String       failureReason,
        Instant      createdAt,
        Instant      finishedAt
) {
    public static MissionResponse from(Mission m) {
        return new MissionResponse(
                m.getId(),
                m.getState(),
                m.getPrimeDirective(),
                m.getFailureReason(),
                m.getCreatedAt(),
                m.getFinishedAt()
        );
    }
}
