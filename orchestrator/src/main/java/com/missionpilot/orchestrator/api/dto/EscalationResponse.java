package com.missionpilot.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.missionpilot.orchestrator.model.EscalationReason;
import com.missionpilot.orchestrator.model.EscalationStatus;
import com.missionpilot.orchestrator.model.HumanEscalation;

import java.time.Instant;
import java.util.UUID;

/**
 * The operator-facing escalation payload.
 *
 * history is the blocked task's reflexion history, already serialized as a
 * JSON array when the escalation was raised.
 */
public record EscalationResponse(
        UUID             id,
        UUID             missionId,
        UUID             taskId,
        int              taskNumber,
        EscalationReason reason,
        String           detail,
        @JsonRawValue String history,
        EscalationStatus status,
        String           resolution,
        Instant          createdAt,
        Instant          resolvedAt
) {
    public static EscalationResponse from(HumanEscalation e) {
        return new EscalationResponse(
                e.getId(),
                e.getMissionId(),
                e.getTaskId(),
                e.getTaskNumber(),
                e.getReason(),
                e.getDetail(),
                e.getHistoryJson(),
                e.getStatus(),
                e.getResolution(),
                e.getCreatedAt(),
                e.getResolvedAt()
        );
    }
}
