package com.missionpilot.orchestrator.api.dto;

import com.missionpilot.orchestrator.protocol.ResolutionAction;

/**
 * Request body for POST /escalations/{id}/resolve.
 *
 * SUCCEED: observation is fed back to the task as a successful result.
 * CANCEL:  the task is cancelled; observation is kept as the reason.
 */
public record ResolveEscalationRequest(ResolutionAction action, String observation) {
}
