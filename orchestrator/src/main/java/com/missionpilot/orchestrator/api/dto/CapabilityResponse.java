package com.missionpilot.orchestrator.api.dto;

import com.missionpilot.orchestrator.capability.CapabilityHealth;
import com.missionpilot.orchestrator.capability.CapabilityManifestEntry;

import java.time.Instant;

/** One Capability Manifest entry with its health, as listed by GET /capabilities. */
public record CapabilityResponse(
        String  toolName,
        String  description,
        String  invocationSchema,
        double  confidenceScore,
        Instant verifiedAt,
        CapabilityHealth health
) {
    public static CapabilityResponse from(CapabilityManifestEntry e, CapabilityHealth health) {
        return new CapabilityResponse(
                e.toolName(),
                e.description(),
                e.invocationSchema(),
                e.confidenceScore(),
                e.verifiedAt(),
                health
        );
    }
}
