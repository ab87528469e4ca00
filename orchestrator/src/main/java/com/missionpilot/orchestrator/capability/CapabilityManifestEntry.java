package com.missionpilot.orchestrator.capability;

import java.time.Instant;

/**
 * The agent's belief about one tool: what it does, how to call it,
 * and how much it trusts it.
 *
 * @param confidenceScore in [0, 1]; decays on failed outcomes, grows on successful ones
 * @param verifiedAt      last successful read-only self-check, null if never checked
 */
public record CapabilityManifestEntry(
        String  toolName,
        String  description,
        String  invocationSchema,
        double  confidenceScore,
        Instant verifiedAt) {

    public CapabilityManifestEntry withConfidence(double score) {
        return new CapabilityManifestEntry(toolName, description, invocationSchema,
                Math.max(0.0, Math.min(1.0, score)), verifiedAt);
    }

    public CapabilityManifestEntry withVerifiedAt(Instant at) {
        return new CapabilityManifestEntry(toolName, description, invocationSchema,
                confidenceScore, at);
    }

    /** One line for the reasoning context. */
    public String describe() {
        return "%s  (confidence %.2f)\n      %s".formatted(invocationSchema, confidenceScore, description);
    }
}
