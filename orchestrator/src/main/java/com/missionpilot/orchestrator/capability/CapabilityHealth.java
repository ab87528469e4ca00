package com.missionpilot.orchestrator.capability;

/** Coarse status of a registered tool, derived from its confidence. */
public enum CapabilityHealth {

    /** At or above the verify threshold. */
    HEALTHY,
    /** Usable, but re-verified before high-stakes calls. */
    DEGRADED,
    /** Below the minimum confidence: calls report a capability gap. */
    UNAVAILABLE;

    static CapabilityHealth of(double confidence, double minConfidence, double verifyThreshold) {
        if (confidence < minConfidence) return UNAVAILABLE;
        return confidence < verifyThreshold ? DEGRADED : HEALTHY;
    }
}
