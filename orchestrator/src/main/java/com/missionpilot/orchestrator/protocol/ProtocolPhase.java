package com.missionpilot.orchestrator.protocol;

/**
 * States of the two self-correction workflows, used for transition logs and metrics.
 */
public enum ProtocolPhase {

    // Tier 1: Reflexion
    DETECTED(1),
    CATEGORIZED(1),
    HYPOTHESIS_FORMED(1),
    CORRECTIVE_TASK_INJECTED(1),
    RETRYING(1),
    RESOLVED(1),
    CIRCUIT_BREAKER_TRIPPED(1),

    // Tier 2: Meta-Cognition
    GAP_IDENTIFIED(2),
    META_TASK_ESCALATED(2),
    RESEARCHING(2),
    HEURISTIC_SYNTHESIZED(2),
    KNOWLEDGE_BASE_UPDATED(2),
    REQUEUED(2),
    RESEARCH_EXHAUSTED(2),
    KNOWLEDGE_BASE_CONFLICT(2);

    private final int tier;

    ProtocolPhase(int tier) {
        this.tier = tier;
    }

    public int tier() {
        return tier;
    }
}
