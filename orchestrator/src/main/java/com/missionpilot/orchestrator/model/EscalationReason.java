package com.missionpilot.orchestrator.model;

/**
 * Why a Task was handed to the human escalation boundary.
 */
public enum EscalationReason {
    CIRCUIT_BREAKER_TRIPPED,
    RESEARCH_EXHAUSTED,
    KNOWLEDGE_BASE_CONFLICT,
    UNAUTHORIZED,
    REASONING_EXHAUSTED
}
