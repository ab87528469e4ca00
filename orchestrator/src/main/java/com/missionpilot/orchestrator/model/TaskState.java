package com.missionpilot.orchestrator.model;

/**
 * Execution state of a single Task in a Plan.
 *
 * Transitions:
 *   PENDING  → RUNNING                   (claimed by a worker)
 *   RUNNING  → SUCCEEDED                 (verified completion)
 *   RUNNING  → FAILED                    (Tier 1 corrective task injected)
 *   RUNNING  → BLOCKED_PENDING_RESEARCH  (Tier 2 capability gap research)
 *   RUNNING  → BLOCKED                   (escalated to a human operator)
 *   FAILED   → PENDING                   (corrective prerequisite succeeded)
 *   BLOCKED_PENDING_RESEARCH → PENDING   (knowledge base update committed)
 *   any non-terminal → CANCELLED
 *   BLOCKED  → SUCCEEDED | CANCELLED     (operator resolution)
 */
public enum TaskState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    BLOCKED_PENDING_RESEARCH,
    BLOCKED,
    CANCELLED;

    /** SUCCEEDED and CANCELLED never change again; BLOCKED only through an operator. */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == CANCELLED || this == BLOCKED;
    }
}
