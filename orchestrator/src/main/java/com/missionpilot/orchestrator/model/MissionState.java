package com.missionpilot.orchestrator.model;

/**
 * Lifecycle of a Mission.
 *
 * Transitions:
 *   PLANNING → RUNNING   (plan decomposed and accepted)
 *   PLANNING → FAILED    (invalid plan: cycle, dangling dependency)
 *   RUNNING  → SUCCEEDED (every planned task succeeded)
 *   RUNNING  → FAILED    (no runnable task, nothing in flight, not done)
 *   RUNNING  → CANCELLED (operator cancellation)
 */
public enum MissionState {
    PLANNING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
