package com.missionpilot.orchestrator.model;

/** Who created a Task: the plan decomposition step or the Tier 1 protocol. */
public enum TaskOrigin {
    PLANNED,
    CORRECTIVE
}
