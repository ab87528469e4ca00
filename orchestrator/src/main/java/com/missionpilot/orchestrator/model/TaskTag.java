package com.missionpilot.orchestrator.model;

/**
 * Planning-complexity classes attached to a Task by the decomposition step.
 *
 * A task carrying any of these is routed straight to Tree-of-Thoughts search
 * before its first action.
 */
public enum TaskTag {
    ARCHITECTURE_SELECTION,
    TECHNOLOGY_CHOICE,
    LARGE_SCALE_REFACTOR
}
