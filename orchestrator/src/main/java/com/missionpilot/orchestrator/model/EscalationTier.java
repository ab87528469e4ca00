package com.missionpilot.orchestrator.model;

/**
 * The self-correction workflow a Task is currently in.
 * A task is in at most one tier at any instant.
 */
public enum EscalationTier {
    NONE,
    REFLEXION,          // Tier 1: transient, classifiable errors
    META_COGNITION      // Tier 2: capability gaps
}
