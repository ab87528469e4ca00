package com.missionpilot.orchestrator.model;

public enum EscalationStatus {
    OPEN,
    RESOLVED,
    CANCELLED
}
