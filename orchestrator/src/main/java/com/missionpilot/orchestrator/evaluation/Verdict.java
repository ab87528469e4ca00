package com.missionpilot.orchestrator.evaluation;

public enum Verdict {
    SUCCESS,
    FAILURE
}
