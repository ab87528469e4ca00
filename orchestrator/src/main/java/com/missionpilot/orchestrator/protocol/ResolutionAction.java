package com.missionpilot.orchestrator.protocol;

/** How an operator resolves a human escalation. */
public enum ResolutionAction {
    SUCCEED,    // deliver a synthetic successful observation; the task succeeds
    CANCEL      // cancel the task
}
