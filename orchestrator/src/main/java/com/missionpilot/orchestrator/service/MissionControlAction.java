package com.missionpilot.orchestrator.service;

/** Operator control of a running mission, as accepted by POST /missions/{id}/control. */
public enum MissionControlAction {
    /** Stop dispatching new units; in-flight units finish normally. */
    PAUSE,
    RESUME,
    CANCEL
}
