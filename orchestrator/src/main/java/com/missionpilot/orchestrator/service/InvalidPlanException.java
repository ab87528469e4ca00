package com.missionpilot.orchestrator.service;

/**
 * A decomposition that must never execute: a cycle, a dangling or duplicate id, or no tasks at all.
 * Fatal to the mission.
 */
public class InvalidPlanException extends RuntimeException {

    public InvalidPlanException(String message) {
        super(message);
    }
}
