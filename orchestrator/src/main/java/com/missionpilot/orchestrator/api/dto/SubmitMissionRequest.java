package com.missionpilot.orchestrator.api.dto;

/**
 * Request body for POST /missions.
 *
 * Required: primeDirective, the natural-language objective the mission pursues.
 */
public record SubmitMissionRequest(String primeDirective) {
}
