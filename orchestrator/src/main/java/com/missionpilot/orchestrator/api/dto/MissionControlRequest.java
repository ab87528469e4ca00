package com.missionpilot.orchestrator.api.dto;

import com.missionpilot.orchestrator.service.MissionControlAction;

/** Request body for POST /missions/{id}/control. */
public record MissionControlRequest(MissionControlAction action) {}
