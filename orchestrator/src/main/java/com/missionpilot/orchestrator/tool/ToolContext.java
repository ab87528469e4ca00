package com.missionpilot.orchestrator.tool;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Runtime context passed to every tool invocation.
 *
 * Tools use this to locate the mission's workspace directory and to tag
 * logs with the owning mission and task.
 */
public record ToolContext(Path workspace, UUID missionId, UUID taskId) {}
