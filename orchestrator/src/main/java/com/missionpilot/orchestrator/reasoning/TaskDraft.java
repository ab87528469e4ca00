package com.missionpilot.orchestrator.reasoning;

import com.missionpilot.orchestrator.model.TaskTag;

import java.util.List;
import java.util.Set;

/**
 * A task as proposed by the planner, before validation.
 * {@code id} is plan-local; {@code dependsOn} refers to other drafts' ids.
 */
public record TaskDraft(int id, String description, List<Integer> dependsOn, Set<TaskTag> tags) {

    public TaskDraft {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        tags      = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
