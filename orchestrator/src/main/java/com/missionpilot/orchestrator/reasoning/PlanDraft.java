package com.missionpilot.orchestrator.reasoning;

import java.util.List;

/** Unvalidated decomposition of a prime directive. */
public record PlanDraft(List<TaskDraft> tasks) {

    public PlanDraft {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
