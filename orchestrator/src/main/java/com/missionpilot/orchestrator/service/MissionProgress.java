package com.missionpilot.orchestrator.service;

import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskState;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a mission's execution.
 *
 * @param paused    false for missions that are not running
 * @param tasks     every task of the plan, lowest number first
 */
public record MissionProgress(Mission mission, boolean paused, List<TaskProgress> tasks) {

    public MissionProgress {
        tasks = List.copyOf(tasks);
    }

    /**
     * One task with its escalation counters.
     *
     * @param researchRounds Tier 2 research units run for the task
     */
    public record TaskProgress(Task task, long researchRounds) {}

    public Map<TaskState, Long> countsByState() {
        Map<TaskState, Long> counts = new EnumMap<>(TaskState.class);
        for (TaskProgress p : tasks) {
            counts.merge(p.task().getState(), 1L, Long::sum);
        }
        return counts;
    }

    /** Share of tasks in a final state, in [0, 1]; 0 for an empty plan. */
    public double completion() {
        if (tasks.isEmpty()) return 0.0;
        long done = tasks.stream()
                .map(p -> p.task().getState())
                .filter(s -> s == TaskState.SUCCEEDED || s == TaskState.CANCELLED)
                .count();
        return (double) done / tasks.size();
    }
}
