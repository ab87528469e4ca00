package com.missionpilot.orchestrator.goal;

import com.missionpilot.orchestrator.model.ChecklistItem;
import com.missionpilot.orchestrator.model.GoalState;
import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.repository.GoalStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Keeps each mission's prime directive and checklist, and recites them at
 * the top of every reasoning context so long missions never lose their goal.
 *
 * Checklist items track planned tasks only; corrective tasks are bookkeeping.
 * Workers read recitations while the owning scheduler marks items done, so
 * both go through the goal state's monitor.
 */
@Component
public class GoalStateManager {

    private static final Logger log = LoggerFactory.getLogger(GoalStateManager.class);

    private final GoalStateRepository       repository;
    private final Map<UUID, GoalState>      goals = new ConcurrentHashMap<>();

    public GoalStateManager(GoalStateRepository repository) {
        this.repository = repository;
    }

    public GoalState initialize(Mission mission, Collection<Task> plannedTasks) {
        GoalState goal = new GoalState(mission.getId(), mission.getPrimeDirective(),
                plannedTasks.stream()
                        .filter(t -> t.getOrigin() == TaskOrigin.PLANNED)
                        .sorted(Comparator.comparingInt(Task::getNumber))
                        .map(t -> new ChecklistItem(t.getNumber(), t.getDescription()))
                        .toList());
        repository.save(goal);
        goals.put(mission.getId(), goal);
        return goal;
    }

    /** The goal state, loading it after a restart. */
    public GoalState recite(UUID missionId) {
        return goals.computeIfAbsent(missionId, id -> repository.findById(id)
                .orElseThrow(() -> new IllegalStateException("No goal state for mission " + id)));
    }

    /** Rendered prime directive and checklist. */
    public String recitation(UUID missionId) {
        GoalState goal = recite(missionId);
        synchronized (goal) {
            return goal.recitation();
        }
    }

    /**
     * Read a consistent view of a mission's goal, from the cache or the store.
     * Missions that failed during planning have no goal.
     */
    public <T> Optional<T> read(UUID missionId, Function<GoalState, T> view) {
        GoalState goal = goals.get(missionId);
        if (goal == null) {
            return repository.findById(missionId).map(view);
        }
        synchronized (goal) {
            return Optional.of(view.apply(goal));
        }
    }

    /** Close the checklist item of a verified-successful task. */
    public void markDone(UUID missionId, int taskNumber) {
        GoalState goal = recite(missionId);
        synchronized (goal) {
            if (goal.markDone(taskNumber)) {
                repository.save(goal);
                log.info("Goal checklist item {} done ({} open)", taskNumber, goal.openItems());
            }
        }
    }

    /** Drop the cached goal of a finished mission. */
    public void evict(UUID missionId) {
        goals.remove(missionId);
    }
}
