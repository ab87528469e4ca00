package com.missionpilot.orchestrator.service;

import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.model.TaskState;
import com.missionpilot.orchestrator.reasoning.PlanDraft;
import com.missionpilot.orchestrator.reasoning.ReasoningModel;
import com.missionpilot.orchestrator.reasoning.TaskDraft;
import com.missionpilot.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds and mutates mission plans.
 *
 * A plan is a DAG of tasks keyed by their plan-local number. The reasoning
 * model proposes it once per mission; {@link #decompose} rejects anything that
 * is not a DAG before a single row is written.
 *
 * After that the plan only grows. Tier 1 inserts corrective tasks in front of
 * the task that failed:
 * <pre>
 *   before:  #1 set up ──► #2 run app.py            (#2 FAILED: No module named 'flask')
 *   after:   #1 set up ──► #2 run app.py ◄── #3 install flask
 * </pre>
 * #2 waits in FAILED until #3 succeeds, then {@link #reactivateDependents}
 * puts it back to PENDING. Tasks are never removed.
 *
 * All mutating methods must be called from the plan's owning thread. Every
 * mutation is written through to the tasks table, so {@link #restore} can
 * rebuild the plan after a restart.
 */
@Component
public class PlanManager {

    private static final Logger log = LoggerFactory.getLogger(PlanManager.class);

    private final ReasoningModel model;
    private final TaskRepository taskRepo;

    public PlanManager(ReasoningModel model, TaskRepository taskRepo) {
        this.model    = model;
        this.taskRepo = taskRepo;
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    /**
     * Ask the reasoning model for a decomposition and validate it.
     *
     * @throws InvalidPlanException on an empty plan, duplicate or non-positive ids,
     *         dangling or self dependencies, or a cycle; nothing is persisted then
     */
    public Plan decompose(Mission mission) {
        PlanDraft draft = model.decompose(mission.getPrimeDirective());
        validate(draft);

        Plan plan = new Plan(mission.getId());
        for (TaskDraft d : draft.tasks()) {
            plan.put(new Task(mission.getId(), d.id(), d.description(),
                    new HashSet<>(d.dependsOn()), d.tags(), TaskOrigin.PLANNED));
        }
        taskRepo.saveAll(plan.tasks());
        log.info("Mission {} decomposed into {} tasks", mission.getId(), plan.size());
        return plan;
    }

    static void validate(PlanDraft draft) {
        if (draft.tasks().isEmpty()) {
            throw new InvalidPlanException("Plan has no tasks");
        }
        Map<Integer, List<Integer>> edges = new HashMap<>();
        for (TaskDraft d : draft.tasks()) {
            if (d.id() <= 0) {
                throw new InvalidPlanException("Task id must be positive: " + d.id());
            }
            if (edges.put(d.id(), d.dependsOn()) != null) {
                throw new InvalidPlanException("Duplicate task id " + d.id());
            }
        }
        for (TaskDraft d : draft.tasks()) {
            for (int dep : d.dependsOn()) {
                if (dep == d.id()) {
                    throw new InvalidPlanException("Task " + d.id() + " depends on itself");
                }
                if (!edges.containsKey(dep)) {
                    throw new InvalidPlanException("Task " + d.id() + " depends on unknown task " + dep);
                }
            }
        }
        findCycle(edges).ifPresent(cycle -> {
            throw new InvalidPlanException("Dependency cycle: " + cycle);
        });
    }

    /**
     * Rebuild the plan of a mission after a restart. Tasks that were in flight
     * when the process stopped go back to PENDING.
     */
    public Plan restore(Mission mission) {
        Plan plan = new Plan(mission.getId());
        for (Task t : taskRepo.findByMissionIdOrderByNumberAsc(mission.getId())) {
            if (t.getState() == TaskState.RUNNING || t.getState() == TaskState.BLOCKED_PENDING_RESEARCH) {
                log.info("Resetting interrupted {} of mission {} to PENDING", t, mission.getId());
                t.setState(TaskState.PENDING);
                taskRepo.save(t);
            }
            plan.put(t);
        }
        return plan;
    }

    // ------------------------------------------------------------------
    // Scheduling queries
    // ------------------------------------------------------------------

    /** Lowest-numbered PENDING task whose dependencies have all succeeded. */
    public Optional<Task> nextRunnable(Plan plan) {
        return plan.tasks().stream().filter(t -> isRunnable(plan, t)).findFirst();
    }

    /** Every runnable task, lowest number first. */
    public List<Task> runnable(Plan plan) {
        return plan.tasks().stream().filter(t -> isRunnable(plan, t)).toList();
    }

    private static boolean isRunnable(Plan plan, Task t) {
        return t.getState() == TaskState.PENDING && dependenciesSucceeded(plan, t);
    }

    private static boolean dependenciesSucceeded(Plan plan, Task t) {
        return t.getDependencies().stream().allMatch(n ->
                plan.task(n).map(dep -> dep.getState() == TaskState.SUCCEEDED).orElse(false));
    }

    // ------------------------------------------------------------------
    // Mutation
    // ------------------------------------------------------------------

    public void markRunning(Plan plan, Task task) {
        task.setState(TaskState.RUNNING);
        task.incrementAttempts();
        taskRepo.save(task);
    }

    /** Record a task's outcome. */
    public void recordOutcome(Plan plan, Task task, TaskState state, String result) {
        task.setState(state);
        if (result != null) task.setResult(result);
        taskRepo.save(task);
        log.info("{} -> {}", task, state);
    }

    /**
     * Insert a new task as a prerequisite of {@code before}.
     *
     * @throws InvalidPlanException if the edge would close a cycle; the plan is left unchanged
     */
    public Task injectTask(Plan plan, String description, TaskOrigin origin, Task before) {
        Task injected = new Task(plan.missionId(), plan.nextNumber(), description,
                Set.of(), Set.of(), origin);
        plan.put(injected);

        Map<Integer, List<Integer>> edges = edges(plan);
        edges.computeIfPresent(before.getNumber(), (n, deps) -> {
            List<Integer> withNew = new ArrayList<>(deps);
            withNew.add(injected.getNumber());
            return withNew;
        });
        Optional<List<Integer>> cycle = findCycle(edges);
        if (cycle.isPresent()) {
            plan.remove(injected.getNumber());
            throw new InvalidPlanException("Injecting before " + before + " would create cycle " + cycle.get());
        }

        before.addDependency(injected.getNumber());
        taskRepo.save(injected);
        taskRepo.save(before);
        log.info("Injected {} '{}' as prerequisite of {}", injected, description, before);
        return injected;
    }

    /** Tier 2 finished: the task goes back in the queue. */
    public void requeue(Plan plan, Task task) {
        recordOutcome(plan, task, TaskState.PENDING, null);
    }

    /**
     * FAILED tasks waiting on {@code succeeded} go back to PENDING once all of
     * their dependencies have succeeded.
     *
     * @return the reactivated tasks
     */
    public List<Task> reactivateDependents(Plan plan, Task succeeded) {
        List<Task> reactivated = new ArrayList<>();
        for (Task t : plan.tasks()) {
            if (t.getState() == TaskState.FAILED
                    && t.getDependencies().contains(succeeded.getNumber())
                    && dependenciesSucceeded(plan, t)) {
                recordOutcome(plan, t, TaskState.PENDING, null);
                reactivated.add(t);
            }
        }
        return reactivated;
    }

    // ------------------------------------------------------------------
    // Graph helpers
    // ------------------------------------------------------------------

    private static Map<Integer, List<Integer>> edges(Plan plan) {
        Map<Integer, List<Integer>> edges = new HashMap<>();
        plan.byNumber().forEach((n, t) -> edges.put(n, new ArrayList<>(t.getDependencies())));
        return edges;
    }

    /** Depth-first search for a cycle; returns one if found. */
    static Optional<List<Integer>> findCycle(Map<Integer, List<Integer>> dependsOn) {
        Map<Integer, Integer> color = new HashMap<>();   // absent=unvisited, 1=on stack, 2=done
        for (Integer start : dependsOn.keySet()) {
            if (color.containsKey(start)) continue;
            List<Integer> stack = new ArrayList<>();
            Optional<List<Integer>> cycle = visit(start, dependsOn, color, stack);
            if (cycle.isPresent()) return cycle;
        }
        return Optional.empty();
    }

    private static Optional<List<Integer>> visit(Integer node, Map<Integer, List<Integer>> dependsOn,
                                                 Map<Integer, Integer> color, List<Integer> stack) {
        color.put(node, 1);
        stack.add(node);
        for (Integer next : dependsOn.getOrDefault(node, List.of())) {
            Integer c = color.get(next);
            if (c == null) {
                Optional<List<Integer>> found = visit(next, dependsOn, color, stack);
                if (found.isPresent()) return found;
            } else if (c == 1) {
                List<Integer> cycle = new ArrayList<>(stack.subList(stack.indexOf(next), stack.size()));
                cycle.add(next);
                return Optional.of(cycle);
            }
        }
        stack.remove(stack.size() - 1);
        color.put(node, 2);
        return Optional.empty();
    }
}
