package com.missionpilot.orchestrator.service;

import com.missionpilot.orchestrator.agent.CancellationToken;
import com.missionpilot.orchestrator.agent.TaskWorker;
import com.missionpilot.orchestrator.goal.GoalStateManager;
import com.missionpilot.orchestrator.model.EscalationReason;
import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.model.MissionState;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.model.TaskState;
import com.missionpilot.orchestrator.protocol.HumanEscalationService;
import com.missionpilot.orchestrator.protocol.MetaCognitionTier;
import com.missionpilot.orchestrator.protocol.ProtocolDecision;
import com.missionpilot.orchestrator.protocol.ProtocolEngine;
import com.missionpilot.orchestrator.reasoning.ReasoningException;
import com.missionpilot.orchestrator.repository.MissionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Drives every RUNNING mission.
 *
 * {@link #tick()} is called from a single scheduler thread, which therefore
 * owns every plan. Each tick, per mission:
 * <ol>
 *   <li>drain the decisions workers, research units and operators delivered</li>
 *   <li>apply them through the {@link ProtocolEngine}</li>
 *   <li>dispatch every runnable task to the worker pool</li>
 *   <li>check for completion or stall</li>
 * </ol>
 *
 * A paused mission still drains its inbox, so units already in flight land
 * normally, but nothing new is dispatched: neither task attempts nor research
 * for gaps found meanwhile. It cannot stall while paused.
 *
 * Each unit is timed on the task ({@link Task#unitStarted}, {@link Task#unitFinished})
 * and in the {@code missionpilot.task.units} timer, tagged by kind and outcome.
 */
@Service
public class MissionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MissionCoordinator.class);

    private final MissionRepository      missionRepo;
    private final PlanManager            plans;
    private final GoalStateManager       goals;
    private final TaskWorker             worker;
    private final MetaCognitionTier      metaCognition;
    private final ProtocolEngine         protocol;
    private final HumanEscalationService escalations;
    private final ExecutorService        workers;
    private final MeterRegistry          meterRegistry;

    private final Map<UUID, MissionRun> runs = new ConcurrentHashMap<>();

    public MissionCoordinator(MissionRepository missionRepo,
                              PlanManager plans,
                              GoalStateManager goals,
                              TaskWorker worker,
                              MetaCognitionTier metaCognition,
                              ProtocolEngine protocol,
                              HumanEscalationService escalations,
                              @Qualifier("taskWorkers") ExecutorService workers,
                              MeterRegistry meterRegistry) {
        this.missionRepo   = missionRepo;
        this.plans         = plans;
        this.goals         = goals;
        this.worker        = worker;
        this.metaCognition = metaCognition;
        this.protocol      = protocol;
        this.escalations   = escalations;
        this.workers       = workers;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Decompose a new mission and start running it.
     *
     * An invalid plan, or a reasoning backend that cannot produce one, fails
     * the mission immediately; it is still returned so the caller sees why.
     */
    public Mission launch(Mission mission) {
        missionRepo.save(mission);
        Plan plan;
        try {
            plan = plans.decompose(mission);
        } catch (InvalidPlanException | ReasoningException e) {
            log.error("Mission {} could not be planned: {}", mission.getId(), e.getMessage());
            mission.fail("Invalid plan: " + e.getMessage());
            missionRepo.save(mission);
            return mission;
        }
        goals.initialize(mission, plan.tasks());
        mission.start();
        missionRepo.save(mission);
        runs.put(mission.getId(), new MissionRun(mission, plan));
        log.info("Mission {} RUNNING with {} tasks", mission.getId(), plan.size());
        return mission;
    }

    /** Pick up RUNNING missions after a restart. */
    public int resume() {
        int resumed = 0;
        for (Mission mission : missionRepo.findByState(MissionState.RUNNING)) {
            if (runs.containsKey(mission.getId())) continue;
            Plan plan = plans.restore(mission);
            runs.put(mission.getId(), new MissionRun(mission, plan));
            resumed++;
            log.info("Resumed mission {} ({} tasks)", mission.getId(), plan.size());
        }
        return resumed;
    }

    /** One scheduling round over every running mission. */
    public void tick() {
        for (MissionRun run : new ArrayList<>(runs.values())) {
            try {
                advance(run);
            } catch (RuntimeException e) {
                log.error("Mission {} failed unexpectedly", run.missionId(), e);
                finish(run, MissionState.FAILED, "Internal error: " + e.getMessage());
            }
        }
    }

    // ------------------------------------------------------------------
    // Operator inputs (any thread)
    // ------------------------------------------------------------------

    /** @return false if the mission is not running */
    public boolean requestCancel(UUID missionId) {
        MissionRun run = runs.get(missionId);
        if (run == null) return false;
        run.cancelRequested = true;
        run.token.cancel();
        log.info("Cancellation requested for mission {}", missionId);
        return true;
    }

    /**
     * Stop or restart dispatching new units. Units in flight are not interrupted.
     *
     * @return false if the mission is not running
     */
    public boolean setPaused(UUID missionId, boolean paused) {
        MissionRun run = runs.get(missionId);
        if (run == null) return false;
        if (run.paused != paused) {
            run.paused = paused;
            log.info("Mission {} {}", missionId, paused ? "paused" : "resumed");
        }
        return true;
    }

    /** Empty if the mission is not running. */
    public Optional<Boolean> isPaused(UUID missionId) {
        return Optional.ofNullable(runs.get(missionId)).map(r -> r.paused);
    }

    /** Queue a decision for the owning thread. @return false if the mission is not running */
    public boolean deliver(UUID missionId, ProtocolDecision decision) {
        MissionRun run = runs.get(missionId);
        if (run == null) return false;
        run.inbox.add(decision);
        return true;
    }

    public Optional<Mission> active(UUID missionId) {
        return Optional.ofNullable(runs.get(missionId)).map(r -> r.mission);
    }

    // ------------------------------------------------------------------
    // Owner thread
    // ------------------------------------------------------------------

    void advance(MissionRun run) {
        drain(run);
        if (run.cancelRequested) {
            finish(run, MissionState.CANCELLED, null);
            return;
        }
        if (!run.paused) {
            startPendingResearch(run);
            dispatch(run);
        }
        checkCompletion(run);
    }

    private void drain(MissionRun run) {
        ProtocolDecision decision;
        while ((decision = run.inbox.poll()) != null) {
            Optional<Task> found = run.plan.task(decision.taskId());
            if (found.isEmpty()) {
                log.warn("Mission {}: decision {} for unknown task {}", run.missionId(),
                        decision.kind(), decision.taskId());
                continue;
            }
            Task task = found.get();
            if (run.inFlight.remove(task.getId()) != null) {
                task.unitFinished(Instant.now());
            }
            if (run.cancelRequested) {
                continue;
            }
            if (isOperatorDecision(decision) && task.getState() != TaskState.BLOCKED) {
                log.warn("Ignoring {} for {}: task is not blocked", decision.kind(), task);
                continue;
            }
            protocol.apply(run.plan, task, decision);
            if (decision.kind() == ProtocolDecision.Kind.CAPABILITY_GAP
                    && task.getState() == TaskState.BLOCKED_PENDING_RESEARCH) {
                if (run.paused) {
                    run.pendingResearch.put(task.getId(), decision.capability());
                } else {
                    startResearch(run, task, decision.capability());
                }
            }
        }
    }

    private void dispatch(MissionRun run) {
        for (Task task : plans.runnable(run.plan)) {
            task.unitStarted(Instant.now());
            plans.markRunning(run.plan, task);
            CancellationToken token = run.token;
            Future<?> future = workers.submit(() -> run.inbox.add(attempt(task, token)));
            run.inFlight.put(task.getId(), future);
        }
    }

    private void startPendingResearch(MissionRun run) {
        Iterator<Map.Entry<UUID, String>> pending = run.pendingResearch.entrySet().iterator();
        while (pending.hasNext()) {
            Map.Entry<UUID, String> next = pending.next();
            pending.remove();
            run.plan.task(next.getKey())
                    .filter(t -> t.getState() == TaskState.BLOCKED_PENDING_RESEARCH)
                    .ifPresent(t -> startResearch(run, t, next.getValue()));
        }
    }

    private void startResearch(MissionRun run, Task task, String capability) {
        task.unitStarted(Instant.now());
        CancellationToken token = run.token;
        Future<?> future = workers.submit(() -> run.inbox.add(research(task, capability, token)));
        run.inFlight.put(task.getId(), future);
    }

    /**
     * Every task SUCCEEDED or CANCELLED ends the mission; it succeeds unless a
     * planned task was cancelled. With nothing runnable or in flight the
     * mission waits while any task is BLOCKED on an operator, and fails otherwise.
     */
    private void checkCompletion(MissionRun run) {
        List<Task> tasks = new ArrayList<>(run.plan.tasks());
        boolean allFinal = tasks.stream().allMatch(t ->
                t.getState() == TaskState.SUCCEEDED || t.getState() == TaskState.CANCELLED);
        if (allFinal) {
            List<Integer> cancelledPlanned = tasks.stream()
                    .filter(t -> t.getOrigin() == TaskOrigin.PLANNED && t.getState() == TaskState.CANCELLED)
                    .map(Task::getNumber)
                    .toList();
            if (cancelledPlanned.isEmpty()) {
                finish(run, MissionState.SUCCEEDED, null);
            } else {
                finish(run, MissionState.FAILED, "Planned tasks cancelled by operator: " + cancelledPlanned);
            }
            return;
        }
        if (run.paused || !run.inFlight.isEmpty() || !run.inbox.isEmpty() || !plans.runnable(run.plan).isEmpty()) {
            return;
        }
        int blocked = (int) tasks.stream().filter(t -> t.getState() == TaskState.BLOCKED).count();
        if (blocked > 0) {
            if (blocked != run.reportedBlocked) {
                log.warn("Mission {} waiting on {} blocked task(s) for operator resolution",
                        run.missionId(), blocked);
                run.reportedBlocked = blocked;
            }
            return;
        }
        finish(run, MissionState.FAILED, "Stalled: no runnable task and none in flight; "
                + tasks.stream().filter(t -> t.getState() != TaskState.SUCCEEDED).map(Task::toString).toList());
    }

    private void finish(MissionRun run, MissionState outcome, String reason) {
        run.token.cancel();
        run.inFlight.values().forEach(f -> f.cancel(true));
        run.inFlight.clear();
        run.inbox.clear();
        run.pendingResearch.clear();

        Mission mission = run.mission;
        switch (outcome) {
            case SUCCEEDED -> mission.succeed();
            case FAILED    -> mission.fail(reason);
            case CANCELLED -> {
                for (Task t : run.plan.tasks()) {
                    if (t.getState() != TaskState.SUCCEEDED && t.getState() != TaskState.CANCELLED) {
                        plans.recordOutcome(run.plan, t, TaskState.CANCELLED, null);
                    }
                }
                mission.cancel();
            }
            default -> throw new IllegalArgumentException("Not a terminal outcome: " + outcome);
        }
        missionRepo.save(mission);
        escalations.cancelOpen(mission.getId(), "Mission " + outcome);
        goals.evict(mission.getId());
        runs.remove(mission.getId());

        if (outcome == MissionState.SUCCEEDED) {
            log.info("Mission {} SUCCEEDED", mission.getId());
        } else {
            log.warn("Mission {} {}{}", mission.getId(), outcome, reason == null ? "" : ": " + reason);
        }
    }

    // ------------------------------------------------------------------
    // Worker threads
    // ------------------------------------------------------------------

    private ProtocolDecision attempt(Task task, CancellationToken token) {
        Timer.Sample sample = Timer.start(meterRegistry);
        ProtocolDecision decision;
        try {
            decision = worker.run(task, token);
        } catch (RuntimeException e) {
            log.error("Unhandled error in worker for {}", task, e);
            decision = ProtocolDecision.block(task.getId(), EscalationReason.REASONING_EXHAUSTED,
                    "Unhandled worker error: " + e.getMessage());
        }
        sample.stop(unitTimer("attempt", decision));
        return decision;
    }

    private ProtocolDecision research(Task task, String capability, CancellationToken token) {
        MDC.put("missionId",  task.getMissionId().toString());
        MDC.put("taskId",     task.getId().toString());
        MDC.put("taskNumber", String.valueOf(task.getNumber()));
        Timer.Sample sample = Timer.start(meterRegistry);
        ProtocolDecision decision;
        try {
            decision = metaCognition.research(task, capability, token);
        } catch (CancellationException e) {
            decision = ProtocolDecision.aborted(task.getId());
        } catch (RuntimeException e) {
            log.error("Research for {} failed", task, e);
            decision = ProtocolDecision.block(task.getId(), EscalationReason.RESEARCH_EXHAUSTED,
                    "Research failed: " + e.getMessage());
        } finally {
            MDC.clear();
        }
        sample.stop(unitTimer("research", decision));
        return decision;
    }

    private Timer unitTimer(String kind, ProtocolDecision decision) {
        return meterRegistry.timer("missionpilot.task.units", "kind", kind, "outcome", decision.kind().name());
    }

    private static boolean isOperatorDecision(ProtocolDecision decision) {
        return decision.kind() == ProtocolDecision.Kind.RESOLVED
                || decision.kind() == ProtocolDecision.Kind.CANCEL_TASK;
    }
}
