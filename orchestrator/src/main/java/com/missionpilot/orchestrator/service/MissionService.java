package com.missionpilot.orchestrator.service;

import com.missionpilot.orchestrator.goal.GoalStateManager;
import com.missionpilot.orchestrator.memory.EpisodicMemory;
import com.missionpilot.orchestrator.model.EscalationStatus;
import com.missionpilot.orchestrator.model.GoalState;
import com.missionpilot.orchestrator.model.HumanEscalation;
import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.ReflexionRecord;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.protocol.HumanEscalationService;
import com.missionpilot.orchestrator.protocol.ProtocolDecision;
import com.missionpilot.orchestrator.protocol.ResolutionAction;
import com.missionpilot.orchestrator.repository.MissionRepository;
import com.missionpilot.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Mission lifecycle and operator actions behind the REST API.
 *
 * Nothing here touches a plan directly: cancellations and escalation
 * resolutions are handed to the {@link MissionCoordinator}, which applies
 * them on the plan's owning thread.
 */
@Service
public class MissionService {

    private static final Logger log = LoggerFactory.getLogger(MissionService.class);

    private final MissionCoordinator     coordinator;
    private final MissionRepository      missionRepo;
    private final TaskRepository         taskRepo;
    private final GoalStateManager       goals;
    private final EpisodicMemory         memory;
    private final HumanEscalationService escalations;

    public MissionService(MissionCoordinator coordinator,
                          MissionRepository missionRepo,
                          TaskRepository taskRepo,
                          GoalStateManager goals,
                          EpisodicMemory memory,
                          HumanEscalationService escalations) {
        this.coordinator = coordinator;
        this.missionRepo = missionRepo;
        this.taskRepo    = taskRepo;
        this.goals       = goals;
        this.memory      = memory;
        this.escalations = escalations;
    }

    // ------------------------------------------------------------------
    // Missions
    // ------------------------------------------------------------------

    /**
     * Create a mission and decompose it. Returns once the plan is accepted
     * (RUNNING) or rejected (FAILED); tasks then run in the background.
     */
    public Mission submit(String primeDirective) {
        if (primeDirective == null || primeDirective.isBlank()) {
            throw new IllegalArgumentException("primeDirective must not be blank");
        }
        Mission mission = coordinator.launch(new Mission(primeDirective.strip()));
        log.info("Mission {} submitted: {}", mission.getId(), mission.getState());
        return mission;
    }

    public Optional<Mission> find(UUID missionId) {
        Optional<Mission> running = coordinator.active(missionId);
        return running.isPresent() ? running : missionRepo.findById(missionId);
    }

    @Transactional(readOnly = true)
    public List<Task> tasks(UUID missionId) {
        return taskRepo.findByMissionIdOrderByNumberAsc(missionId);
    }

    public <T> Optional<T> goal(UUID missionId, Function<GoalState, T> view) {
        return goals.read(missionId, view);
    }

    public List<ReflexionRecord> reflections(UUID missionId, UUID taskId) {
        return memory.history(missionId, taskId);
    }

    /**
     * Ask the coordinator to cancel a running mission. In-flight workers stop
     * at their next suspension point and their results are discarded.
     *
     * @throws IllegalStateException if the mission is not running
     */
    public void cancel(UUID missionId) {
        if (!coordinator.requestCancel(missionId)) {
            throw new IllegalStateException("Mission " + missionId + " is not running");
        }
    }

    /**
     * Pause, resume or cancel a running mission.
     *
     * @throws IllegalStateException if the mission is not running
     */
    public void control(UUID missionId, MissionControlAction action) {
        boolean applied = switch (action) {
            case PAUSE  -> coordinator.setPaused(missionId, true);
            case RESUME -> coordinator.setPaused(missionId, false);
            case CANCEL -> coordinator.requestCancel(missionId);
        };
        if (!applied) {
            throw new IllegalStateException("Mission " + missionId + " is not running");
        }
    }

    /** Per-task attempts, escalation rounds and timing; empty for an unknown mission. */
    @Transactional(readOnly = true)
    public Optional<MissionProgress> progress(UUID missionId) {
        return find(missionId).map(mission -> new MissionProgress(mission,
                coordinator.isPaused(missionId).orElse(false),
                taskRepo.findByMissionIdOrderByNumberAsc(missionId).stream()
                        .map(t -> new MissionProgress.TaskProgress(t, memory.count(t, RecordCategory.RESEARCH)))
                        .toList()));
    }

    // ------------------------------------------------------------------
    // Escalations
    // ------------------------------------------------------------------

    public List<HumanEscalation> escalations(EscalationStatus status) {
        return escalations.list(status);
    }

    public Optional<HumanEscalation> findEscalation(UUID escalationId) {
        return escalations.find(escalationId);
    }

    /**
     * Close an open escalation and deliver the operator's decision to the
     * blocked task: SUCCEED feeds {@code observation} back as a successful
     * result, CANCEL cancels the task.
     *
     * @throws IllegalStateException if the escalation is not OPEN or its mission is not running
     */
    public HumanEscalation resolve(HumanEscalation escalation, ResolutionAction action, String observation) {
        if (escalation.getStatus() != EscalationStatus.OPEN) {
            throw new IllegalStateException("Escalation " + escalation.getId() + " is " + escalation.getStatus());
        }
        if (coordinator.active(escalation.getMissionId()).isEmpty()) {
            throw new IllegalStateException("Mission " + escalation.getMissionId() + " is not running");
        }
        String text = observation == null ? "" : observation;
        escalations.close(escalation, action, text);
        ProtocolDecision decision = action == ResolutionAction.SUCCEED
                ? ProtocolDecision.resolved(escalation.getTaskId(), text)
                : ProtocolDecision.cancelTask(escalation.getTaskId(), text.isEmpty() ? "cancelled by operator" : text);
        coordinator.deliver(escalation.getMissionId(), decision);
        return escalation;
    }
}
