package com.missionpilot.orchestrator.protocol;

import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.evaluation.FailureAssessment;
import com.missionpilot.orchestrator.goal.GoalStateManager;
import com.missionpilot.orchestrator.memory.EpisodicMemory;
import com.missionpilot.orchestrator.model.EscalationReason;
import com.missionpilot.orchestrator.model.EscalationTier;
import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.model.TaskState;
import com.missionpilot.orchestrator.service.Plan;
import com.missionpilot.orchestrator.service.PlanManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes task outcomes into the self-correction tiers and applies their effects.
 *
 * <p>{@link #decide} runs on the worker thread and only classifies:
 * <ul>
 *   <li>UNAUTHORIZED → human escalation</li>
 *   <li>capability gap → Tier 2 (Meta-Cognition)</li>
 *   <li>transient category → Tier 1 (Reflexion)</li>
 *   <li>anything still ambiguous (ToT already tried) → human escalation</li>
 * </ul>
 * The two tier triggers are disjoint, so a task is in at most one tier at a time
 * and Tier 1 exhaustion never falls through to Tier 2.
 *
 * <p>{@link #apply} runs on the plan's owning thread and is the only place
 * task state, retry counts and the plan change in response to an outcome.
 */
@Component
public class ProtocolEngine {

    private static final Logger log = LoggerFactory.getLogger(ProtocolEngine.class);

    private final PlanManager            plans;
    private final ReflexionTier          reflexion;
    private final GoalStateManager       goals;
    private final EpisodicMemory         memory;
    private final HumanEscalationService escalations;
    private final ProtocolTransitions    transitions;
    private final int                    maxResearchRounds;

    public ProtocolEngine(PlanManager plans,
                          ReflexionTier reflexion,
                          GoalStateManager goals,
                          EpisodicMemory memory,
                          HumanEscalationService escalations,
                          ProtocolTransitions transitions,
                          OrchestratorProperties properties) {
        this.plans             = plans;
        this.reflexion         = reflexion;
        this.goals             = goals;
        this.memory            = memory;
        this.escalations       = escalations;
        this.transitions       = transitions;
        this.maxResearchRounds = properties.getMaxRetries();
    }

    // ------------------------------------------------------------------
    // Worker half
    // ------------------------------------------------------------------

    /** Classify a failed attempt into the decision the owner will apply. */
    public ProtocolDecision decide(Task task, FailureAssessment failure) {
        if (failure.isUnauthorized()) {
            return ProtocolDecision.block(task.getId(), EscalationReason.UNAUTHORIZED, failure.summary());
        }
        if (failure.isCapabilityGap()) {
            transitions.enter(task, ProtocolPhase.GAP_IDENTIFIED, failure.summary());
            return ProtocolDecision.capabilityGap(task.getId(), failure);
        }
        if (failure.isTransient()) {
            return reflexion.diagnose(task, failure);
        }
        return ProtocolDecision.block(task.getId(), EscalationReason.REASONING_EXHAUSTED,
                "No identifiable root cause after Tree-of-Thoughts: " + failure.summary());
    }

    // ------------------------------------------------------------------
    // Owner half
    // ------------------------------------------------------------------

    public void apply(Plan plan, Task task, ProtocolDecision decision) {
        switch (decision.kind()) {
            case SUCCEEDED         -> succeed(plan, task, decision.result());
            case RESOLVED          -> {
                memory.append(task, RecordCategory.RESOLUTION, "operator resolution",
                        decision.result(), 1.0, "Operator supplied a successful observation.");
                succeed(plan, task, decision.result());
            }
            case TRANSIENT_FAILURE -> {
                if (!reflexion.apply(plan, task, decision)) {
                    block(plan, task, EscalationReason.CIRCUIT_BREAKER_TRIPPED,
                            "Retry budget exhausted; last failure: " + decision.detail());
                }
            }
            case CAPABILITY_GAP    -> escalateToResearch(plan, task, decision);
            case REQUEUE           -> {
                task.setEscalationTier(EscalationTier.NONE);
                plans.requeue(plan, task);
                memory.append(task, RecordCategory.REQUEUED, "requeue", decision.detail(), 1.0,
                        "Re-attempting with updated knowledge " + decision.detail());
                transitions.enter(task, ProtocolPhase.REQUEUED, decision.detail());
            }
            case BLOCK             -> block(plan, task, decision.reason(), decision.detail());
            case CANCEL_TASK       -> {
                memory.append(task, RecordCategory.RESOLUTION, "operator cancellation",
                        decision.detail(), 0.0, "Operator cancelled the task.");
                task.setEscalationTier(EscalationTier.NONE);
                plans.recordOutcome(plan, task, TaskState.CANCELLED, decision.detail());
            }
            case ABORTED           -> log.info("Discarding result of {}: {}", task, decision.detail());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void succeed(Plan plan, Task task, String result) {
        if (task.getEscalationTier() == EscalationTier.REFLEXION) {
            transitions.enter(task, ProtocolPhase.RESOLVED, "after " + task.getRetryCount() + " retries");
        }
        task.setEscalationTier(EscalationTier.NONE);
        plans.recordOutcome(plan, task, TaskState.SUCCEEDED, result);
        if (task.getOrigin() == TaskOrigin.PLANNED) {
            goals.markDone(plan.missionId(), task.getNumber());
        }
        List<Task> reactivated = plans.reactivateDependents(plan, task);
        for (Task t : reactivated) {
            transitions.enter(t, ProtocolPhase.RETRYING, "prerequisite " + task + " succeeded");
        }
    }

    private void escalateToResearch(Plan plan, Task task, ProtocolDecision decision) {
        long rounds = memory.count(task, RecordCategory.REQUEUED);
        if (rounds >= maxResearchRounds) {
            transitions.enter(task, ProtocolPhase.RESEARCH_EXHAUSTED, rounds + " research rounds already spent");
            block(plan, task, EscalationReason.RESEARCH_EXHAUSTED,
                    "Capability gap persists after " + rounds + " research rounds: " + decision.detail());
            return;
        }
        task.setEscalationTier(EscalationTier.META_COGNITION);
        plans.recordOutcome(plan, task, TaskState.BLOCKED_PENDING_RESEARCH, null);
        transitions.enter(task, ProtocolPhase.META_TASK_ESCALATED, decision.capability());
    }

    private void block(Plan plan, Task task, EscalationReason reason, String detail) {
        plans.recordOutcome(plan, task, TaskState.BLOCKED, detail);
        memory.append(task, RecordCategory.ESCALATION, "escalate: " + reason, detail, 0.0,
                "Handed to a human operator: " + reason);
        escalations.raise(task, reason, detail);
    }
}
