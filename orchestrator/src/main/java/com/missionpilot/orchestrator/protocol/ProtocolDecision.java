package com.missionpilot.orchestrator.protocol;

import com.missionpilot.orchestrator.evaluation.FailureAssessment;
import com.missionpilot.orchestrator.model.EscalationReason;

import java.util.UUID;

/**
 * What should happen to a task after a unit of work on it finished.
 *
 * Produced on worker threads (task attempts, research) or by the operator
 * (resolutions), and applied by the plan's owning thread through
 * {@link ProtocolEngine#apply}.
 *
 * @param result     task result for SUCCEEDED / RESOLVED
 * @param failure    the failure behind TRANSIENT_FAILURE / CAPABILITY_GAP
 * @param hypothesis Tier 1 causal hypothesis
 * @param corrective description of the Tier 1 corrective task
 * @param reason     escalation reason for BLOCK
 * @param detail     free text for logs, records and escalations
 */
public record ProtocolDecision(
        Kind              kind,
        UUID              taskId,
        String            result,
        FailureAssessment failure,
        String            hypothesis,
        String            corrective,
        EscalationReason  reason,
        String            detail) {

    public enum Kind {
        SUCCEEDED,
        TRANSIENT_FAILURE,
        CAPABILITY_GAP,
        REQUEUE,
        BLOCK,
        RESOLVED,       // operator supplied a synthetic successful observation
        CANCEL_TASK,    // operator cancelled the task
        ABORTED         // worker stopped by mission cancellation; result discarded
    }

    public static ProtocolDecision succeeded(UUID taskId, String result) {
        return new ProtocolDecision(Kind.SUCCEEDED, taskId, result, null, null, null, null, null);
    }

    public static ProtocolDecision transientFailure(UUID taskId, FailureAssessment failure,
                                                    String hypothesis, String corrective) {
        return new ProtocolDecision(Kind.TRANSIENT_FAILURE, taskId, null, failure, hypothesis, corrective,
                null, failure.summary());
    }

    public static ProtocolDecision capabilityGap(UUID taskId, FailureAssessment failure) {
        return new ProtocolDecision(Kind.CAPABILITY_GAP, taskId, null, failure, null, null, null, failure.summary());
    }

    public static ProtocolDecision requeue(UUID taskId, String detail) {
        return new ProtocolDecision(Kind.REQUEUE, taskId, null, null, null, null, null, detail);
    }

    public static ProtocolDecision block(UUID taskId, EscalationReason reason, String detail) {
        return new ProtocolDecision(Kind.BLOCK, taskId, null, null, null, null, reason, detail);
    }

    public static ProtocolDecision resolved(UUID taskId, String observation) {
        return new ProtocolDecision(Kind.RESOLVED, taskId, observation, null, null, null, null, observation);
    }

    public static ProtocolDecision cancelTask(UUID taskId, String detail) {
        return new ProtocolDecision(Kind.CANCEL_TASK, taskId, null, null, null, null, null, detail);
    }

    public static ProtocolDecision aborted(UUID taskId) {
        return new ProtocolDecision(Kind.ABORTED, taskId, null, null, null, null, null, "mission cancelled");
    }

    /** Capability the task lacked, for CAPABILITY_GAP decisions. */
    public String capability() {
        if (failure == null) return null;
        return failure.subject() != null ? failure.subject() : failure.evidence();
    }
}
