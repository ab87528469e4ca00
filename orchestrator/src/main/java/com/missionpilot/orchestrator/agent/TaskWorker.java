package com.missionpilot.orchestrator.agent;

import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.context.CognitiveContext;
import com.missionpilot.orchestrator.context.ContextCurator;
import com.missionpilot.orchestrator.evaluation.FailureAssessment;
import com.missionpilot.orchestrator.model.EscalationReason;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.protocol.ProtocolDecision;
import com.missionpilot.orchestrator.protocol.ProtocolEngine;
import com.missionpilot.orchestrator.reasoning.ReasoningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Runs one attempt of one task, end to end, on a worker thread.
 *
 * <ol>
 *   <li>High-complexity tasks on their first attempt go straight to Tree-of-Thoughts.</li>
 *   <li>Otherwise ReAct steps run until the task completes, a step fails, or
 *       {@code react.max-steps} is reached (an ambiguous failure).</li>
 *   <li>An ambiguous failure escalates to Tree-of-Thoughts.</li>
 *   <li>Whatever failure remains is classified by the {@link ProtocolEngine}.</li>
 * </ol>
 * The worker never mutates the plan. It returns a {@link ProtocolDecision}
 * that the plan's owning thread applies.
 */
@Component
public class TaskWorker {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private final CognitiveLoopExecutor loop;
    private final TreeOfThoughtsEngine  tot;
    private final EscalationController  escalation;
    private final ContextCurator        curator;
    private final ProtocolEngine        protocol;
    private final int                   maxSteps;

    public TaskWorker(CognitiveLoopExecutor loop,
                      TreeOfThoughtsEngine tot,
                      EscalationController escalation,
                      ContextCurator curator,
                      ProtocolEngine protocol,
                      OrchestratorProperties properties) {
        this.loop       = loop;
        this.tot        = tot;
        this.escalation = escalation;
        this.curator    = curator;
        this.protocol   = protocol;
        this.maxSteps   = properties.getReact().getMaxSteps();
    }

    public ProtocolDecision run(Task task, CancellationToken token) {
        // Every log line of this attempt carries these, in plain text (dev) and JSON (prod)
        MDC.put("missionId",  task.getMissionId().toString());
        MDC.put("taskId",     task.getId().toString());
        MDC.put("taskNumber", String.valueOf(task.getNumber()));
        MDC.put("attempt",    String.valueOf(task.getAttempts()));
        try {
            log.info("Starting attempt {} of {}: {}", task.getAttempts(), task, task.getDescription());
            return attempt(task, token);
        } catch (CancellationException e) {
            log.info("{} aborted: {}", task, e.getMessage());
            return ProtocolDecision.aborted(task.getId());
        } catch (ReasoningException e) {
            log.error("Reasoning backend failed during {}", task, e);
            return ProtocolDecision.block(task.getId(), EscalationReason.REASONING_EXHAUSTED,
                    "Reasoning backend failed: " + e.getMessage());
        } finally {
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ProtocolDecision attempt(Task task, CancellationToken token) {
        if (escalation.shouldEscalateToToT(task, null)) {
            log.info("{} is tagged {}; routing directly to Tree-of-Thoughts", task, task.getTags());
            return afterSearch(task, null, null, token);
        }

        List<String> transcript = new ArrayList<>();
        StepResult last = null;
        for (int i = 1; i <= maxSteps; i++) {
            token.throwIfCancelled();
            CognitiveContext context = curator.buildContext(task);
            StepResult step = loop.step(task, context, transcript, token);
            transcript.add(step.transcriptEntry());
            last = step;
            if (step.completed()) {
                log.info("{} completed after {} ReAct steps", task, i);
                return ProtocolDecision.succeeded(task.getId(), step.resultText());
            }
            if (step.failed()) {
                break;
            }
        }

        FailureAssessment failure = last != null && last.failed()
                ? last.assessment()
                : FailureAssessment.unclassified("No completion after " + maxSteps + " ReAct steps");
        if (escalation.shouldEscalateToToT(task, failure)) {
            log.info("{} failure is ambiguous ({}); escalating to Tree-of-Thoughts", task, failure.summary());
            return afterSearch(task, failure, last, token);
        }
        return protocol.decide(task, failure);
    }

    private ProtocolDecision afterSearch(Task task, FailureAssessment failure, StepResult last,
                                         CancellationToken token) {
        String failureContext = failure == null ? null
                : failure.summary() + (last == null ? "" : "\n" + last.observation().toText());
        SearchOutcome outcome = tot.search(task, curator.buildContext(task), failureContext, token);
        if (outcome.succeeded()) {
            return ProtocolDecision.succeeded(task.getId(), outcome.lastStep().resultText());
        }
        FailureAssessment remaining = outcome.lastAssessment() != null ? outcome.lastAssessment() : failure;
        if (remaining == null) {
            remaining = FailureAssessment.unclassified("Tree-of-Thoughts found no viable strategy");
        }
        return protocol.decide(task, remaining);
    }
}
