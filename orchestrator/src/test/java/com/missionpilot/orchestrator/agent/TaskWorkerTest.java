package com.missionpilot.orchestrator.agent;

import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.context.CognitiveContext;
import com.missionpilot.orchestrator.context.ContextCurator;
import com.missionpilot.orchestrator.evaluation.ErrorCategory;
import com.missionpilot.orchestrator.evaluation.EvaluationResult;
import com.missionpilot.orchestrator.evaluation.FailureAssessment;
import com.missionpilot.orchestrator.evaluation.Reflection;
import com.missionpilot.orchestrator.model.EscalationReason;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.model.TaskTag;
import com.missionpilot.orchestrator.protocol.ProtocolDecision;
import com.missionpilot.orchestrator.protocol.ProtocolEngine;
import com.missionpilot.orchestrator.reasoning.ReasoningException;
import com.missionpilot.orchestrator.reasoning.Thought;
import com.missionpilot.orchestrator.reasoning.ToolCall;
import com.missionpilot.orchestrator.tool.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskWorkerTest {

    @Mock CognitiveLoopExecutor loop;
    @Mock TreeOfThoughtsEngine  tot;
    @Mock ContextCurator        curator;
    @Mock ProtocolEngine        protocol;

    TaskWorker        worker;
    CognitiveContext  context;
    CancellationToken token;

    @BeforeEach
    void setUp() {
        OrchestratorProperties props = new OrchestratorProperties();
        props.getReact().setMaxSteps(3);
        worker  = new TaskWorker(loop, tot, new EscalationController(), curator, protocol, props);
        context = new CognitiveContext("goal", List.of(), List.of(), List.of());
        token   = new CancellationToken();
    }

    @Test
    void reactCompletes_succeededWithTheFinalObservation() {
        Task task = task();
        when(curator.buildContext(task)).thenReturn(context);
        when(loop.step(eq(task), eq(context), anyList(), eq(token)))
                .thenReturn(step(false, true, null), step(true, true, null));

        ProtocolDecision d = worker.run(task, token);

        assertThat(d.kind()).isEqualTo(ProtocolDecision.Kind.SUCCEEDED);
        assertThat(d.result()).contains("ok");
        verify(loop, times(2)).step(eq(task), eq(context), anyList(), eq(token));
        verifyNoInteractions(tot, protocol);
        assertThat(MDC.get("taskId")).isNull();
    }

    @Test
    void classifiedFailure_goesToTheProtocolEngine() {
        Task task = task();
        FailureAssessment syntax = FailureAssessment.of(ErrorCategory.SYNTAX_ERROR, "app.py", "invalid syntax");
        ProtocolDecision expected = ProtocolDecision.block(task.getId(), EscalationReason.REASONING_EXHAUSTED, "x");
        when(curator.buildContext(task)).thenReturn(context);
        when(loop.step(eq(task), eq(context), anyList(), eq(token))).thenReturn(step(false, false, syntax));
        when(protocol.decide(task, syntax)).thenReturn(expected);

        assertThat(worker.run(task, token)).isSameAs(expected);
        verify(loop, times(1)).step(any(), any(), anyList(), any());
        verifyNoInteractions(tot);
    }

    @Test
    void stepBudgetExhausted_isAmbiguousAndEscalatesToTreeOfThoughts() {
        Task task = task();
        when(curator.buildContext(task)).thenReturn(context);
        when(loop.step(eq(task), eq(context), anyList(), eq(token))).thenReturn(step(false, true, null));
        when(tot.search(eq(task), eq(context), any(), eq(token)))
                .thenReturn(new SearchOutcome(false, List.of(), 9, 3, null));
        when(protocol.decide(eq(task), any())).thenAnswer(inv ->
                ProtocolDecision.block(task.getId(), EscalationReason.REASONING_EXHAUSTED,
                        inv.<FailureAssessment>getArgument(1).summary()));

        ProtocolDecision d = worker.run(task, token);

        ArgumentCaptor<String> failureContext = ArgumentCaptor.forClass(String.class);
        verify(tot).search(eq(task), eq(context), failureContext.capture(), eq(token));
        assertThat(failureContext.getValue()).contains("No completion after 3 ReAct steps");
        assertThat(d.detail()).startsWith("AMBIGUOUS");
        verify(loop, times(3)).step(any(), any(), anyList(), any());
    }

    @Test
    void highComplexityTask_goesStraightToTreeOfThoughtsOnFirstAttempt() {
        Task task = new Task(UUID.randomUUID(), 1, "choose a database", Set.of(),
                Set.of(TaskTag.TECHNOLOGY_CHOICE), TaskOrigin.PLANNED);
        task.incrementAttempts();
        when(curator.buildContext(task)).thenReturn(context);
        when(tot.search(eq(task), eq(context), isNull(), eq(token)))
                .thenReturn(new SearchOutcome(true, List.of(), 3, 1, step(true, true, null)));

        ProtocolDecision d = worker.run(task, token);

        assertThat(d.kind()).isEqualTo(ProtocolDecision.Kind.SUCCEEDED);
        verifyNoInteractions(loop);
    }

    @Test
    void reasoningBackendFailure_blocksTheTask() {
        Task task = task();
        when(curator.buildContext(task)).thenReturn(context);
        when(loop.step(any(), any(), anyList(), any())).thenThrow(new ReasoningException("HTTP 529 overloaded"));

        ProtocolDecision d = worker.run(task, token);

        assertThat(d.kind()).isEqualTo(ProtocolDecision.Kind.BLOCK);
        assertThat(d.reason()).isEqualTo(EscalationReason.REASONING_EXHAUSTED);
        assertThat(d.detail()).contains("overloaded");
    }

    @Test
    void cancellation_isReportedAsAborted() {
        Task task = task();
        when(curator.buildContext(task)).thenReturn(context);
        when(loop.step(any(), any(), anyList(), any())).thenThrow(new CancellationException("Mission cancelled"));

        assertThat(worker.run(task, token).kind()).isEqualTo(ProtocolDecision.Kind.ABORTED);
    }

    // ------------------------------------------------------------------

    private static Task task() {
        Task task = new Task(UUID.randomUUID(), 1, "run the tests", Set.of(), Set.of(), TaskOrigin.PLANNED);
        task.incrementAttempts();
        return task;
    }

    private static StepResult step(boolean terminal, boolean succeeded, FailureAssessment failure) {
        Thought thought = Thought.act("try it", new ToolCall("run_command", Map.of("command", "make test")), terminal);
        Reflection reflection = succeeded
                ? new Reflection(EvaluationResult.success(1.0, "fine"), null, null)
                : new Reflection(EvaluationResult.failure(0.0, "broken"), failure, null);
        return new StepResult(thought, "run_command", "run_command {command=make test}",
                Observation.of("run_command", succeeded ? 0 : 1, "ok", ""), terminal, reflection);
    }
}
