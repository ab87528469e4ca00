package com.missionpilot.orchestrator.claude;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.missionpilot.orchestrator.context.CognitiveContext;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.model.TaskTag;
import com.missionpilot.orchestrator.reasoning.Critique;
import com.missionpilot.orchestrator.reasoning.PlanDraft;
import com.missionpilot.orchestrator.reasoning.ReasoningException;
import com.missionpilot.orchestrator.reasoning.TaskDraft;
import com.missionpilot.orchestrator.reasoning.Thought;
import com.missionpilot.orchestrator.research.Finding;
import com.missionpilot.orchestrator.tool.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Parsing of Claude replies into reasoning types. ClaudeClient is mocked,
 * so each test controls the raw reply text.
 */
@ExtendWith(MockitoExtension.class)
class ClaudeReasoningModelTest {

    @Mock ClaudeClient claude;

    ClaudeReasoningModel model;
    Task                 task;
    CognitiveContext     context;

    @BeforeEach
    void setUp() {
        model   = new ClaudeReasoningModel(claude, new ObjectMapper(), "test-model");
        task    = new Task(UUID.randomUUID(), 1, "build the app", Set.of(), Set.of(), TaskOrigin.PLANNED);
        context = new CognitiveContext("Ship the app", List.of(), List.of(), List.of());
    }

    private void reply(String text) {
        when(claude.complete(eq("test-model"), anyString(), anyList())).thenReturn(text);
    }

    @Test
    void decompose_readsTasksDependenciesAndKnownTags() {
        reply("""
                ```json
                {"tasks":[
                  {"id":1,"description":"pick a database","tags":["architecture-selection","shiny"]},
                  {"id":2,"description":"write the schema","dependsOn":[1]}
                ]}
                ```
                """);

        PlanDraft draft = model.decompose("Build a service");

        assertThat(draft.tasks()).hasSize(2);
        TaskDraft first = draft.tasks().get(0);
        assertThat(first.id()).isEqualTo(1);
        assertThat(first.tags()).containsExactly(TaskTag.ARCHITECTURE_SELECTION);
        assertThat(draft.tasks().get(1).dependsOn()).containsExactly(1);
    }

    @Test
    void think_actionReply_becomesToolCall() {
        reply("""
                {"thought":"look at the build file","action":{"tool":"read_file","args":{"path":"Makefile"}},
                 "completesTask":false}
                """);

        Thought thought = model.think(task, context, List.of());

        assertThat(thought.hasAction()).isTrue();
        assertThat(thought.action().tool()).isEqualTo("read_file");
        assertThat(thought.action().args()).isEqualTo(Map.of("path", "Makefile"));
        assertThat(thought.completesTask()).isFalse();
    }

    @Test
    void think_resultTagWithoutJson_becomesFinalAnswer() {
        reply("The build is green.\n<result>built</result>");

        Thought thought = model.think(task, context, List.of("step 1: make -> exit 0"));

        assertThat(thought.isFinal()).isTrue();
        assertThat(thought.finalAnswer()).isEqualTo("built");
    }

    @Test
    void think_plainProse_isThoughtWithoutAction() {
        reply("I should first find out which compiler is installed.");

        Thought thought = model.think(task, context, List.of());

        assertThat(thought.hasAction()).isFalse();
        assertThat(thought.isFinal()).isFalse();
        assertThat(thought.text()).startsWith("I should first");
    }

    @Test
    void propose_returnsAtMostCountCandidates() {
        reply("""
                {"candidates":[
                  {"thought":"use postgres","finalAnswer":"postgres"},
                  {"thought":"use sqlite","finalAnswer":"sqlite"},
                  {"thought":"use files","finalAnswer":"files"}
                ]}
                """);

        List<Thought> candidates = model.propose(task, context, null, List.of(), 2);

        assertThat(candidates).extracting(Thought::finalAnswer).containsExactly("postgres", "sqlite");
    }

    @Test
    void scoreThought_isClampedToTen() {
        reply("{\"score\": 14}");

        assertThat(model.scoreThought(task, "exit 1", Thought.answer("t", "a"))).isEqualTo(10.0);
    }

    @Test
    void critique_readsScoreVerdictAndReflection() {
        reply("{\"score\":0.2,\"succeeded\":false,\"reflection\":\"wrong directory\"}");

        Critique critique = model.critique(task, "run_command make", Observation.failure("run_command", "no Makefile"));

        assertThat(critique.score()).isEqualTo(0.2);
        assertThat(critique.succeeded()).isFalse();
        assertThat(critique.reflection()).isEqualTo("wrong directory");
    }

    @Test
    void synthesizeHeuristic_unusableFindings_returnsEmpty() {
        reply("{\"usable\":false,\"heuristic\":\"\"}");

        assertThat(model.synthesizeHeuristic("kubectl", List.of(new Finding("t", "https://example.org", "s"))))
                .isEmpty();
    }

    @Test
    void synthesizeHeuristic_usable_returnsStrippedText() {
        reply("{\"usable\":true,\"heuristic\":\"  Install kubectl via the package manager \"}");

        assertThat(model.synthesizeHeuristic("kubectl", List.of()))
                .contains("Install kubectl via the package manager");
    }

    @Test
    void replyWithoutJson_throwsReasoningException() {
        reply("I cannot score this.");

        assertThatThrownBy(() -> model.scoreThought(task, null, Thought.answer("t", "a")))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("no JSON");
    }

    @Test
    void malformedJson_throwsReasoningException() {
        reply("{\"score\": }");

        assertThatThrownBy(() -> model.scoreThought(task, null, Thought.answer("t", "a")))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void apiError_becomesReasoningException() {
        when(claude.complete(eq("test-model"), anyString(), anyList()))
                .thenThrow(new ClaudeClient.ClaudeApiException(529, "overloaded"));

        assertThatThrownBy(() -> model.decompose("anything"))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("529");
    }
}
