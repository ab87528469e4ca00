package com.missionpilot.orchestrator.claude;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.missionpilot.orchestrator.context.CognitiveContext;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskTag;
import com.missionpilot.orchestrator.reasoning.Critique;
import com.missionpilot.orchestrator.reasoning.PlanDraft;
import com.missionpilot.orchestrator.reasoning.ReasoningException;
import com.missionpilot.orchestrator.reasoning.ReasoningModel;
import com.missionpilot.orchestrator.reasoning.TaskDraft;
import com.missionpilot.orchestrator.reasoning.Thought;
import com.missionpilot.orchestrator.reasoning.ToolCall;
import com.missionpilot.orchestrator.research.Finding;
import com.missionpilot.orchestrator.tool.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ReasoningModel} backed by Claude. Each call is a single-turn request:
 * a role prompt from {@link SystemPrompts}, the curated context and the task,
 * answered with JSON.
 */
@Component
public class ClaudeReasoningModel implements ReasoningModel {

    private static final Logger log = LoggerFactory.getLogger(ClaudeReasoningModel.class);

    private static final TypeReference<Map<String, Object>> ARGS = new TypeReference<>() {};

    private final ClaudeClient claude;
    private final ObjectMapper json;
    private final String       model;

    public ClaudeReasoningModel(ClaudeClient claude, ObjectMapper objectMapper,
                                @Value("${anthropic.model}") String model) {
        this.claude = claude;
        this.json   = objectMapper;
        this.model  = model;
    }

    @Override
    public PlanDraft decompose(String primeDirective) {
        JsonNode root = ask(SystemPrompts.PLANNER, "PRIME DIRECTIVE:\n" + primeDirective);
        List<TaskDraft> tasks = new ArrayList<>();
        for (JsonNode t : root.path("tasks")) {
            List<Integer> deps = new ArrayList<>();
            for (JsonNode d : t.path("dependsOn")) deps.add(d.asInt());
            Set<TaskTag> tags = EnumSet.noneOf(TaskTag.class);
            for (JsonNode tag : t.path("tags")) {
                parseTag(tag.asText()).ifPresent(tags::add);
            }
            tasks.add(new TaskDraft(t.path("id").asInt(), t.path("description").asText(), deps, tags));
        }
        return new PlanDraft(tasks);
    }

    @Override
    public Thought think(Task task, CognitiveContext context, List<String> transcript) {
        StringBuilder user = new StringBuilder(context.render())
                .append("\n== TASK ").append(task.getNumber()).append(" ==\n")
                .append(task.getDescription()).append('\n');
        if (!transcript.isEmpty()) {
            user.append("\n== STEPS SO FAR ==\n");
            transcript.forEach(s -> user.append(s).append("\n\n"));
        }
        String reply = send(SystemPrompts.REACT, user.toString());
        Optional<String> body = ResponseParser.extractJson(reply);
        if (body.isEmpty()) {
            return ResponseParser.extractResult(reply)
                    .map(r -> Thought.answer(reply, r))
                    .orElseGet(() -> new Thought(reply.strip(), null, false, null));
        }
        return toThought(parse(body.get()));
    }

    @Override
    public List<Thought> propose(Task task, CognitiveContext context, String failureContext,
                                 List<Thought> path, int count) {
        StringBuilder user = new StringBuilder(context.render())
                .append("\n== TASK ").append(task.getNumber()).append(" ==\n")
                .append(task.getDescription()).append("\n\n== FAILURE CONTEXT ==\n")
                .append(failureContext == null ? "(none: task needs a deliberate choice)" : failureContext);
        if (!path.isEmpty()) {
            user.append("\n\n== PATH SO FAR ==\n");
            path.forEach(t -> user.append("- ").append(t.describe()).append('\n'));
        }
        JsonNode root = ask(SystemPrompts.TOT_PROPOSER.replace("{{COUNT}}", String.valueOf(count)),
                user.toString());
        List<Thought> out = new ArrayList<>();
        for (JsonNode c : root.path("candidates")) {
            if (out.size() == count) break;
            out.add(toThought(c));
        }
        return out;
    }

    @Override
    public double scoreThought(Task task, String failureContext, Thought candidate) {
        JsonNode root = ask(SystemPrompts.TOT_SCORER,
                "TASK: " + task.getDescription()
                + "\nFAILURE CONTEXT: " + (failureContext == null ? "(none)" : failureContext)
                + "\nCANDIDATE: " + candidate.describe());
        double score = root.path("score").asDouble(0.0);
        return Math.max(0.0, Math.min(10.0, score));
    }

    @Override
    public Critique critique(Task task, String action, Observation observation) {
        JsonNode root = ask(SystemPrompts.CRITIC,
                "TASK: " + task.getDescription()
                + "\nACTION: " + action
                + "\nOBSERVATION:\n" + observation.toText());
        return new Critique(root.path("score").asDouble(0.0),
                root.path("succeeded").asBoolean(false),
                root.path("reflection").asText(""));
    }

    @Override
    public Optional<String> synthesizeHeuristic(String capabilityGap, List<Finding> findings) {
        StringBuilder user = new StringBuilder("MISSING CAPABILITY: ").append(capabilityGap)
                .append("\n\nFINDINGS:\n");
        findings.forEach(f -> user.append(f.toText()).append('\n'));
        JsonNode root = ask(SystemPrompts.RESEARCHER, user.toString());
        String heuristic = root.path("heuristic").asText("").strip();
        if (!root.path("usable").asBoolean(false) || heuristic.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(heuristic);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JsonNode ask(String system, String user) {
        String reply = send(system, user);
        String body = ResponseParser.extractJson(reply)
                .orElseThrow(() -> new ReasoningException("Reply contained no JSON: " + abbreviate(reply)));
        return parse(body);
    }

    private String send(String system, String user) {
        try {
            return claude.complete(model, system, List.of(ClaudeClient.Message.user(user)));
        } catch (ClaudeClient.ClaudeApiException e) {
            throw new ReasoningException(e.getMessage(), e);
        }
    }

    private JsonNode parse(String body) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ReasoningException("Malformed JSON reply: " + abbreviate(body), e);
        }
    }

    private Thought toThought(JsonNode node) {
        String text = node.path("thought").asText("");
        JsonNode answer = node.get("finalAnswer");
        JsonNode action = node.get("action");
        if (action != null && action.hasNonNull("tool")) {
            Map<String, Object> args = action.has("args")
                    ? json.convertValue(action.get("args"), ARGS)
                    : Map.of();
            return Thought.act(text, new ToolCall(action.get("tool").asText(), args),
                    node.path("completesTask").asBoolean(false));
        }
        if (answer != null && !answer.isNull()) {
            return Thought.answer(text, answer.asText());
        }
        return new Thought(text, null, false, null);
    }

    private static Optional<TaskTag> parseTag(String raw) {
        try {
            return Optional.of(TaskTag.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown task tag '{}'", raw);
            return Optional.empty();
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
