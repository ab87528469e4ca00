package com.missionpilot.orchestrator.protocol;

import com.missionpilot.orchestrator.agent.CancellationToken;
import com.missionpilot.orchestrator.capability.CapabilityRegistry;
import com.missionpilot.orchestrator.config.OrchestratorProperties;
import com.missionpilot.orchestrator.knowledge.KnowledgeBaseConflictException;
import com.missionpilot.orchestrator.knowledge.KnowledgeBaseDocument;
import com.missionpilot.orchestrator.knowledge.PersonaDiff;
import com.missionpilot.orchestrator.knowledge.PersonaEditor;
import com.missionpilot.orchestrator.memory.EpisodicMemory;
import com.missionpilot.orchestrator.model.EscalationReason;
import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.reasoning.ReasoningException;
import com.missionpilot.orchestrator.reasoning.ReasoningModel;
import com.missionpilot.orchestrator.research.Finding;
import com.missionpilot.orchestrator.research.ResearchCollaborator;
import com.missionpilot.orchestrator.research.ResearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tier 2: closing capability gaps by research.
 *
 * <pre>
 *   GAP_IDENTIFIED → META_TASK_ESCALATED → RESEARCHING → HEURISTIC_SYNTHESIZED
 *                  → KNOWLEDGE_BASE_UPDATED → REQUEUED
 * </pre>
 * {@link #research} is the research unit of work. It runs on the worker pool
 * while the task waits in BLOCKED_PENDING_RESEARCH, writes the heuristic into
 * the gap persona and answers REQUEUE, or BLOCK when research finds nothing
 * usable or the persona cannot be updated.
 *
 * <p>A gap can also be a registered tool whose confidence fell below the
 * minimum. Before requeueing, such a tool is re-verified through its check and
 * restored when the check passes, so the requeued task runs against the
 * updated registry instead of hitting the same gap again.
 */
@Component
public class MetaCognitionTier {

    private static final Logger log = LoggerFactory.getLogger(MetaCognitionTier.class);

    private final ResearchCollaborator research;
    private final CapabilityRegistry   registry;
    private final ReasoningModel       model;
    private final PersonaEditor        editor;
    private final EpisodicMemory       memory;
    private final ProtocolTransitions  transitions;
    private final String               gapPersona;

    public MetaCognitionTier(ResearchCollaborator research, CapabilityRegistry registry, ReasoningModel model,
                             PersonaEditor editor, EpisodicMemory memory, ProtocolTransitions transitions,
                             OrchestratorProperties properties) {
        this.research    = research;
        this.registry    = registry;
        this.model       = model;
        this.editor      = editor;
        this.memory      = memory;
        this.transitions = transitions;
        this.gapPersona  = properties.getKnowledge().getGapPersona();
    }

    public ProtocolDecision research(Task task, String capability, CancellationToken token) {
        String query = "how to " + capability + " " + task.getDescription();
        transitions.enter(task, ProtocolPhase.RESEARCHING, query);

        token.throwIfCancelled();
        List<Finding> findings;
        try {
            findings = research.research(query);
        } catch (ResearchException e) {
            log.warn("Research for {} failed: {}", task, e.getMessage());
            findings = List.of();
        }
        if (findings.isEmpty()) {
            return exhausted(task, query, "no findings for '" + capability + "'");
        }

        token.throwIfCancelled();
        String heuristic;
        try {
            heuristic = model.synthesizeHeuristic(capability, findings).orElse(null);
        } catch (ReasoningException e) {
            log.warn("Heuristic synthesis for {} failed: {}", task, e.getMessage());
            heuristic = null;
        }
        if (heuristic == null) {
            return exhausted(task, query, "no usable heuristic in " + findings.size() + " findings");
        }
        transitions.enter(task, ProtocolPhase.HEURISTIC_SYNTHESIZED, heuristic);

        String sources = findings.stream().map(f -> "- " + f.url()).collect(Collectors.joining("\n"));
        PersonaDiff diff = new PersonaDiff("Capability: " + capability, heuristic + "\n\nSources:\n" + sources);
        KnowledgeBaseDocument committed;
        try {
            committed = editor.apply(gapPersona, diff);
        } catch (KnowledgeBaseConflictException e) {
            transitions.enter(task, ProtocolPhase.KNOWLEDGE_BASE_CONFLICT, e.getMessage());
            return ProtocolDecision.block(task.getId(), EscalationReason.KNOWLEDGE_BASE_CONFLICT, e.getMessage());
        }
        transitions.enter(task, ProtocolPhase.KNOWLEDGE_BASE_UPDATED, committed.reference());

        String learned = "Learned how to " + capability + "; recorded in " + committed.reference();
        if (reverify(capability)) {
            learned += "; tool '" + capability + "' re-verified and restored";
        }
        memory.append(task, RecordCategory.RESEARCH, "research: " + query,
                findings.stream().map(Finding::toText).collect(Collectors.joining("\n")),
                1.0, learned);
        return ProtocolDecision.requeue(task.getId(), committed.reference());
    }

    /** Re-verify a registered tool that fell below the minimum confidence. */
    private boolean reverify(String capability) {
        if (registry.find(capability).isEmpty() || registry.isUsable(capability)) {
            return false;
        }
        if (!registry.verify(capability)) {
            log.warn("Capability '{}' is still unusable: its check failed", capability);
            return false;
        }
        registry.restore(capability);
        return true;
    }

    private ProtocolDecision exhausted(Task task, String query, String why) {
        memory.append(task, RecordCategory.RESEARCH, "research: " + query, why, 0.0,
                "Research did not produce a usable heuristic.");
        transitions.enter(task, ProtocolPhase.RESEARCH_EXHAUSTED, why);
        return ProtocolDecision.block(task.getId(), EscalationReason.RESEARCH_EXHAUSTED, why);
    }
}
