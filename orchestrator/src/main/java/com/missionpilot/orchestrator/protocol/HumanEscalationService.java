package com.missionpilot.orchestrator.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.missionpilot.orchestrator.memory.EpisodicMemory;
import com.missionpilot.orchestrator.model.EscalationReason;
import com.missionpilot.orchestrator.model.EscalationStatus;
import com.missionpilot.orchestrator.model.HumanEscalation;
import com.missionpilot.orchestrator.model.ReflexionRecord;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.repository.HumanEscalationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The operator-facing boundary.
 *
 * A blocked task produces one {@link HumanEscalation} carrying the reason and
 * the task's full reflexion history. The escalation stays OPEN until an
 * operator resolves it, or its mission ends.
 *
 * <p>Operators close escalations on HTTP threads while the scheduler cancels
 * the open ones of a finished mission. Both go through one lock, so an
 * escalation is closed exactly once and the loser of the race sees it closed.
 */
@Service
public class HumanEscalationService {

    private static final Logger log = LoggerFactory.getLogger(HumanEscalationService.class);

    private final HumanEscalationRepository repository;
    private final EpisodicMemory            memory;
    private final ObjectMapper              json;
    private final Map<UUID, HumanEscalation> recent = new ConcurrentHashMap<>();
    private final Object closing = new Object();

    public HumanEscalationService(HumanEscalationRepository repository,
                                  EpisodicMemory memory,
                                  ObjectMapper objectMapper) {
        this.repository = repository;
        this.memory     = memory;
        this.json       = objectMapper;
    }

    public HumanEscalation raise(Task task, EscalationReason reason, String detail) {
        List<ReflexionRecord> history = memory.history(task);
        HumanEscalation escalation = new HumanEscalation(task.getMissionId(), task.getId(), task.getNumber(),
                reason, detail == null ? "" : detail, toJson(history));
        repository.save(escalation);
        recent.put(escalation.getId(), escalation);
        log.error("HUMAN ESCALATION {}: mission={} task={} reason={} detail={} ({} history records)",
                escalation.getId(), task.getMissionId(), task, reason, detail, history.size());
        return escalation;
    }

    public Optional<HumanEscalation> find(UUID escalationId) {
        HumanEscalation cached = recent.get(escalationId);
        return cached != null ? Optional.of(cached) : repository.findById(escalationId);
    }

    public List<HumanEscalation> list(EscalationStatus status) {
        return repository.findByStatusOrderByCreatedAtAsc(status);
    }

    /**
     * Close an OPEN escalation.
     *
     * @throws IllegalStateException if it is not OPEN
     */
    public HumanEscalation close(HumanEscalation escalation, ResolutionAction action, String resolution) {
        synchronized (closing) {
            escalation.close(action == ResolutionAction.SUCCEED ? EscalationStatus.RESOLVED : EscalationStatus.CANCELLED,
                    resolution);
            repository.save(escalation);
        }
        log.info("Escalation {} closed by operator: {} ({})", escalation.getId(), action, resolution);
        return escalation;
    }

    /** Cancel every OPEN escalation of a finished mission. */
    public void cancelOpen(UUID missionId, String why) {
        synchronized (closing) {
            for (HumanEscalation e : repository.findByMissionIdOrderByCreatedAtAsc(missionId)) {
                closeIfOpen(e, why);
            }
            recent.values().stream()
                    .filter(e -> e.getMissionId().equals(missionId))
                    .forEach(e -> closeIfOpen(e, why));
            recent.values().removeIf(e -> e.getMissionId().equals(missionId));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void closeIfOpen(HumanEscalation e, String why) {
        if (e.getStatus() == EscalationStatus.OPEN) {
            e.close(EscalationStatus.CANCELLED, why);
            repository.save(e);
        }
    }

    private String toJson(List<ReflexionRecord> history) {
        List<Map<String, Object>> rows = history.stream().map(r -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("category",    r.getCategory());
            row.put("action",      r.getAction());
            row.put("observation", r.getObservation());
            row.put("score",       r.getEvaluationScore());
            row.put("reflection",  r.getReflectionText());
            row.put("timestamp",   String.valueOf(r.getTimestamp()));
            return row;
        }).toList();
        try {
            return json.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize reflexion history", e);
        }
    }
}
