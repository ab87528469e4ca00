package com.missionpilot.orchestrator.memory;

import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.ReflexionRecord;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.repository.ReflexionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only log of {@link ReflexionRecord}s, shared by every task.
 *
 * Records are written through to the database and kept in per-mission
 * in-memory logs. Appends to one mission's log are serialized on that log,
 * so a record is visible to every later {@link #history}/{@link #relevant}
 * call once {@link #append} returns. There is no update or delete.
 */
@Component
public class EpisodicMemory {

    private static final Logger log = LoggerFactory.getLogger(EpisodicMemory.class);

    /** Weight of recency relative to lexical overlap when ranking. */
    private static final double RECENCY_WEIGHT = 0.3;
    private static final double SAME_TASK_BONUS = 0.5;

    private final ReflexionRecordRepository repository;
    private final Map<UUID, List<ReflexionRecord>> byMission = new ConcurrentHashMap<>();
    private final AtomicLong appended = new AtomicLong();

    public EpisodicMemory(ReflexionRecordRepository repository) {
        this.repository = repository;
    }

    public ReflexionRecord append(ReflexionRecord record) {
        List<ReflexionRecord> missionLog = missionLog(record.getMissionId());
        synchronized (missionLog) {
            repository.save(record);
            missionLog.add(record);
        }
        appended.incrementAndGet();
        log.debug("Reflexion record {} for task {}: {}", record.getCategory(), record.getTaskId(),
                record.getReflectionText());
        return record;
    }

    /** Convenience for callers that have the task at hand. */
    public ReflexionRecord append(Task task, RecordCategory category, String action,
                                  String observation, double score, String reflection) {
        return append(new ReflexionRecord(task.getMissionId(), task.getId(), category,
                action, observation, score, reflection, Instant.now()));
    }

    /** Every record of one task, oldest first. */
    public List<ReflexionRecord> history(UUID missionId, UUID taskId) {
        List<ReflexionRecord> missionLog = missionLog(missionId);
        synchronized (missionLog) {
            return missionLog.stream().filter(r -> r.getTaskId().equals(taskId)).toList();
        }
    }

    public List<ReflexionRecord> history(Task task) {
        return history(task.getMissionId(), task.getId());
    }

    /** Every record of one mission, oldest first. */
    public List<ReflexionRecord> missionHistory(UUID missionId) {
        List<ReflexionRecord> missionLog = missionLog(missionId);
        synchronized (missionLog) {
            return List.copyOf(missionLog);
        }
    }

    public long count(Task task, RecordCategory category) {
        return history(task).stream().filter(r -> r.getCategory() == category).count();
    }

    /** Records appended since startup. Only ever grows. */
    public long count() {
        return appended.get();
    }

    /**
     * The {@code k} records of the task's mission most relevant to the task.
     *
     * Relevance is word overlap between the task description and the record's
     * action, observation and reflection, plus a recency term and a bonus for
     * the task's own records. Results are returned oldest first so they read
     * as a narrative.
     */
    public List<ReflexionRecord> relevant(Task task, int k) {
        if (k <= 0) return List.of();
        List<ReflexionRecord> candidates = missionHistory(task.getMissionId());
        if (candidates.size() <= k) return candidates;

        Set<String> query = tokens(task.getDescription());
        int n = candidates.size();
        List<Scored> scored = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ReflexionRecord r = candidates.get(i);
            double overlap = jaccard(query, tokens(r.getAction() + " " + r.getObservation()
                    + " " + r.getReflectionText()));
            double recency = (double) (i + 1) / n;
            double bonus   = r.getTaskId().equals(task.getId()) ? SAME_TASK_BONUS : 0.0;
            scored.add(new Scored(i, r, overlap + RECENCY_WEIGHT * recency + bonus));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed()
                .thenComparing(Comparator.comparingInt(Scored::position).reversed()));
        List<Scored> top = new ArrayList<>(scored.subList(0, k));
        top.sort(Comparator.comparingInt(Scored::position));
        return top.stream().map(Scored::record).toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private record Scored(int position, ReflexionRecord record, double score) {}

    private List<ReflexionRecord> missionLog(UUID missionId) {
        return byMission.computeIfAbsent(missionId, id ->
                Collections.synchronizedList(new ArrayList<>(repository.findByMissionIdOrderByIdAsc(id))));
    }

    private static Set<String> tokens(String text) {
        Set<String> out = new HashSet<>();
        if (text == null) return out;
        for (String w : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (w.length() > 2) out.add(w);
        }
        return out;
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        int common = 0;
        for (String w : a) {
            if (b.contains(w)) common++;
        }
        return (double) common / (a.size() + b.size() - common);
    }
}
