package com.missionpilot.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * One unit of work in a Mission's Plan.
 *
 * {@code number} is the plan-local id used for dependency edges and for the
 * deterministic lowest-id tie-break in the scheduler. {@code id} is the
 * global identifier exposed through the API and referenced by reflexion records.
 *
 * State is only mutated by the thread that owns the Plan (see PlanManager).
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task implements Persistable<UUID> {

    @Id
    private UUID id;

    // Ids are assigned here, so Spring Data cannot infer newness from them.
    @Transient
    private boolean isNew = true;

    @Column(name = "mission_id", nullable = false, updatable = false)
    private UUID missionId;

    @Column(nullable = false, updatable = false)
    private int number;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    // Edge A→B is stored on B as "B depends on A".
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_dependencies", joinColumns = @JoinColumn(name = "task_id"))
    @Column(name = "depends_on", nullable = false)
    private Set<Integer> dependencies = new TreeSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "task_tags", joinColumns = @JoinColumn(name = "task_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "tag", nullable = false)
    private Set<TaskTag> tags = new HashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskState state = TaskState.PENDING;

    // Tier 1 re-attempts only; Tier 2 requeues never touch it.
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "escalation_tier", nullable = false)
    private EscalationTier escalationTier = EscalationTier.NONE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TaskOrigin origin = TaskOrigin.PLANNED;

    @Column(columnDefinition = "TEXT")
    private String result;

    // Number of worker attempts (ReAct or ToT runs), informational.
    @Column(nullable = false)
    private int attempts = 0;

    // First time a worker or research unit picked the task up.
    @Column(name = "started_at")
    private Instant startedAt;

    // Wall-clock time spent in finished units.
    @Column(name = "busy_millis", nullable = false)
    private long busyMillis = 0;

    @Transient
    private Instant unitStartedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(UUID missionId, int number, String description,
                Set<Integer> dependencies, Set<TaskTag> tags, TaskOrigin origin) {
        this.id          = UUID.randomUUID();
        this.missionId   = missionId;
        this.number      = number;
        this.description = description;
        this.origin      = origin;
        if (dependencies != null) this.dependencies.addAll(dependencies);
        if (tags != null)         this.tags.addAll(tags);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()             { return id; }
    public UUID           getMissionId()      { return missionId; }
    public int            getNumber()         { return number; }
    public String         getDescription()    { return description; }
    public Set<Integer>   getDependencies()   { return Collections.unmodifiableSet(dependencies); }
    public Set<TaskTag>   getTags()           { return Collections.unmodifiableSet(tags); }
    public TaskState      getState()          { return state; }
    public int            getRetryCount()     { return retryCount; }
    public EscalationTier getEscalationTier() { return escalationTier; }
    public TaskOrigin     getOrigin()         { return origin; }
    public String         getResult()         { return result; }
    public int            getAttempts()       { return attempts; }
    public Instant        getStartedAt()      { return startedAt; }
    public long           getBusyMillis()     { return busyMillis; }
    public boolean        isUnitRunning()     { return unitStartedAt != null; }
    public Instant        getCreatedAt()      { return createdAt; }
    public Instant        getUpdatedAt()      { return updatedAt; }

    public void setState(TaskState state)                 { this.state = state; }
    public void setResult(String result)                   { this.result = result; }
    public void setEscalationTier(EscalationTier tier)     { this.escalationTier = tier; }
    public void incrementRetryCount()                      { this.retryCount++; }
    public void incrementAttempts()                        { this.attempts++; }

    /** A worker attempt or a research unit took the task. */
    public void unitStarted(Instant at) {
        if (startedAt == null) startedAt = at;
        unitStartedAt = at;
    }

    /** The running unit delivered its decision; no-op if none was running. */
    public void unitFinished(Instant at) {
        if (unitStartedAt == null) return;
        busyMillis += Math.max(0, Duration.between(unitStartedAt, at).toMillis());
        unitStartedAt = null;
    }

    /** Busy time including the unit still running at {@code now}. */
    public Duration busyTime(Instant now) {
        Duration busy = Duration.ofMillis(busyMillis);
        return unitStartedAt == null ? busy : busy.plus(Duration.between(unitStartedAt, now));
    }

    /** Edge insertion; only the PlanManager calls this. */
    public void addDependency(int prerequisiteNumber)      { this.dependencies.add(prerequisiteNumber); }

    public boolean isHighComplexity() {
        return !tags.isEmpty();
    }

    @Override
    public String toString() {
        return "Task#" + number + "[" + state + "]";
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostPersist
    @PostLoad
    void markPersisted() {
        this.isNew = false;
    }
}
