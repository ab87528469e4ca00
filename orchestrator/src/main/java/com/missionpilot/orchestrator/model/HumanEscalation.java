package com.missionpilot.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.time.Instant;
import java.util.UUID;

/**
 * A Task handed to the operator-facing channel.
 *
 * The history column holds the task's full reflexion history as JSON, so the
 * payload stays self-explanatory even after the mission is archived.
 *
 * DB table: human_escalations  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "human_escalations")
public class HumanEscalation implements Persistable<UUID> {

    @Id
    private UUID id;

    // Ids are assigned here, so Spring Data cannot infer newness from them.
    @Transient
    private boolean isNew = true;

    @Column(name = "mission_id", nullable = false, updatable = false)
    private UUID missionId;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    @Column(name = "task_number", nullable = false, updatable = false)
    private int taskNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EscalationReason reason;

    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private String detail;

    @Column(name = "history_json", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String historyJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EscalationStatus status = EscalationStatus.OPEN;

    @Column(columnDefinition = "TEXT")
    private String resolution;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    protected HumanEscalation() {}   // required by JPA

    public HumanEscalation(UUID missionId, UUID taskId, int taskNumber,
                           EscalationReason reason, String detail, String historyJson) {
        this.id          = UUID.randomUUID();
        this.missionId   = missionId;
        this.taskId      = taskId;
        this.taskNumber  = taskNumber;
        this.reason      = reason;
        this.detail      = detail;
        this.historyJson = historyJson;
    }

    public UUID             getId()          { return id; }
    public UUID             getMissionId()   { return missionId; }
    public UUID             getTaskId()      { return taskId; }
    public int              getTaskNumber()  { return taskNumber; }
    public EscalationReason getReason()      { return reason; }
    public String           getDetail()      { return detail; }
    public String           getHistoryJson() { return historyJson; }
    public EscalationStatus getStatus()      { return status; }
    public String           getResolution()  { return resolution; }
    public Instant          getCreatedAt()   { return createdAt; }
    public Instant          getResolvedAt()  { return resolvedAt; }

    public void close(EscalationStatus status, String resolution) {
        if (this.status != EscalationStatus.OPEN) {
            throw new IllegalStateException("Escalation " + id + " already " + this.status);
        }
        this.status     = status;
        this.resolution = resolution;
        this.resolvedAt = Instant.now();
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
