package com.missionpilot.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of Episodic Memory.
 *
 * Records are append-only: there are no setters, every column is
 * non-updatable and Hibernate treats the entity as immutable.
 *
 * DB table: reflexion_records  (created by Flyway V1 migration)
 */
@Entity
@Immutable
@Table(name = "reflexion_records")
public class ReflexionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mission_id", nullable = false, updatable = false)
    private UUID missionId;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private RecordCategory category;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String action;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String observation;

    @Column(name = "evaluation_score", nullable = false, updatable = false)
    private double evaluationScore;

    @Column(name = "reflection_text", columnDefinition = "TEXT", updatable = false)
    private String reflectionText;

    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    protected ReflexionRecord() {}   // required by JPA

    public ReflexionRecord(UUID missionId, UUID taskId, RecordCategory category,
                           String action, String observation,
                           double evaluationScore, String reflectionText, Instant timestamp) {
        this.missionId       = missionId;
        this.taskId          = taskId;
        this.category        = category;
        this.action          = action;
        this.observation     = observation;
        this.evaluationScore = evaluationScore;
        this.reflectionText  = reflectionText;
        this.timestamp       = timestamp;
    }

    public Long           getId()              { return id; }
    public UUID           getMissionId()       { return missionId; }
    public UUID           getTaskId()          { return taskId; }
    public RecordCategory getCategory()        { return category; }
    public String         getAction()          { return action; }
    public String         getObservation()     { return observation; }
    public double         getEvaluationScore() { return evaluationScore; }
    public String         getReflectionText()  { return reflectionText; }
    public Instant        getTimestamp()       { return timestamp; }
}
