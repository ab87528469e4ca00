package com.missionpilot.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.time.Instant;
import java.util.UUID;

/**
 * One top-level objective submitted by an operator.
 *
 * A Mission owns exactly one Plan (its Tasks). Apart from the terminal
 * status fields the row never changes after creation.
 *
 * DB table: missions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "missions")
public class Mission implements Persistable<UUID> {

    @Id
    private UUID id;

    // Ids are assigned here, so Spring Data cannot infer newness from them.
    @Transient
    private boolean isNew = true;

    @Column(name = "prime_directive", nullable = false, columnDefinition = "TEXT")
    private String primeDirective;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MissionState state = MissionState.PLANNING;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Mission() {}   // required by JPA

    public Mission(String primeDirective) {
        this.id             = UUID.randomUUID();
        this.primeDirective = primeDirective;
    }

    // ------------------------------------------------------------------
    // Getters / state transitions
    // ------------------------------------------------------------------

    public UUID         getId()             { return id; }
    public String       getPrimeDirective() { return primeDirective; }
    public MissionState getState()          { return state; }
    public String       getFailureReason()  { return failureReason; }
    public Instant      getCreatedAt()      { return createdAt; }
    public Instant      getFinishedAt()     { return finishedAt; }

    public void start() {
        requireState(MissionState.PLANNING);
        this.state = MissionState.RUNNING;
    }

    public void succeed() {
        finish(MissionState.SUCCEEDED, null);
    }

    public void fail(String reason) {
        finish(MissionState.FAILED, reason);
    }

    public void cancel() {
        finish(MissionState.CANCELLED, null);
    }

    private void finish(MissionState terminal, String reason) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Mission " + id + " already " + state);
        }
        this.state         = terminal;
        this.failureReason = reason;
        this.finishedAt    = Instant.now();
    }

    private void requireState(MissionState expected) {
        if (state != expected) {
            throw new IllegalStateException(
                    "Mission " + id + " is " + state + ", expected " + expected);
        }
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
