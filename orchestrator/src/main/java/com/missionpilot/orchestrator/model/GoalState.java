package com.missionpilot.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * The live goal of a Mission: its prime directive plus an ordered checklist.
 *
 * Recited at the start of every cognitive-loop iteration so the prime
 * directive is present in every context handed to the reasoning model.
 *
 * DB tables: goal_states, goal_checklist_items  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "goal_states")
public class GoalState implements Persistable<UUID> {

    @Id
    @Column(name = "mission_id")
    private UUID missionId;

    // Ids are assigned here, so Spring Data cannot infer newness from them.
    @Transient
    private boolean isNew = true;

    @Column(name = "prime_directive", nullable = false, columnDefinition = "TEXT")
    private String primeDirective;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "goal_checklist_items", joinColumns = @JoinColumn(name = "mission_id"))
    @OrderColumn(name = "position")
    private List<ChecklistItem> checklist = new ArrayList<>();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected GoalState() {}   // required by JPA

    public GoalState(UUID missionId, String primeDirective, List<ChecklistItem> checklist) {
        this.missionId      = missionId;
        this.primeDirective = primeDirective;
        this.checklist.addAll(checklist);
    }

    @Override
    public UUID                getId()             { return missionId; }
    public UUID                getMissionId()      { return missionId; }
    public String              getPrimeDirective() { return primeDirective; }
    public List<ChecklistItem> getChecklist()      { return Collections.unmodifiableList(checklist); }
    public Instant             getUpdatedAt()      { return updatedAt; }

    /**
     * Mark the checklist item for the given task number done.
     *
     * @return true if an open item was found and closed
     */
    public boolean markDone(int taskNumber) {
        for (ChecklistItem item : checklist) {
            if (item.getTaskNumber() == taskNumber && !item.isDone()) {
                item.markDone();
                updatedAt = Instant.now();
                return true;
            }
        }
        return false;
    }

    public long openItems() {
        return checklist.stream().filter(i -> !i.isDone()).count();
    }

    /** Render the goal for inclusion at the top of a reasoning context. */
    public String recitation() {
        StringBuilder sb = new StringBuilder();
        sb.append("PRIME DIRECTIVE: ").append(primeDirective).append('\n');
        sb.append("CHECKLIST:\n");
        for (ChecklistItem item : checklist) {
            sb.append(item.isDone() ? "  [x] " : "  [ ] ")
              .append(item.getTaskNumber()).append(". ")
              .append(item.getItem()).append('\n');
        }
        return sb.toString();
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
