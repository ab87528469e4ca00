package com.missionpilot.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * One line of a mission's goal checklist; mirrors one planned Task.
 */
@Embeddable
public class ChecklistItem {

    @Column(name = "task_number", nullable = false)
    private int taskNumber;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String item;

    @Column(nullable = false)
    private boolean done;

    protected ChecklistItem() {}   // required by JPA

    public ChecklistItem(int taskNumber, String item) {
        this.taskNumber = taskNumber;
        this.item       = item;
    }

    public int     getTaskNumber() { return taskNumber; }
    public String  getItem()       { return item; }
    public boolean isDone()        { return done; }

    void markDone() { this.done = true; }
}
