package com.missionpilot.orchestrator.api.dto;

import com.missionpilot.orchestrator.model.ChecklistItem;
import com.missionpilot.orchestrator.model.GoalState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Response body for GET /missions/{id}/goal. */
public record GoalResponse(
        UUID        missionId,
        String      primeDirective,
        List<Item>  checklist,
        Instant     updatedAt
) {
    public record Item(int taskNumber, String item, boolean done) {
        static Item from(ChecklistItem i) {
            return new Item(i.getTaskNumber(), i.getItem(), i.isDone());
        }
    }

    public static GoalResponse from(GoalState g) {
        return new GoalResponse(
                g.getMissionId(),
                g.getPrimeDirective(),
                g.getChecklist().stream().map(Item::from).toList(),
                g.getUpdatedAt()
        );
    }
}
