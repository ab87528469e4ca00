package com.missionpilot.orchestrator.model;

/**
 * Kind of entry in Episodic Memory.
 */
public enum RecordCategory {
    EVALUATION,     // outcome of one executed action
    CORRECTIVE,     // Tier 1 hypothesis + injected corrective task
    RESEARCH,       // Tier 2 heuristic committed to the knowledge base
    REQUEUED,       // Tier 2 task moved back to PENDING
    ESCALATION,     // task handed to the human boundary
    RESOLUTION      // operator answer delivered back to the task
}
