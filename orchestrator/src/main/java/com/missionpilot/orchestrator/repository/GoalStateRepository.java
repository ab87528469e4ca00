package com.missionpilot.orchestrator.repository;

import com.missionpilot.orchestrator.model.GoalState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/** Goal state rows are keyed by mission id. */
public interface GoalStateRepository extends JpaRepository<GoalState, UUID> {
}
