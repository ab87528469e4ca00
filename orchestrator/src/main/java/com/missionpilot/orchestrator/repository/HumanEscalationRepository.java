package com.missionpilot.orchestrator.repository;

import com.missionpilot.orchestrator.model.EscalationStatus;
import com.missionpilot.orchestrator.model.HumanEscalation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + operator queries for the human_escalations table.
 */
public interface HumanEscalationRepository extends JpaRepository<HumanEscalation, UUID> {

    List<HumanEscalation> findByStatusOrderByCreatedAtAsc(EscalationStatus status);

    List<HumanEscalation> findByMissionIdOrderByCreatedAtAsc(UUID missionId);
}
