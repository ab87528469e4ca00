package com.missionpilot.orchestrator.repository;

import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.model.MissionState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the missions table.
 */
public interface MissionRepository extends JpaRepository<Mission, UUID> {

    /** Missions in a given state; RUNNING ones are resumed after a restart. */
    List<Mission> findByState(MissionState state);
}
