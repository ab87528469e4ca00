package com.missionpilot.orchestrator.repository;

import com.missionpilot.orchestrator.model.ReflexionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Append + read access to Episodic Memory.
 *
 * Only save() and the finder are used; records are never updated or deleted.
 */
public interface ReflexionRecordRepository extends JpaRepository<ReflexionRecord, Long> {

    /** Chronological history of one mission, across all of its tasks. */
    List<ReflexionRecord> findByMissionIdOrderByIdAsc(UUID missionId);
}
