package com.missionpilot.orchestrator.repository;

import com.missionpilot.orchestrator.model.Task;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + plan queries for the tasks table.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    /** All tasks of one mission's plan, by plan-local number. */
    List<Task> findByMissionIdOrderByNumberAsc(UUID missionId);
}
