package com.missionpilot.orchestrator.service;

import com.missionpilot.orchestrator.model.Task;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * The task DAG of one mission, keyed by plan-local task number.
 *
 * Not thread-safe. Exactly one thread (the mission scheduler) owns a plan;
 * every mutation goes through {@link PlanManager}.
 */
public class Plan {

    private final UUID                missionId;
    private final TreeMap<Integer, Task> tasks = new TreeMap<>();

    Plan(UUID missionId) {
        this.missionId = missionId;
    }

    public UUID missionId() {
        return missionId;
    }

    /** Tasks in number order. */
    public Collection<Task> tasks() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    public Optional<Task> task(int number) {
        return Optional.ofNullable(tasks.get(number));
    }

    public Optional<Task> task(UUID taskId) {
        return tasks.values().stream().filter(t -> t.getId().equals(taskId)).findFirst();
    }

    public int size() {
        return tasks.size();
    }

    int nextNumber() {
        return tasks.isEmpty() ? 1 : tasks.lastKey() + 1;
    }

    void put(Task task) {
        tasks.put(task.getNumber(), task);
    }

    void remove(int number) {
        tasks.remove(number);
    }

    Map<Integer, Task> byNumber() {
        return Collections.unmodifiableMap(tasks);
    }
}
