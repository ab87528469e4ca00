package com.missionpilot.orchestrator.service;

import com.missionpilot.orchestrator.agent.CancellationToken;
import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.protocol.ProtocolDecision;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Future;

/**
 * Runtime state of one RUNNING mission.
 *
 * {@code plan} and {@code inFlight} belong to the scheduler thread. Workers
 * only ever touch {@code inbox} and the token; operators only the inbox,
 * {@code cancelRequested} and {@code paused}.
 */
class MissionRun {

    final Mission           mission;
    final Plan              plan;
    final CancellationToken token = new CancellationToken();

    // Task id → the worker or research unit currently holding the task.
    final Map<UUID, Future<?>> inFlight = new HashMap<>();

    final Queue<ProtocolDecision> inbox = new ConcurrentLinkedQueue<>();

    // Task id → capability, for gaps found while paused.
    final Map<UUID, String> pendingResearch = new LinkedHashMap<>();

    volatile boolean cancelRequested;
    volatile boolean paused;

    // Last stall that was logged, so a waiting mission does not log every tick.
    int reportedBlocked = -1;

    MissionRun(Mission mission, Plan plan) {
        this.mission = mission;
        this.plan    = plan;
    }

    UUID missionId() {
        return mission.getId();
    }
}
