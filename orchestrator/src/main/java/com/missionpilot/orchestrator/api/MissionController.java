package com.missionpilot.orchestrator.api;

import com.missionpilot.orchestrator.api.dto.GoalResponse;
import com.missionpilot.orchestrator.api.dto.MissionControlRequest;
import com.missionpilot.orchestrator.api.dto.MissionProgressResponse;
import com.missionpilot.orchestrator.api.dto.MissionResponse;
import com.missionpilot.orchestrator.api.dto.ReflexionRecordResponse;
import com.missionpilot.orchestrator.api.dto.SubmitMissionRequest;
import com.missionpilot.orchestrator.api.dto.TaskResponse;
import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.service.MissionProgress;
import com.missionpilot.orchestrator.service.MissionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for mission lifecycle.
 *
 * POST /missions                                   submit a mission
 * GET  /missions/{id}                              poll mission state
 * GET  /missions/{id}/tasks                        the plan, lowest task number first
 * GET  /missions/{id}/goal                         prime directive and checklist
 * GET  /missions/{id}/tasks/{taskId}/reflections   a task's episodic memory
 * GET  /missions/{id}/progress                     per-task attempts, escalation rounds, timing
 * POST /missions/{id}/cancel                       cancel a running mission
 * POST /missions/{id}/control                      pause, resume or cancel a running mission
 */
@RestController
@RequestMapping("/missions")
public class MissionController {

    private final MissionService missionService;

    public MissionController(MissionService missionService) {
        this.missionService = missionService;
    }

    /**
     * Submit a new mission. The plan is built before the response is sent:
     * an invalid plan yields a FAILED mission with its reason, still 201.
     *
     * Example:
     *   curl -X POST http://localhost:8080/missions \
     *     -H "Content-Type: application/json" \
     *     -d '{"primeDirective":"Build the project in ./app and make its tests pass"}'
     */
    @PostMapping
    public ResponseEntity<MissionResponse> submit(@RequestBody SubmitMissionRequest req) {
        Mission mission;
        try {
            mission = missionService.submit(req.primeDirective());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(MissionResponse.from(mission));
    }

    @GetMapping("/{id}")
    public MissionResponse getMission(@PathVariable UUID id) {
        return MissionResponse.from(requireMission(id));
    }

    @GetMapping("/{id}/tasks")
    public List<TaskResponse> getTasks(@PathVariable UUID id) {
        requireMission(id);
        return missionService.tasks(id).stream()
                .map(TaskResponse::from)
                .toList();
    }

    /** Returns 404 for missions that failed before a plan existed. */
    @GetMapping("/{id}/goal")
    public GoalResponse getGoal(@PathVariable UUID id) {
        requireMission(id);
        return missionService.goal(id, GoalResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Mission " + id + " has no goal state"));
    }

    @GetMapping("/{id}/tasks/{taskId}/reflections")
    public List<ReflexionRecordResponse> getReflections(@PathVariable UUID id, @PathVariable UUID taskId) {
        requireMission(id);
        return missionService.reflections(id, taskId).stream()
                .map(ReflexionRecordResponse::from)
                .toList();
    }

    @GetMapping("/{id}/progress")
    public MissionProgressResponse getProgress(@PathVariable UUID id) {
        MissionProgress progress = missionService.progress(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Mission not found: " + id));
        return MissionProgressResponse.from(progress, Instant.now());
    }

    /**
     * Request cancellation. The mission becomes CANCELLED on the next
     * scheduler tick, hence 202.
     *
     * HTTP 409: the mission is already finished
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<MissionResponse> cancel(@PathVariable UUID id) {
        Mission mission = requireMission(id);
        try {
            missionService.cancel(id);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        return ResponseEntity.accepted().body(MissionResponse.from(mission));
    }

    /**
     * Pause, resume or cancel. Pausing stops new dispatches only; units in
     * flight run to completion. Applied on the next scheduler tick, hence 202.
     *
     * HTTP 400: no action given
     * HTTP 409: the mission is already finished
     */
    @PostMapping("/{id}/control")
    public ResponseEntity<MissionResponse> control(@PathVariable UUID id, @RequestBody MissionControlRequest req) {
        if (req.action() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "action is required (PAUSE, RESUME or CANCEL)");
        }
        Mission mission = requireMission(id);
        try {
            missionService.control(id, req.action());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
        return ResponseEntity.accepted().body(MissionResponse.from(mission));
    }

    private Mission requireMission(UUID id) {
        return missionService.find(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Mission not found: " + id));
    }
}
