package com.missionpilot.orchestrator.api;

import com.missionpilot.orchestrator.model.ChecklistItem;
import com.missionpilot.orchestrator.model.GoalState;
import com.missionpilot.orchestrator.model.Mission;
import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.ReflexionRecord;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.model.TaskState;
import com.missionpilot.orchestrator.service.MissionControlAction;
import com.missionpilot.orchestrator.service.MissionProgress;
import com.missionpilot.orchestrator.service.MissionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for MissionController. Only the web layer is started;
 * MissionService is a mock.
 */
@WebMvcTest(MissionController.class)
class MissionControllerTest {

    @Autowired MockMvc            mockMvc;
    @MockitoBean MissionService   missionService;

    // ------------------------------------------------------------------
    // POST /missions
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_returns201WithRunningMission() throws Exception {
        Mission mission = runningMission("Build ./app and make its tests pass");
        when(missionService.submit("Build ./app and make its tests pass")).thenReturn(mission);

        mockMvc.perform(post("/missions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"primeDirective":"Build ./app and make its tests pass"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(mission.getId().toString()))
                .andExpect(jsonPath("$.state").value("RUNNING"))
                .andExpect(jsonPath("$.primeDirective").value("Build ./app and make its tests pass"));
    }

    @Test
    void submit_invalidPlan_returns201WithFailedMission() throws Exception {
        Mission mission = new Mission("do everything");
        mission.fail("Invalid plan: dependency cycle among tasks [1, 2]");
        when(missionService.submit(anyString())).thenReturn(mission);

        mockMvc.perform(post("/missions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"primeDirective":"do everything"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.state").value("FAILED"))
                .andExpect(jsonPath("$.failureReason").value("Invalid plan: dependency cycle among tasks [1, 2]"));
    }

    @Test
    void submit_blankDirective_returns400() throws Exception {
        when(missionService.submit(any())).thenThrow(new IllegalArgumentException("primeDirective must not be blank"));

        mockMvc.perform(post("/missions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"primeDirective":"   "}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /missions/{id}
    // ------------------------------------------------------------------

    @Test
    void getMission_existing_returns200() throws Exception {
        Mission mission = runningMission("ship it");
        when(missionService.find(mission.getId())).thenReturn(Optional.of(mission));

        mockMvc.perform(get("/missions/{id}", mission.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("RUNNING"));
    }

    @Test
    void getMission_unknown_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(missionService.find(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/missions/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void getTasks_unknownMission_returns404WithoutQueryingTasks() throws Exception {
        UUID id = UUID.randomUUID();
        when(missionService.find(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/missions/{id}/tasks", id))
                .andExpect(status().isNotFound());
        verify(missionService, never()).tasks(any());
    }

    // ------------------------------------------------------------------
    // GET /missions/{id}/goal
    // ------------------------------------------------------------------

    @Test
    void getGoal_returnsDirectiveAndChecklist() throws Exception {
        Mission mission = runningMission("ship it");
        GoalState goal = new GoalState(mission.getId(), "ship it",
                List.of(new ChecklistItem(1, "compile"), new ChecklistItem(2, "run tests")));
        goal.markDone(1);
        when(missionService.find(mission.getId())).thenReturn(Optional.of(mission));
        when(missionService.goal(eq(mission.getId()), any()))
                .thenAnswer(inv -> {
                    Function<GoalState, ?> view = inv.getArgument(1);
                    return Optional.of(view.apply(goal));
                });

        mockMvc.perform(get("/missions/{id}/goal", mission.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.primeDirective").value("ship it"))
                .andExpect(jsonPath("$.checklist.length()").value(2))
                .andExpect(jsonPath("$.checklist[0].done").value(true))
                .andExpect(jsonPath("$.checklist[1].item").value("run tests"))
                .andExpect(jsonPath("$.checklist[1].done").value(false));
    }

    @Test
    void getGoal_missionWithoutPlan_returns404() throws Exception {
        Mission mission = new Mission("nothing");
        mission.fail("Invalid plan: empty");
        when(missionService.find(mission.getId())).thenReturn(Optional.of(mission));
        when(missionService.goal(eq(mission.getId()), any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/missions/{id}/goal", mission.getId()))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /missions/{id}/tasks/{taskId}/reflections
    // ------------------------------------------------------------------

    @Test
    void getReflections_returnsRecordsInOrder() throws Exception {
        Mission mission = runningMission("ship it");
        UUID taskId = UUID.randomUUID();
        ReflexionRecord first = new ReflexionRecord(mission.getId(), taskId, RecordCategory.EVALUATION,
                "run_command make", "exit 2", 0.0, null, Instant.parse("2026-01-01T10:00:00Z"));
        ReflexionRecord second = new ReflexionRecord(mission.getId(), taskId, RecordCategory.CORRECTIVE,
                "run_command make", "exit 2", 0.0, "Missing header; install libfoo-dev first",
                Instant.parse("2026-01-01T10:00:05Z"));
        when(missionService.find(mission.getId())).thenReturn(Optional.of(mission));
        when(missionService.reflections(mission.getId(), taskId)).thenReturn(List.of(first, second));

        mockMvc.perform(get("/missions/{id}/tasks/{taskId}/reflections", mission.getId(), taskId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].category").value("EVALUATION"))
                .andExpect(jsonPath("$[1].category").value("CORRECTIVE"))
                .andExpect(jsonPath("$[1].reflectionText").value("Missing header; install libfoo-dev first"));
    }

    // ------------------------------------------------------------------
    // POST /missions/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_runningMission_returns202() throws Exception {
        Mission mission = runningMission("ship it");
        when(missionService.find(mission.getId())).thenReturn(Optional.of(mission));

        mockMvc.perform(post("/missions/{id}/cancel", mission.getId()))
                .andExpect(status().isAccepted());
        verify(missionService).cancel(mission.getId());
    }

    @Test
    void cancel_finishedMission_returns409() throws Exception {
        Mission mission = new Mission("done already");
        mission.start();
        mission.succeed();
        when(missionService.find(mission.getId())).thenReturn(Optional.of(mission));
        doThrow(new IllegalStateException("Mission is not running")).when(missionService).cancel(mission.getId());

        mockMvc.perform(post("/missions/{id}/cancel", mission.getId()))
                .andExpect(status().isConflict());
    }

    // ------------------------------------------------------------------
    // GET /missions/{id}/progress
    // ------------------------------------------------------------------

    @Test
    void getProgress_reportsPerTaskRoundsAndTiming() throws Exception {
        Mission mission = runningMission("deploy the app");
        Task setUp = new Task(mission.getId(), 1, "set up", Set.of(), Set.of(), TaskOrigin.PLANNED);
        setUp.unitStarted(Instant.parse("2026-01-01T10:00:00Z"));
        setUp.unitFinished(Instant.parse("2026-01-01T10:00:02.500Z"));
        setUp.setState(TaskState.SUCCEEDED);
        Task deploy = new Task(mission.getId(), 2, "deploy", Set.of(1), Set.of(), TaskOrigin.PLANNED);
        deploy.incrementAttempts();
        deploy.incrementAttempts();
        deploy.incrementRetryCount();
        deploy.setState(TaskState.BLOCKED_PENDING_RESEARCH);
        when(missionService.progress(mission.getId())).thenReturn(Optional.of(new MissionProgress(mission, true,
                List.of(new MissionProgress.TaskProgress(setUp, 0), new MissionProgress.TaskProgress(deploy, 1)))));

        mockMvc.perform(get("/missions/{id}/progress", mission.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(true))
                .andExpect(jsonPath("$.totalTasks").value(2))
                .andExpect(jsonPath("$.completion").value(0.5))
                .andExpect(jsonPath("$.tasksByState.SUCCEEDED").value(1))
                .andExpect(jsonPath("$.tasksByState.BLOCKED_PENDING_RESEARCH").value(1))
                .andExpect(jsonPath("$.tasks[0].busyMillis").value(2500))
                .andExpect(jsonPath("$.tasks[1].attempts").value(2))
                .andExpect(jsonPath("$.tasks[1].tier1Rounds").value(1))
                .andExpect(jsonPath("$.tasks[1].tier2Rounds").value(1))
                .andExpect(jsonPath("$.tasks[1].startedAt").doesNotExist());
    }

    @Test
    void getProgress_unknownMission_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(missionService.progress(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/missions/{id}/progress", id))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /missions/{id}/control
    // ------------------------------------------------------------------

    @Test
    void control_pause_returns202() throws Exception {
        Mission mission = runningMission("ship it");
        when(missionService.find(mission.getId())).thenReturn(Optional.of(mission));

        mockMvc.perform(post("/missions/{id}/control", mission.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"PAUSE\"}"))
                .andExpect(status().isAccepted());
        verify(missionService).control(mission.getId(), MissionControlAction.PAUSE);
    }

    @Test
    void control_withoutAction_returns400() throws Exception {
        mockMvc.perform(post("/missions/{id}/control", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verify(missionService, never()).control(any(), any());
    }

    @Test
    void control_finishedMission_returns409() throws Exception {
        Mission mission = new Mission("done already");
        mission.start();
        mission.succeed();
        when(missionService.find(mission.getId())).thenReturn(Optional.of(mission));
        doThrow(new IllegalStateException("Mission is not running"))
                .when(missionService).control(mission.getId(), MissionControlAction.RESUME);

        mockMvc.perform(post("/missions/{id}/control", mission.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"RESUME\"}"))
                .andExpect(status().isConflict());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Mission runningMission(String directive) {
        Mission mission = new Mission(directive);
        mission.start();
        return mission;
    }
}
