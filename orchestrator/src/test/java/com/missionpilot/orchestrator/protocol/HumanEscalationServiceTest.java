package com.missionpilot.orchestrator.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.missionpilot.orchestrator.memory.EpisodicMemory;
import com.missionpilot.orchestrator.model.EscalationReason;
import com.missionpilot.orchestrator.model.EscalationStatus;
import com.missionpilot.orchestrator.model.HumanEscalation;
import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.repository.HumanEscalationRepository;
import com.missionpilot.orchestrator.repository.ReflexionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HumanEscalationServiceTest {

    @Mock HumanEscalationRepository repository;
    @Mock ReflexionRecordRepository recordRepo;

    ObjectMapper           json = new ObjectMapper();
    EpisodicMemory         memory;
    HumanEscalationService service;
    Task                   task;

    @BeforeEach
    void setUp() {
        memory  = new EpisodicMemory(recordRepo);
        service = new HumanEscalationService(repository, memory, json);
        task    = new Task(UUID.randomUUID(), 2, "run app.py", Set.of(), Set.of(), TaskOrigin.PLANNED);
    }

    @Test
    void raise_carriesTheTasksFullHistoryAsJson() throws Exception {
        memory.append(task, RecordCategory.EVALUATION, "run_command {command=python app.py}",
                "exit 1", 0.0, "flask missing");
        memory.append(task, RecordCategory.CORRECTIVE, "inject task #3", "No module named 'flask'",
                0.0, "flask is not installed");

        HumanEscalation e = service.raise(task, EscalationReason.CIRCUIT_BREAKER_TRIPPED, "retry budget exhausted");

        verify(repository).save(e);
        assertThat(e.getStatus()).isEqualTo(EscalationStatus.OPEN);
        assertThat(e.getTaskNumber()).isEqualTo(2);
        JsonNode history = json.readTree(e.getHistoryJson());
        assertThat(history.size()).isEqualTo(2);
        assertThat(history.get(0).get("category").asText()).isEqualTo("EVALUATION");
        assertThat(history.get(1).get("reflection").asText()).isEqualTo("flask is not installed");
        assertThat(service.find(e.getId())).containsSame(e);
    }

    @Test
    void close_resolvesOnceAndRejectsASecondClose() {
        HumanEscalation e = service.raise(task, EscalationReason.UNAUTHORIZED, "sudo denied");

        service.close(e, ResolutionAction.SUCCEED, "ran it myself");

        assertThat(e.getStatus()).isEqualTo(EscalationStatus.RESOLVED);
        assertThat(e.getResolution()).isEqualTo("ran it myself");
        assertThat(e.getResolvedAt()).isNotNull();
        assertThatThrownBy(() -> service.close(e, ResolutionAction.CANCEL, "again"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancelOpen_closesOnlyTheMissionsOpenEscalations() {
        HumanEscalation open   = service.raise(task, EscalationReason.REASONING_EXHAUSTED, "stuck");
        HumanEscalation closed = service.raise(task, EscalationReason.UNAUTHORIZED, "denied");
        service.close(closed, ResolutionAction.CANCEL, "not needed");
        Task elsewhere = new Task(UUID.randomUUID(), 1, "other mission", Set.of(), Set.of(), TaskOrigin.PLANNED);
        HumanEscalation unrelated = service.raise(elsewhere, EscalationReason.REASONING_EXHAUSTED, "stuck");
        when(repository.findByMissionIdOrderByCreatedAtAsc(task.getMissionId())).thenReturn(List.of(open, closed));

        service.cancelOpen(task.getMissionId(), "Mission CANCELLED");

        assertThat(open.getStatus()).isEqualTo(EscalationStatus.CANCELLED);
        assertThat(open.getResolution()).isEqualTo("Mission CANCELLED");
        assertThat(closed.getResolution()).isEqualTo("not needed");
        assertThat(unrelated.getStatus()).isEqualTo(EscalationStatus.OPEN);
    }

    @Test
    void operatorCloseRacingMissionEnd_closesExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                HumanEscalation e = service.raise(task, EscalationReason.REASONING_EXHAUSTED, "stuck");
                CountDownLatch start = new CountDownLatch(1);
                Future<Boolean> operator = pool.submit(() -> {
                    start.await();
                    try {
                        service.close(e, ResolutionAction.SUCCEED, "fixed by hand");
                        return true;
                    } catch (IllegalStateException alreadyClosed) {
                        return false;
                    }
                });
                Future<?> missionEnd = pool.submit(() -> {
                    start.await();
                    service.cancelOpen(task.getMissionId(), "Mission CANCELLED");
                    return null;
                });
                start.countDown();
                missionEnd.get();

                if (operator.get()) {
                    assertThat(e.getStatus()).isEqualTo(EscalationStatus.RESOLVED);
                    assertThat(e.getResolution()).isEqualTo("fixed by hand");
                } else {
                    assertThat(e.getStatus()).isEqualTo(EscalationStatus.CANCELLED);
                    assertThat(e.getResolution()).isEqualTo("Mission CANCELLED");
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
