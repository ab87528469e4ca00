package com.missionpilot.orchestrator.memory;

import com.missionpilot.orchestrator.model.RecordCategory;
import com.missionpilot.orchestrator.model.ReflexionRecord;
import com.missionpilot.orchestrator.model.Task;
import com.missionpilot.orchestrator.model.TaskOrigin;
import com.missionpilot.orchestrator.repository.ReflexionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EpisodicMemoryTest {

    @Mock ReflexionRecordRepository repository;

    EpisodicMemory memory;
    UUID missionId;
    Task task;
    Task other;

    @BeforeEach
    void setUp() {
        memory    = new EpisodicMemory(repository);
        missionId = UUID.randomUUID();
        task  = new Task(missionId, 1, "compile the parser module", Set.of(), Set.of(), TaskOrigin.PLANNED);
        other = new Task(missionId, 2, "deploy the frontend", Set.of(), Set.of(), TaskOrigin.PLANNED);
    }

    @Test
    void appendedRecord_isImmediatelyVisibleAndWrittenThrough() {
        ReflexionRecord r = memory.append(task, RecordCategory.EVALUATION, "run_command {command=make}",
                "exit_code: 2", 0.0, "make failed");

        assertThat(memory.history(task)).containsExactly(r);
        assertThat(memory.history(other)).isEmpty();
        assertThat(memory.count()).isEqualTo(1);
        verify(repository).save(r);
    }

    @Test
    void firstAccess_loadsPersistedRecordsOnce() {
        ReflexionRecord persisted = new ReflexionRecord(missionId, task.getId(), RecordCategory.EVALUATION,
                "read_file", "stdout", 1.0, "ok", Instant.now());
        when(repository.findByMissionIdOrderByIdAsc(missionId)).thenReturn(List.of(persisted));

        memory.append(task, RecordCategory.CORRECTIVE, "spawn", "", 0.0, "corrective task spawned");

        assertThat(memory.history(task)).hasSize(2).first().isSameAs(persisted);
        assertThat(memory.missionHistory(missionId)).hasSize(2);
        verify(repository, times(1)).findByMissionIdOrderByIdAsc(missionId);
    }

    @Test
    void countByCategory_onlyCountsTheTasksOwnRecords() {
        memory.append(task,  RecordCategory.REQUEUED, "", "", 0.0, "requeued after research");
        memory.append(task,  RecordCategory.EVALUATION, "", "", 0.0, "failed");
        memory.append(other, RecordCategory.REQUEUED, "", "", 0.0, "requeued after research");

        assertThat(memory.count(task, RecordCategory.REQUEUED)).isEqualTo(1);
        assertThat(memory.count(task, RecordCategory.CORRECTIVE)).isZero();
    }

    @Test
    void relevant_prefersOwnAndRecentRecordsAndReturnsThemOldestFirst() {
        ReflexionRecord own = memory.append(task, RecordCategory.EVALUATION, "run_command", "exit 1", 0.0,
                "missing header");
        for (int i = 0; i < 4; i++) {
            memory.append(other, RecordCategory.EVALUATION, "write_file", "ok", 1.0, "step " + i);
        }
        ReflexionRecord latest = memory.append(other, RecordCategory.EVALUATION, "write_file", "ok", 1.0,
                "final step");

        assertThat(memory.relevant(task, 2)).containsExactly(own, latest);
    }

    @Test
    void relevant_ranksLexicalOverlapAboveRecency() {
        ReflexionRecord onTopic = memory.append(other, RecordCategory.EVALUATION, "run_command",
                "parser module failed to compile", 0.0, "compile the parser with -Werror off");
        for (int i = 0; i < 3; i++) {
            memory.append(other, RecordCategory.EVALUATION, "write_file", "ok", 1.0, "step " + i);
        }

        assertThat(memory.relevant(task, 1)).containsExactly(onTopic);
    }

    @Test
    void relevant_withFewRecordsReturnsAllAndZeroKReturnsNone() {
        ReflexionRecord r = memory.append(other, RecordCategory.EVALUATION, "", "", 1.0, "done");

        assertThat(memory.relevant(task, 5)).containsExactly(r);
        assertThat(memory.relevant(task, 0)).isEmpty();
    }
}
