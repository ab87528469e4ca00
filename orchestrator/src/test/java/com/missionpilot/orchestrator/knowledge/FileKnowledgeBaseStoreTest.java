package com.missionpilot.orchestrator.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileKnowledgeBaseStoreTest {

    @TempDir Path dir;

    FileKnowledgeBaseStore store;

    @BeforeEach
    void setUp() {
        store = new FileKnowledgeBaseStore(dir, new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    @Test
    void read_missingDocument_isEmptyVersionZero() {
        KnowledgeBaseDocument doc = store.read("operator");

        assertThat(doc.exists()).isFalse();
        assertThat(doc.version()).isZero();
        assertThat(doc.content()).isEmpty();
    }

    @Test
    void write_expectedVersionMatches_commitsNextVersion() {
        WriteOutcome first  = store.write("operator", "v1 content", 0);
        WriteOutcome second = store.write("operator", "v2 content", 1);

        assertThat(first.committed()).isTrue();
        assertThat(second.committed()).isTrue();
        assertThat(second.document().version()).isEqualTo(2);
        assertThat(store.read("operator").content()).isEqualTo("v2 content");
    }

    @Test
    void write_staleVersion_conflictsAndReturnsLatest() {
        store.write("operator", "v1", 0);

        WriteOutcome stale = store.write("operator", "lost update", 0);

        assertThat(stale.committed()).isFalse();
        assertThat(stale.document().version()).isEqualTo(1);
        assertThat(stale.document().content()).isEqualTo("v1");
        assertThat(store.read("operator").content()).isEqualTo("v1");
    }

    @Test
    void history_keepsEveryVersionOldestFirst() throws Exception {
        store.write("operator", "a", 0);
        store.write("operator", "b", 1);
        store.write("operator", "c", 2);

        assertThat(store.history("operator")).extracting(KnowledgeBaseDocument::content)
                .containsExactly("a", "b", "c");
        try (Stream<Path> files = Files.list(dir.resolve("operator"))) {
            assertThat(files.map(p -> p.getFileName().toString()).sorted())
                    .containsExactly("v000001.json", "v000002.json", "v000003.json");
        }
    }

    @Test
    void versionCommittedByAnotherProcessMeanwhile_isNeverReplaced() {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        FileKnowledgeBaseStore otherProcess = new FileKnowledgeBaseStore(dir, mapper);
        FileKnowledgeBaseStore racing = new FileKnowledgeBaseStore(dir, mapper) {
            @Override
            void publish(Path documentDir, Path target, KnowledgeBaseDocument doc) throws IOException {
                // lands between this store's version check and its commit
                otherProcess.write("operator", "from the other process", 1);
                super.publish(documentDir, target, doc);
            }
        };
        store.write("operator", "base", 0);

        WriteOutcome outcome = racing.write("operator", "mine", 1);

        assertThat(outcome.committed()).isFalse();
        assertThat(outcome.document().version()).isEqualTo(2);
        assertThat(outcome.document().content()).isEqualTo("from the other process");
        assertThat(store.read("operator").content()).isEqualTo("from the other process");
        assertThat(store.history("operator")).hasSize(2);
    }

    @Test
    void invalidName_isRejected() {
        assertThatThrownBy(() -> store.read("../etc"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentWritersWithSameExpectedVersion_exactlyOneCommits() throws Exception {
        store.write("operator", "base", 0);
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<WriteOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String content = "writer " + i;
                Callable<WriteOutcome> write = () -> {
                    start.await();
                    return store.write("operator", content, 1);
                };
                futures.add(pool.submit(write));
            }
            start.countDown();

            int committed = 0;
            for (Future<WriteOutcome> f : futures) {
                if (f.get().committed()) committed++;
            }
            assertThat(committed).isEqualTo(1);
            assertThat(store.read("operator").version()).isEqualTo(2);
            assertThat(store.history("operator")).hasSize(2);
        } finally {
            pool.shutdownNow();
        }
    }
}
