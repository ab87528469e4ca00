package com.missionpilot.orchestrator.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.missionpilot.orchestrator.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Knowledge base kept on disk, one JSON file per version:
 * <pre>
 *   {directory}/{name}/v000001.json
 *   {directory}/{name}/v000002.json   ← latest
 * </pre>
 * A write takes the document's lock, checks the expected version against the
 * newest file, writes a temp file and links it into place as the next version.
 * Linking fails when the target exists, so a version committed by another
 * process in the meantime is reported as a conflict and never replaced.
 * Existing version files are never touched.
 */
@Component
public class FileKnowledgeBaseStore implements KnowledgeBaseStore {

    private static final Logger log = LoggerFactory.getLogger(FileKnowledgeBaseStore.class);

    private static final Pattern VALID_NAME   = Pattern.compile("[a-z0-9][a-z0-9_\\-]*");
    private static final Pattern VERSION_FILE = Pattern.compile("v(\\d+)\\.json");

    private final Path         root;
    private final ObjectMapper json;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public FileKnowledgeBaseStore(OrchestratorProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getKnowledge().getDirectory()), objectMapper);
    }

    /** A store rooted at {@code root}, outside of any configuration. */
    public FileKnowledgeBaseStore(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.json = objectMapper;
    }

    @Override
    public KnowledgeBaseDocument read(String name) {
        Path dir = documentDir(name);
        OptionalLong latest = latestVersion(dir);
        if (latest.isEmpty()) {
            return KnowledgeBaseDocument.empty(name);
        }
        return load(versionFile(dir, latest.getAsLong()));
    }

    @Override
    public WriteOutcome write(String name, String newContent, long expectedVersion) {
        Path dir = documentDir(name);
        ReentrantLock lock = locks.computeIfAbsent(name, n -> new ReentrantLock());
        lock.lock();
        try {
            long current = latestVersion(dir).orElse(0);
            if (current != expectedVersion) {
                log.info("Version conflict on '{}': expected v{}, found v{}", name, expectedVersion, current);
                return WriteOutcome.versionConflict(current == 0
                        ? KnowledgeBaseDocument.empty(name)
                        : load(versionFile(dir, current)));
            }
            KnowledgeBaseDocument next =
                    new KnowledgeBaseDocument(name, current + 1, newContent, Instant.now());
            Path target = versionFile(dir, next.version());
            Files.createDirectories(dir);
            try {
                publish(dir, target, next);
            } catch (FileAlreadyExistsException e) {
                // written by another process since the directory listing
                log.info("Version conflict on '{}': v{} appeared concurrently", name, next.version());
                return WriteOutcome.versionConflict(load(target));
            }
            log.info("Knowledge base '{}' committed v{}", name, next.version());
            return WriteOutcome.ok(next);
        } catch (IOException e) {
            throw new KnowledgeBaseException("Failed to write '" + name + "'", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<KnowledgeBaseDocument> history(String name) {
        Path dir = documentDir(name);
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> VERSION_FILE.matcher(p.getFileName().toString()).matches())
                    .map(this::load)
                    .sorted(Comparator.comparingLong(KnowledgeBaseDocument::version))
                    .toList();
        } catch (IOException e) {
            throw new KnowledgeBaseException("Failed to list versions of '" + name + "'", e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Make {@code doc} visible as {@code target} without replacing anything.
     *
     * @throws FileAlreadyExistsException if {@code target} already exists
     */
    void publish(Path dir, Path target, KnowledgeBaseDocument doc) throws IOException {
        Path tmp = Files.createTempFile(dir, ".write-", ".tmp");
        try {
            json.writeValue(tmp.toFile(), doc);
            try {
                Files.createLink(target, tmp);
            } catch (UnsupportedOperationException e) {
                // no hard links on this file system
                Files.write(target, Files.readAllBytes(tmp), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Path documentDir(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid knowledge base document name: " + name);
        }
        return root.resolve(name);
    }

    private static Path versionFile(Path dir, long version) {
        return dir.resolve("v%06d.json".formatted(version));
    }

    private static OptionalLong latestVersion(Path dir) {
        if (!Files.isDirectory(dir)) return OptionalLong.empty();
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> VERSION_FILE.matcher(p.getFileName().toString()))
                    .filter(Matcher::matches)
                    .mapToLong(m -> Long.parseLong(m.group(1)))
                    .max();
        } catch (IOException e) {
            throw new KnowledgeBaseException("Failed to list " + dir, e);
        }
    }

    private KnowledgeBaseDocument load(Path file) {
        try {
            return json.readValue(file.toFile(), KnowledgeBaseDocument.class);
        } catch (IOException e) {
            throw new KnowledgeBaseException("Corrupt knowledge base version " + file, e);
        }
    }
}
