package com.rewind.core.manager;

import com.rewind.core.TestClock;
import com.rewind.core.config.RewindProperties;
import com.rewind.core.content.ContentStore;
import com.rewind.core.exception.CheckpointNotFoundException;
import com.rewind.core.exception.InvalidLineageException;
import com.rewind.core.exception.ManagerConflictException;
import com.rewind.core.metrics.RewindMetrics;
import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.CheckpointResult;
import com.rewind.core.persistence.CheckpointStorage;
import com.rewind.core.persistence.FileSystemCheckpointStore;
import com.rewind.core.scanner.ProjectScanner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointManagerRegistryTest {

    @TempDir
    Path tempDir;

    private Path project;
    private CheckpointManagerRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        project = Files.createDirectories(tempDir.resolve("project"));
        var properties = new RewindProperties();
        var metrics = new RewindMetrics(new SimpleMeterRegistry());
        var clock = new TestClock();
        var store = new FileSystemCheckpointStore(tempDir.resolve("store"));
        var storage = new CheckpointStorage(store, new ContentStore(store), metrics, clock);
        registry = new CheckpointManagerRegistry(storage, new ProjectScanner(properties), properties, metrics, clock);
    }

    @Test
    @DisplayName("getOrCreateManager returns the same manager for the same session")
    void idempotent() {
        CheckpointManager first = registry.getOrCreateManager("s1", "proj", project);
        CheckpointManager second = registry.getOrCreateManager("s1", "proj", project.resolve(".").resolve("sub/.."));

        assertSame(first, second);
        assertEquals(1, registry.activeCount());
    }

    @Test
    @DisplayName("binding a session to another project or path is a conflict")
    void conflict() throws IOException {
        registry.getOrCreateManager("s1", "proj", project);
        Path elsewhere = Files.createDirectories(tempDir.resolve("elsewhere"));

        assertThrows(ManagerConflictException.class, () -> registry.getOrCreateManager("s1", "other", project));
        assertThrows(ManagerConflictException.class, () -> registry.getOrCreateManager("s1", "proj", elsewhere));
    }

    @Test
    @DisplayName("concurrent callers share one manager")
    void concurrentCreation() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<CheckpointManager>>();
        try {
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.getOrCreateManager("s1", "proj", project);
                }));
            }
            start.countDown();
            CheckpointManager expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<CheckpointManager> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, registry.activeCount());
    }

    @Test
    @DisplayName("removeManager drops the session but keeps its checkpoints")
    void remove() throws IOException {
        Files.writeString(project.resolve("a.txt"), "x");
        registry.getOrCreateManager("s1", "proj", project).createCheckpoint("kept", null);

        assertTrue(registry.removeManager("s1"));
        assertFalse(registry.removeManager("s1"));
        assertTrue(registry.getManager("s1").isEmpty());
        assertThrows(CheckpointNotFoundException.class, () -> registry.requireManager("s1"));

        assertEquals(1, registry.getOrCreateManager("s1", "proj", project).listCheckpoints().size());
    }

    @Test
    @DisplayName("listActiveSessions returns sessions in creation order")
    void listActive() {
        registry.getOrCreateManager("b", "proj", project);
        registry.getOrCreateManager("a", "proj", project);

        assertEquals(List.of("b", "a"), registry.listActiveSessions());
    }

    @Test
    @DisplayName("forkSession creates a manager for the new session descending from the checkpoint")
    void forkSession() throws IOException {
        Files.writeString(project.resolve("a.txt"), "x");
        Checkpoint origin = registry.getOrCreateManager("s1", "proj", project)
                .createCheckpoint("origin", null).checkpoint();

        CheckpointResult result = registry.forkSession("s1", origin.id(), "s2", "experiment");

        assertEquals("s2", result.checkpoint().sessionId());
        assertEquals(origin.id(), result.checkpoint().parentCheckpointId());
        assertEquals("experiment", result.checkpoint().description());
        CheckpointManager forked = registry.requireManager("s2");
        assertEquals("proj", forked.getProjectId());
        assertEquals(project.toAbsolutePath().normalize(), forked.getProjectPath());
    }

    @Test
    @DisplayName("forkSession rejects checkpoints outside the source lineage")
    void forkOutsideLineage() throws IOException {
        Files.writeString(project.resolve("a.txt"), "x");
        Checkpoint foreign = registry.getOrCreateManager("other", "proj", project)
                .createCheckpoint("foreign", null).checkpoint();
        registry.getOrCreateManager("s1", "proj", project);

        assertThrows(InvalidLineageException.class, () -> registry.forkSession("s1", foreign.id(), "s2", null));
        assertThrows(CheckpointNotFoundException.class, () -> registry.forkSession("s1", "missing", "s2", null));
        assertThrows(CheckpointNotFoundException.class, () -> registry.forkSession("ghost", foreign.id(), "s2", null));
        assertTrue(registry.getManager("s2").isEmpty());
    }
}
