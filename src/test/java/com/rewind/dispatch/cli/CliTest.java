package com.rewind.dispatch.cli;

import com.rewind.core.TestClock;
import com.rewind.core.config.RewindProperties;
import com.rewind.core.content.ContentStore;
import com.rewind.core.manager.CheckpointManagerRegistry;
import com.rewind.core.metrics.RewindMetrics;
import com.rewind.core.model.Checkpoint;
import com.rewind.core.persistence.CheckpointStorage;
import com.rewind.core.persistence.FileSystemCheckpointStore;
import com.rewind.core.scanner.ProjectScanner;
import com.rewind.core.transcript.SessionLogStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Rewind CLI command structure.
 * Commands run through picocli without a Spring context, against a real registry backed by a
 * temporary checkpoint store.
 */
class CliTest {

    @TempDir
    Path tempDir;

    private Path project;
    private TestClock clock;
    private CheckpointManagerRegistry registry;
    private SessionLogStore sessionLogStore;

    private record CliResult(int exitCode, String output) {}

    @BeforeEach
    void setUp() throws IOException {
        project = Files.createDirectories(tempDir.resolve("project"));
        clock = new TestClock();
        var properties = new RewindProperties();
        properties.setSessionsDir(tempDir.resolve("sessions").toString());
        var metrics = new RewindMetrics(new SimpleMeterRegistry());
        var store = new FileSystemCheckpointStore(tempDir.resolve("store"));
        var storage = new CheckpointStorage(store, new ContentStore(store), metrics, clock);
        registry = new CheckpointManagerRegistry(storage, new ProjectScanner(properties), properties, metrics, clock);
        sessionLogStore = new SessionLogStore(properties);
    }

    /**
     * Custom picocli IFactory that wires commands to the test registry.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == CreateCommand.class) return (K) new CreateCommand(registry, sessionLogStore);
                if (cls == ListCommand.class) return (K) new ListCommand(registry);
                if (cls == RestoreCommand.class) return (K) new RestoreCommand(registry, sessionLogStore);
                if (cls == ForkCommand.class) return (K) new ForkCommand(registry, sessionLogStore);
                if (cls == DiffCommand.class) return (K) new DiffCommand(registry);
                if (cls == TimelineCommand.class) return (K) new TimelineCommand(registry);
                if (cls == CleanupCommand.class) return (K) new CleanupCommand(registry);
                if (cls == SettingsCommand.class) return (K) new SettingsCommand(registry);
                if (cls == ServeCommand.class) return (K) new ServeCommand();
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new RewindCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    /** Runs a session command against the test project. */
    private CliResult session(String command, String session, String... extra) {
        var args = new ArrayList<>(List.of(command, "-s", session,
                "--project-path", project.toString(), "--project-id", "proj"));
        args.addAll(List.of(extra));
        return execute(args.toArray(String[]::new));
    }

    private Checkpoint createCheckpoint(String description) {
        clock.advance(Duration.ofSeconds(1));
        assertEquals(0, session("create", "s1", "-m", description).exitCode());
        List<Checkpoint> checkpoints = registry.requireManager("s1").listCheckpoints();
        return checkpoints.get(checkpoints.size() - 1);
    }

    private void write(String path, String content) throws IOException {
        Files.writeString(project.resolve(path), content);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("create", "list", "restore", "fork", "diff", "timeline", "cleanup", "settings", "serve")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Rewind 0.1.0"));
        }

        @Test
        @DisplayName("missing --session is a usage error")
        void missingSession() {
            CliResult result = execute("list", "--project-path", project.toString());
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--session"));
        }
    }

    // =====================================================================
    //  Checkpoint commands
    // =====================================================================

    @Nested
    @DisplayName("Checkpoint commands")
    class CheckpointCommands {

        @Test
        @DisplayName("create then list shows the checkpoint")
        void createAndList() throws IOException {
            write("a.txt", "hello");

            CliResult created = session("create", "s1", "-m", "first");
            assertEquals(0, created.exitCode());
            assertTrue(created.output().contains("Created checkpoint"));
            assertTrue(created.output().contains("1 files"));

            CliResult listed = session("list", "s1");
            assertEquals(0, listed.exitCode());
            assertTrue(listed.output().contains("first"));
            assertTrue(listed.output().contains("1 checkpoint"));
        }

        @Test
        @DisplayName("list for a session without checkpoints says so")
        void listEmpty() {
            CliResult result = session("list", "s1");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No checkpoints"));
        }

        @Test
        @DisplayName("create loads the agent's session log when present")
        void createLoadsSessionLog() throws IOException {
            write("a.txt", "hello");
            sessionLogStore.write("proj", "s1", "{\"type\":\"user\",\"message\":{\"content\":\"hi\"}}\n{\"type\":\"assistant\"}\n");

            Checkpoint cp = createCheckpoint("with log");

            assertEquals(2, registry.requireManager("s1").getTranscript().size());
            assertEquals("hi", cp.metadata().userPrompt());
        }

        @Test
        @DisplayName("restore brings back file contents")
        void restore() throws IOException {
            write("a.txt", "v1");
            Checkpoint first = createCheckpoint("first");
            write("a.txt", "v2");

            CliResult result = session("restore", "s1", first.id());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Restored checkpoint " + first.shortId()));
            assertEquals("v1", Files.readString(project.resolve("a.txt")));
        }

        @Test
        @DisplayName("restore of an unknown checkpoint fails with exit code 1")
        void restoreUnknown() {
            CliResult result = session("restore", "s1", "missing");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("not found"));
        }

        @Test
        @DisplayName("fork starts a new session and copies the session log")
        void fork() throws IOException {
            write("a.txt", "v1");
            sessionLogStore.write("proj", "s1", "{\"type\":\"user\",\"message\":{\"content\":\"hi\"}}\n");
            Checkpoint origin = createCheckpoint("origin");

            CliResult result = session("fork", "s1", origin.id(), "--new-session", "s2");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Forked session s2"));
            assertTrue(registry.requireManager("s2").isInLineage(origin.id()));
            assertTrue(sessionLogStore.exists("proj", "s2"));
        }

        @Test
        @DisplayName("diff lists added and modified files")
        void diff() throws IOException {
            write("a.txt", "one\n");
            Checkpoint from = createCheckpoint("from");
            write("a.txt", "one\ntwo\n");
            write("c.txt", "new");
            Checkpoint to = createCheckpoint("to");

            CliResult result = session("diff", "s1", from.id(), to.id());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("c.txt"));
            assertTrue(result.output().contains("a.txt (+2 -1)"));
            assertTrue(result.output().contains("1 added, 0 deleted, 1 modified"));
        }

        @Test
        @DisplayName("timeline prints the tree and marks the current checkpoint")
        void timeline() throws IOException {
            write("a.txt", "v1");
            createCheckpoint("first");
            write("a.txt", "v2");
            Checkpoint second = createCheckpoint("second");

            CliResult result = session("timeline", "s1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("first"));
            assertTrue(result.output().contains(second.shortId() + " second <- current"));
            assertTrue(result.output().contains("2 checkpoints recorded."));
        }

        @Test
        @DisplayName("cleanup removes older checkpoints")
        void cleanup() throws IOException {
            write("a.txt", "v1");
            createCheckpoint("first");
            write("a.txt", "v2");
            createCheckpoint("second");

            CliResult result = session("cleanup", "s1", "-k", "1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Removed 1 checkpoint"));
            assertEquals(1, registry.requireManager("s1").listCheckpoints().size());
        }
    }

    // =====================================================================
    //  Settings
    // =====================================================================

    @Nested
    @DisplayName("Settings")
    class SettingsTests {

        @Test
        @DisplayName("without options prints the defaults")
        void showDefaults() {
            CliResult result = session("settings", "s1");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("auto-checkpoint: off, strategy: manual"));
        }

        @Test
        @DisplayName("--auto --strategy updates the session")
        void update() {
            CliResult result = session("settings", "s1", "--auto", "--strategy", "smart");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("auto-checkpoint: on, strategy: smart"));
        }

        @Test
        @DisplayName("an unknown strategy fails with exit code 1")
        void invalidStrategy() {
            CliResult result = session("settings", "s1", "--strategy", "hourly");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("hourly"));
        }
    }
}
