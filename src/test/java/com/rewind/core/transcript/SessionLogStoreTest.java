package com.rewind.core.transcript;

import com.rewind.core.config.RewindProperties;
import com.rewind.core.exception.TranscriptCaptureException;
import com.rewind.core.manager.CheckpointManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SessionLogStoreTest {

    @TempDir
    Path sessionsDir;

    private SessionLogStore logs;

    @BeforeEach
    void setUp() throws Exception {
        var properties = new RewindProperties();
        properties.setSessionsDir(sessionsDir.toString());
        logs = new SessionLogStore(properties);
        Files.createDirectories(sessionsDir.resolve("proj"));
        Files.writeString(sessionsDir.resolve("proj/s1.jsonl"), "l0\nl1\n\nl2\n");
    }

    @Test
    @DisplayName("readLines skips blank lines and honours messageIndex")
    void readLines() {
        assertEquals(List.of("l0", "l1", "l2"), logs.readLines("proj", "s1", null));
        assertEquals(List.of("l0", "l1"), logs.readLines("proj", "s1", 1));
    }

    @Test
    @DisplayName("a missing log raises TranscriptCaptureException")
    void missingLog() {
        assertFalse(logs.exists("proj", "nope"));
        assertThrows(TranscriptCaptureException.class, () -> logs.readLines("proj", "nope", null));
    }

    @Test
    @DisplayName("loadInto syncs the manager's transcript")
    void loadInto() {
        var manager = mock(CheckpointManager.class);
        when(manager.getProjectId()).thenReturn("proj");
        when(manager.getSessionId()).thenReturn("s1");

        assertEquals(3, logs.loadInto(manager, null));
        verify(manager).syncTranscript(List.of("l0", "l1", "l2"));
    }

    @Test
    @DisplayName("write replaces an existing log and creates missing ones")
    void write() throws Exception {
        logs.write("proj", "s1", "x\ny\n");
        assertEquals("x\ny\n", Files.readString(logs.logPath("proj", "s1")));

        logs.write("other", "s2", "z\n");
        assertTrue(logs.exists("other", "s2"));
        assertEquals(List.of("z"), logs.readLines("other", "s2", null));
        try (var files = Files.list(sessionsDir.resolve("proj"))) {
            assertEquals(1, files.count(), "no temp files left behind");
        }
    }

    @Test
    @DisplayName("a failed write removes its temporary file")
    void failedWriteLeavesNoTempFile() throws Exception {
        // A non-empty directory at the log path makes the final move fail.
        Path blocked = sessionsDir.resolve("proj/s9.jsonl");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("keep"), "k");

        assertThrows(TranscriptCaptureException.class, () -> logs.write("proj", "s9", "x\n"));

        try (var files = Files.list(sessionsDir.resolve("proj"))) {
            assertEquals(List.of(), files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(".tmp"))
                    .toList());
        }
        assertTrue(Files.isRegularFile(blocked.resolve("keep")));
    }
}
