package com.rewind.core.scanner;

import com.rewind.core.config.RewindProperties;
import com.rewind.core.content.ContentStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

/**
 * Unit tests for {@link ProjectScanner}.
 * <p>
 * Uses JUnit 5's {@code @TempDir} for isolated filesystem tests so that
 * results are deterministic and independent of the host machine.
 */
class ProjectScannerTest {

    @TempDir
    Path tempDir;

    ProjectScanner scanner = new ProjectScanner(new RewindProperties());

    @Test
    @DisplayName("scans empty directory and returns zero files")
    void scansEmptyDirectory() throws IOException {
        var result = scanner.snapshot(tempDir);
        assertTrue(result.files().isEmpty());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    @DisplayName("lists nested files relative to the root with forward slashes")
    void listsNestedFiles() throws IOException {
        Files.createDirectories(tempDir.resolve("src/main/java"));
        Files.writeString(tempDir.resolve("src/main/java/App.java"), "class App {}");
        Files.writeString(tempDir.resolve("pom.xml"), "<project/>");

        assertEquals(List.of("pom.xml", "src/main/java/App.java"), scanner.listFiles(tempDir));
    }

    @Test
    @DisplayName("snapshot captures content, hash and size")
    void snapshotCapturesContent() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "hello");

        var file = scanner.snapshot(tempDir).files().get(0);

        assertEquals("a.txt", file.filePath());
        assertEquals("hello", new String(file.content(), StandardCharsets.UTF_8));
        assertEquals(ContentStore.hash("hello".getBytes(StandardCharsets.UTF_8)), file.hash());
        assertEquals(5, file.size());
    }

    @Test
    @DisplayName("ignores .git, node_modules and OS metadata files")
    void ignoresBuiltInDirectories() throws IOException {
        Files.createDirectories(tempDir.resolve(".git/objects"));
        Files.writeString(tempDir.resolve(".git/config"), "");
        Files.createDirectories(tempDir.resolve("node_modules/lodash"));
        Files.writeString(tempDir.resolve("node_modules/lodash/index.js"), "");
        Files.writeString(tempDir.resolve(".DS_Store"), "");
        Files.writeString(tempDir.resolve("keep.txt"), "");

        assertEquals(List.of("keep.txt"), scanner.listFiles(tempDir));
        assertTrue(scanner.isIgnored(".git/config"));
        assertTrue(scanner.isIgnored("web/node_modules/x.js"));
        assertFalse(scanner.isIgnored("src/App.java"));
    }

    @Test
    @DisplayName("honours configured extra ignore directories")
    void extraIgnoreDirs() throws IOException {
        var properties = new RewindProperties();
        properties.getCheckpoint().setIgnoreDirs(List.of("venv"));
        var custom = new ProjectScanner(properties);
        Files.createDirectories(tempDir.resolve("venv/lib"));
        Files.writeString(tempDir.resolve("venv/lib/site.py"), "");
        Files.writeString(tempDir.resolve("main.py"), "");

        assertEquals(List.of("main.py"), custom.listFiles(tempDir));
    }

    @Test
    @DisplayName("skips files over the size limit with a warning")
    void skipsLargeFiles() throws IOException {
        var properties = new RewindProperties();
        properties.getCheckpoint().setMaxFileSizeBytes(4);
        var limited = new ProjectScanner(properties);
        Files.writeString(tempDir.resolve("big.bin"), "123456");
        Files.writeString(tempDir.resolve("ok.txt"), "123");

        var result = limited.snapshot(tempDir);

        assertEquals(List.of("ok.txt"), result.files().stream().map(f -> f.filePath()).toList());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("big.bin"));
    }

    @Test
    @DisplayName("an unreadable directory is skipped with a warning instead of failing the walk")
    void skipsUnreadableDirectory() throws IOException {
        Files.writeString(tempDir.resolve("ok.txt"), "ok");
        Path locked = Files.createDirectories(tempDir.resolve("locked"));
        Files.writeString(locked.resolve("secret.txt"), "hidden");
        Set<PosixFilePermission> original = Files.getPosixFilePermissions(locked);
        Files.setPosixFilePermissions(locked, Set.of());
        try {
            assumeFalse(Files.isReadable(locked), "permissions are not enforced for this user");

            var result = scanner.snapshot(tempDir);

            assertEquals(List.of("ok.txt"), result.files().stream().map(f -> f.filePath()).toList());
            assertEquals(1, result.warnings().size());
            assertTrue(result.warnings().get(0).startsWith("Skipped locked"));
            assertEquals(List.of("ok.txt"), scanner.listFiles(tempDir));
        } finally {
            Files.setPosixFilePermissions(locked, original);
        }
    }

    @Test
    @DisplayName("a dangling link is reported, a link to a directory is not followed")
    void links() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "a");
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.writeString(outside.resolve("b.txt"), "b");
        Path root = Files.createDirectories(tempDir.resolve("root"));
        Files.writeString(root.resolve("real.txt"), "real");
        Files.createSymbolicLink(root.resolve("dangling"), root.resolve("missing"));
        Files.createSymbolicLink(root.resolve("dirlink"), outside);
        Files.createSymbolicLink(root.resolve("filelink"), tempDir.resolve("a.txt"));

        var result = scanner.snapshot(root);

        assertEquals(List.of("filelink", "real.txt"), result.files().stream().map(f -> f.filePath()).toList());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith("Skipped dangling"));
    }

    @Test
    @DisplayName("isCapturable mirrors the snapshot's size and readability filter")
    void capturable() throws IOException {
        var properties = new RewindProperties();
        properties.getCheckpoint().setMaxFileSizeBytes(4);
        var limited = new ProjectScanner(properties);
        Path small = Files.writeString(tempDir.resolve("small.txt"), "123");
        Path big = Files.writeString(tempDir.resolve("big.bin"), "123456");

        assertTrue(limited.isCapturable(small));
        assertFalse(limited.isCapturable(big));
        assertFalse(limited.isCapturable(tempDir.resolve("absent")));
        assertFalse(limited.isCapturable(tempDir));
    }

    @Test
    @DisplayName("a missing root yields no files")
    void missingRoot() throws IOException {
        assertTrue(scanner.listFiles(tempDir.resolve("absent")).isEmpty());
    }
}
