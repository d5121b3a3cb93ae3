package com.rewind.core.scanner;

import com.rewind.core.config.RewindProperties;
import com.rewind.core.content.ContentStore;
import com.rewind.core.model.FileSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a project directory and captures the working tree as {@link FileSnapshot}s.
 * <p>
 * Common build-tool and IDE directories (e.g. {@code .git}, {@code node_modules},
 * {@code target}) are automatically excluded, as are any directories listed under
 * {@code rewind.checkpoint.ignore-dirs}.
 */
@Service
public class ProjectScanner {

    private static final Logger log = LoggerFactory.getLogger(ProjectScanner.class);

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next"
    );

    /** Individual files to skip during the walk. */
    private static final Set<String> IGNORE_FILES = Set.of(
            ".DS_Store", "Thumbs.db"
    );

    private final Set<String> ignoreDirs;
    private final long maxFileSizeBytes;

    public ProjectScanner(RewindProperties properties) {
        var dirs = new HashSet<>(IGNORE_DIRS);
        dirs.addAll(properties.getCheckpoint().getIgnoreDirs());
        this.ignoreDirs = Set.copyOf(dirs);
        this.maxFileSizeBytes = properties.getCheckpoint().getMaxFileSizeBytes();
    }

    /**
     * Lists the files under {@code projectRoot} as root-relative paths with forward slashes,
     * sorted. Directories that cannot be opened are logged and left out.
     *
     * @throws IOException if the directory walk fails
     */
    public List<String> listFiles(Path projectRoot) throws IOException {
        return walk(projectRoot, new ArrayList<>());
    }

    /**
     * Reads every file under {@code projectRoot}. Files and directories that cannot be read, and
     * files that exceed the size limit, are skipped and reported in {@link ScanResult#warnings()}.
     *
     * @throws IOException if the directory walk itself fails
     */
    public ScanResult snapshot(Path projectRoot) throws IOException {
        var files = new ArrayList<FileSnapshot>();
        var warnings = new ArrayList<String>();
        for (String relative : walk(projectRoot, warnings)) {
            Path file = projectRoot.resolve(relative);
            try {
                if (!Files.isRegularFile(file)) {
                    throw new IOException("not a readable regular file");
                }
                long size = Files.size(file);
                if (size > maxFileSizeBytes) {
                    warnings.add("Skipped " + relative + ": " + size + " bytes exceeds limit of " + maxFileSizeBytes);
                    continue;
                }
                byte[] content = Files.readAllBytes(file);
                files.add(new FileSnapshot(relative, content, ContentStore.hash(content), content.length));
            } catch (IOException e) {
                log.warn("Skipping unreadable file {}: {}", relative, e.getMessage());
                warnings.add("Skipped " + relative + ": " + e.getMessage());
            }
        }
        return new ScanResult(List.copyOf(files), List.copyOf(warnings));
    }

    /**
     * True when {@link #snapshot(Path)} would capture the file: a readable regular file within
     * the size limit. Restore never deletes a file for which this is false.
     */
    public boolean isCapturable(Path file) {
        try {
            return Files.isRegularFile(file) && Files.isReadable(file) && Files.size(file) <= maxFileSizeBytes;
        } catch (IOException e) {
            return false;
        }
    }

    private List<String> walk(Path projectRoot, List<String> warnings) throws IOException {
        if (!Files.isDirectory(projectRoot)) {
            return List.of();
        }
        var found = new ArrayList<String>();
        Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                return shouldIgnore(projectRoot, dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (shouldIgnore(projectRoot, file)) {
                    return FileVisitResult.CONTINUE;
                }
                // Links are not followed; a link to a directory is left out, any other link is listed.
                if (attrs.isRegularFile() || (attrs.isSymbolicLink() && !Files.isDirectory(file))) {
                    found.add(toRelative(projectRoot, file));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                skip(file, exc);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (exc != null) {
                    skip(dir, exc);
                }
                return FileVisitResult.CONTINUE;
            }

            private void skip(Path path, IOException exc) {
                String relative = path.equals(projectRoot) ? "." : toRelative(projectRoot, path);
                log.warn("Skipping unreadable path {}: {}", relative, exc.toString());
                warnings.add("Skipped " + relative + ": " + exc);
            }
        });
        Collections.sort(found);
        return found;
    }

    /**
     * Returns {@code true} if the root-relative path lies in an ignored directory or is an
     * ignored file.
     */
    public boolean isIgnored(String relativePath) {
        for (String component : relativePath.split("/")) {
            if (ignoreDirs.contains(component) || IGNORE_FILES.contains(component)) {
                return true;
            }
        }
        return false;
    }

    private boolean shouldIgnore(Path root, Path path) {
        for (Path component : root.relativize(path)) {
            String name = component.toString();
            if (ignoreDirs.contains(name)) return true;
            if (IGNORE_FILES.contains(name)) return true;
        }
        return false;
    }

    static String toRelative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    /**
     * Files captured by {@link #snapshot(Path)} plus the files skipped on the way.
     */
    public record ScanResult(List<FileSnapshot> files, List<String> warnings) {}
}
