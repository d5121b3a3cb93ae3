package com.rewind.core.manager;

import com.rewind.core.exception.RestoreWriteException;
import com.rewind.core.model.FileSnapshot;
import com.rewind.core.scanner.ProjectScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes a checkpoint's files back into the working tree as one unit.
 * <p>
 * Phase one stages every file into a temporary sibling of its target. Phase two moves the
 * staged files into place, keeping a backup of each file it replaces. A failure in either
 * phase undoes everything done so far and raises {@link RestoreWriteException}.
 */
class WorkingTreeRestorer {

    private static final Logger log = LoggerFactory.getLogger(WorkingTreeRestorer.class);

    private final ProjectScanner scanner;
    private final boolean deleteUntracked;

    WorkingTreeRestorer(ProjectScanner scanner, boolean deleteUntracked) {
        this.scanner = scanner;
        this.deleteUntracked = deleteUntracked;
    }

    record Outcome(int filesWritten, List<String> warnings) {}

    private record Staged(String path, Path target, Path temp) {}

    private record Committed(Path target, Path backup) {}

    Outcome restore(Path projectRoot, List<FileSnapshot> files) {
        Path root = projectRoot.toAbsolutePath().normalize();
        var staged = new ArrayList<Staged>();
        Deque<Path> createdDirs = new ArrayDeque<>();

        for (FileSnapshot file : files) {
            Path target = root.resolve(file.filePath()).normalize();
            try {
                if (!target.startsWith(root)) {
                    throw new IOException("Path escapes project root: " + file.filePath());
                }
                if (Files.isRegularFile(target) && Arrays.equals(Files.readAllBytes(target), file.content())) {
                    continue;
                }
                createDirectories(target.getParent(), createdDirs);
                Path temp = Files.createTempFile(target.getParent(), ".rewind-", ".tmp");
                staged.add(new Staged(file.filePath(), target, temp));
                Files.write(temp, file.content());
            } catch (IOException e) {
                discard(staged, createdDirs);
                throw new RestoreWriteException("Failed to stage " + file.filePath() + ": " + e.getMessage(),
                        List.of(file.filePath()), e);
            }
        }

        var committed = new ArrayList<Committed>();
        for (Staged s : staged) {
            try {
                Path backup = null;
                if (Files.exists(s.target())) {
                    backup = Files.createTempFile(s.target().getParent(), ".rewind-backup-", ".tmp");
                    Files.move(s.target(), backup, StandardCopyOption.REPLACE_EXISTING);
                }
                committed.add(new Committed(s.target(), backup));
                Files.move(s.temp(), s.target(), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                rollback(committed);
                discard(staged, createdDirs);
                throw new RestoreWriteException("Failed to write " + s.path() + ": " + e.getMessage(),
                        List.of(s.path()), e);
            }
        }

        var warnings = new ArrayList<String>();
        for (Committed c : committed) {
            if (c.backup() != null) {
                try {
                    Files.deleteIfExists(c.backup());
                } catch (IOException e) {
                    warnings.add("Could not remove backup " + c.backup() + ": " + e.getMessage());
                }
            }
        }
        if (deleteUntracked) {
            warnings.addAll(deleteUntracked(root, files));
        }
        log.info("Restored {} files ({} unchanged)", staged.size(), files.size() - staged.size());
        return new Outcome(files.size(), warnings);
    }

    private List<String> deleteUntracked(Path root, List<FileSnapshot> files) {
        Set<String> keep = new HashSet<>();
        files.forEach(f -> keep.add(f.filePath()));
        var warnings = new ArrayList<String>();
        List<String> present;
        try {
            present = scanner.listFiles(root);
        } catch (IOException e) {
            warnings.add("Could not list working tree for cleanup: " + e.getMessage());
            return warnings;
        }
        for (String path : present) {
            if (keep.contains(path) || scanner.isIgnored(path)) {
                continue;
            }
            Path file = root.resolve(path);
            // A file no snapshot can capture would be lost for good.
            if (!scanner.isCapturable(file)) {
                warnings.add("Kept untracked file " + path + ": it cannot be captured in a checkpoint");
                continue;
            }
            try {
                Files.deleteIfExists(file);
                log.debug("Deleted untracked file {}", path);
            } catch (IOException e) {
                warnings.add("Could not delete untracked file " + path + ": " + e.getMessage());
            }
        }
        return warnings;
    }

    private void rollback(List<Committed> committed) {
        for (int i = committed.size() - 1; i >= 0; i--) {
            Committed c = committed.get(i);
            try {
                if (c.backup() != null) {
                    Files.move(c.backup(), c.target(), StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.deleteIfExists(c.target());
                }
            } catch (IOException e) {
                log.error("Rollback of {} failed; working tree may be inconsistent", c.target(), e);
            }
        }
    }

    private void discard(List<Staged> staged, Deque<Path> createdDirs) {
        for (Staged s : staged) {
            try {
                Files.deleteIfExists(s.temp());
            } catch (IOException e) {
                log.warn("Could not remove staged file {}: {}", s.temp(), e.getMessage());
            }
        }
        while (!createdDirs.isEmpty()) {
            Path dir = createdDirs.pop();
            try {
                Files.deleteIfExists(dir);
            } catch (IOException e) {
                log.warn("Could not remove directory {}: {}", dir, e.getMessage());
            }
        }
    }

    /**
     * Creates missing ancestors one level at a time so they can be removed on rollback,
     * innermost first.
     */
    private static void createDirectories(Path dir, Deque<Path> created) throws IOException {
        var missing = new ArrayDeque<Path>();
        for (Path p = dir; p != null && !Files.exists(p); p = p.getParent()) {
            missing.push(p);
        }
        while (!missing.isEmpty()) {
            Path p = missing.pop();
            Files.createDirectory(p);
            created.push(p);
        }
    }
}
