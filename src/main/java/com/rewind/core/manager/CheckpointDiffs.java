package com.rewind.core.manager;

import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.CheckpointDiff;
import com.rewind.core.model.FileDiff;
import com.rewind.core.model.FileRef;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Coarse comparison of two checkpoints' file sets.
 */
final class CheckpointDiffs {

    private CheckpointDiffs() {}

    static CheckpointDiff diff(Checkpoint from, List<FileRef> fromFiles,
                               Checkpoint to, List<FileRef> toFiles,
                               Function<String, byte[]> contentByHash) {
        Map<String, FileRef> before = byPath(fromFiles);
        Map<String, FileRef> after = byPath(toFiles);
        Set<String> paths = new TreeSet<>(before.keySet());
        paths.addAll(after.keySet());

        var modified = new ArrayList<FileDiff>();
        var added = new ArrayList<String>();
        var deleted = new ArrayList<String>();
        for (String path : paths) {
            FileRef old = before.get(path);
            FileRef neu = after.get(path);
            if (old == null) {
                added.add(path);
            } else if (neu == null) {
                deleted.add(path);
            } else if (!old.hash().equals(neu.hash())) {
                modified.add(new FileDiff(path,
                        lineCount(contentByHash.apply(neu.hash())),
                        lineCount(contentByHash.apply(old.hash()))));
            }
        }
        long tokenDelta = to.metadata().totalTokens() - from.metadata().totalTokens();
        return new CheckpointDiff(from.id(), to.id(), modified, added, deleted, tokenDelta);
    }

    /**
     * Paths added, removed or modified between two file sets.
     */
    static int changedFileCount(List<FileRef> parentFiles, List<FileRef> files) {
        Map<String, FileRef> before = byPath(parentFiles);
        Map<String, FileRef> after = byPath(files);
        int changes = 0;
        for (FileRef ref : after.values()) {
            FileRef old = before.get(ref.path());
            if (old == null || !old.hash().equals(ref.hash())) {
                changes++;
            }
        }
        for (String path : before.keySet()) {
            if (!after.containsKey(path)) {
                changes++;
            }
        }
        return changes;
    }

    /**
     * Number of lines; a trailing newline does not start a new line and empty content has none.
     */
    static long lineCount(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.isEmpty()) {
            return 0;
        }
        long newlines = text.chars().filter(c -> c == '\n').count();
        return text.endsWith("\n") ? newlines : newlines + 1;
    }

    private static Map<String, FileRef> byPath(List<FileRef> files) {
        Map<String, FileRef> map = new HashMap<>();
        files.forEach(f -> map.put(f.path(), f));
        return map;
    }
}
