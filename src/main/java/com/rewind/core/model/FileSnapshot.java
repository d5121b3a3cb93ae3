package com.rewind.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Content of a single working-tree file captured at a checkpoint.
 *
 * @param filePath project-relative path, forward slashes, unique within a checkpoint
 * @param content  raw file bytes
 * @param hash     SHA-256 of {@code content}, lowercase hex
 * @param size     length of {@code content} in bytes
 */
public record FileSnapshot(
    String filePath,
    byte[] content,
    String hash,
    long size
) {

    public FileSnapshot {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public FileRef toRef() {
        return new FileRef(filePath, hash, size);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileSnapshot other)) return false;
        return size == other.size
                && filePath.equals(other.filePath)
                && Objects.equals(hash, other.hash)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, hash, size, Arrays.hashCode(content));
    }

    @Override
    public String toString() {
        return "FileSnapshot[filePath=" + filePath + ", hash=" + hash + ", size=" + size + "]";
    }
}
