package com.rewind.core.model;

import java.io.Serializable;

/**
 * Persisted reference from a checkpoint to a content blob.
 *
 * @param path project-relative file path
 * @param hash content hash naming the blob
 * @param size file size in bytes
 */
public record FileRef(
    String path,
    String hash,
    long size
) implements Serializable {}
