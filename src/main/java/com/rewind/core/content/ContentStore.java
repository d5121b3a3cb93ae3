package com.rewind.core.content;

import com.rewind.core.exception.CheckpointNotFoundException;
import com.rewind.core.persistence.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Set;

/**
 * Content-addressed blob pool. Identical content is stored once per project, whichever
 * session or checkpoint captured it.
 */
@Service
public class ContentStore {

    private static final Logger log = LoggerFactory.getLogger(ContentStore.class);

    private final CheckpointStore store;

    public ContentStore(CheckpointStore store) {
        this.store = store;
    }

    /**
     * SHA-256 of {@code content} as lowercase hex.
     */
    public static String hash(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Stores {@code content} unless an identical blob already exists.
     *
     * @return the content hash
     */
    public String put(String projectId, byte[] content) {
        String hash = hash(content);
        if (!store.hasBlob(projectId, hash)) {
            store.writeBlob(projectId, hash, content);
        }
        return hash;
    }

    /**
     * @throws CheckpointNotFoundException if no blob with that hash exists in the project
     */
    public byte[] get(String projectId, String hash) {
        return store.readBlob(projectId, hash)
                .orElseThrow(() -> new CheckpointNotFoundException(
                        "Blob " + hash + " not found in project " + projectId));
    }

    public boolean contains(String projectId, String hash) {
        return store.hasBlob(projectId, hash);
    }

    /**
     * Deletes every blob of the project not named in {@code referenced}.
     *
     * @return number of blobs removed
     */
    public int sweep(String projectId, Set<String> referenced) {
        int removed = 0;
        for (String hash : store.listBlobs(projectId)) {
            if (!referenced.contains(hash)) {
                store.deleteBlob(projectId, hash);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Swept {} unreferenced blobs from project {}", removed, projectId);
        }
        return removed;
    }
}
