package com.rewind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions/{sessionId}/checkpoints.
 *
 * @param projectId      project id; with {@code projectPath} opens the session if it is not active
 * @param projectPath    absolute path to the project's working tree
 * @param description    optional checkpoint label
 * @param messageIndex   when set, the session log is loaded up to this line before the snapshot
 * @param loadSessionLog load the whole session log before the snapshot; implied by {@code messageIndex}
 */
public record CreateCheckpointRequest(
    @JsonProperty("project_id") String projectId,
    @JsonProperty("project_path") String projectPath,
    String description,
    @JsonProperty("message_index") Integer messageIndex,
    @JsonProperty("load_session_log") Boolean loadSessionLog
) {}
