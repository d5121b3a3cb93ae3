package com.rewind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions/{sessionId}/checkpoints/{checkpointId}/fork.
 *
 * @param newSessionId id of the session to create
 * @param description  label of the fork checkpoint; nullable, defaults to "Fork from checkpoint ..."
 */
public record ForkRequest(
    @JsonProperty("new_session_id") String newSessionId,
    String description
) {}
