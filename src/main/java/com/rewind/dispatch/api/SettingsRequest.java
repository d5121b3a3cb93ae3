package com.rewind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Auto-checkpoint settings of a session, inbound and outbound.
 *
 * @param autoCheckpointEnabled whether the strategy is consulted
 * @param checkpointStrategy    manual, per_prompt, per_tool_use or smart
 */
public record SettingsRequest(
    @JsonProperty("auto_checkpoint_enabled") boolean autoCheckpointEnabled,
    @JsonProperty("checkpoint_strategy") String checkpointStrategy
) {}
