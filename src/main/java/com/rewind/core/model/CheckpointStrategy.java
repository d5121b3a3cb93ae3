package com.rewind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Policy governing when a checkpoint is taken without explicit user action.
 * <p>
 * MANUAL: only explicit requests create checkpoints.
 * PER_PROMPT: a new user prompt closes the previous exchange.
 * PER_TOOL_USE: every completed tool invocation that touched the file system.
 * SMART: message volume, breadth of file changes, or elapsed time, whichever comes first.
 */
public enum CheckpointStrategy {
    MANUAL("manual"),
    PER_PROMPT("per_prompt"),
    PER_TOOL_USE("per_tool_use"),
    SMART("smart");

    private final String wireName;

    CheckpointStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a strategy from its wire name ({@code per_prompt}) or enum name ({@code PER_PROMPT}).
     *
     * @throws IllegalArgumentException if the value names no strategy
     */
    @JsonCreator
    public static CheckpointStrategy fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Checkpoint strategy must not be null");
        }
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid checkpoint strategy: " + value));
    }
}
