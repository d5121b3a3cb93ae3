package com.rewind.dispatch.api;

import java.util.List;

/**
 * Transcript lines to track, or a single candidate line to evaluate.
 */
public record MessagesRequest(
    List<String> messages,
    String message
) {}
