package com.rewind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body binding a session to a project.
 *
 * @param projectId   project id, shared by every session of the project
 * @param projectPath absolute path to the project's working tree
 */
public record SessionRequest(
    @JsonProperty("project_id") String projectId,
    @JsonProperty("project_path") String projectPath
) {}
