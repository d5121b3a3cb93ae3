package com.rewind.dispatch.cli;

import com.rewind.core.manager.CheckpointManager;
import com.rewind.core.manager.CheckpointManagerRegistry;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every command that works on one session.
 */
public class SessionOptions {

    @Option(names = {"-s", "--session"}, required = true, description = "Session ID")
    String sessionId;

    @Option(names = {"--project-path"}, description = "Project working tree (default: current directory)")
    Path projectPath;

    @Option(names = {"--project-id"}, description = "Project ID (default: derived from the project path)")
    String projectId;

    Path resolvedPath() {
        return (projectPath != null ? projectPath : Path.of("")).toAbsolutePath().normalize();
    }

    String resolvedProjectId() {
        return projectId != null ? projectId : ProjectIds.fromPath(resolvedPath());
    }

    CheckpointManager open(CheckpointManagerRegistry registry) {
        return registry.getOrCreateManager(sessionId, resolvedProjectId(), resolvedPath());
    }
}
