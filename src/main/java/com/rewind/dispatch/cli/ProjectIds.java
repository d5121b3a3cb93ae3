package com.rewind.dispatch.cli;

import java.nio.file.Path;

/**
 * Derives a project id from a working-tree path the way agent session logs are laid out:
 * the absolute path with every separator replaced by {@code -}.
 */
public final class ProjectIds {

    private ProjectIds() {}

    public static String fromPath(Path projectPath) {
        String absolute = projectPath.toAbsolutePath().normalize().toString();
        return absolute.replace('\\', '-').replace('/', '-').replace(':', '-');
    }
}
