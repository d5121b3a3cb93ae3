package com.rewind.core.transcript;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * A tool invocation requested by the assistant.
 *
 * @param id       tool-use id, matched by the later tool result
 * @param name     tool name, e.g. {@code Edit}
 * @param filePath target file for file tools (nullable)
 * @param command  shell command for {@code Bash} (nullable)
 */
public record ToolUse(String id, String name, String filePath, String command) {

    private static final Set<String> FILE_TOOLS = Set.of("Edit", "Write", "MultiEdit", "NotebookEdit");

    private static final Pattern MUTATING_COMMAND = Pattern.compile(
            "(^|[\\s;&|(])(rm|mv|cp|touch|mkdir|rmdir|ln|chmod|tee|truncate|patch|unzip|tar|git\\s+(checkout|restore|reset|apply|mv|rm|stash))\\b"
                    + "|\\bsed\\s+(-[a-zA-Z]*i|--in-place)"
                    + "|(^|[^0-9&>])>{1,2}\\s*[^&\\s]");

    /**
     * True when the tool writes to the file system: the file tools always, {@code Bash} when the
     * command contains a file-mutating program or an output redirect.
     */
    public boolean isMutating() {
        if (FILE_TOOLS.contains(name)) {
            return true;
        }
        return "Bash".equals(name) && command != null && MUTATING_COMMAND.matcher(command).find();
    }
}
