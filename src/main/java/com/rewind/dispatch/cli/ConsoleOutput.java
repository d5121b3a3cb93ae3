package com.rewind.dispatch.cli;

import com.rewind.core.model.Checkpoint;
import com.rewind.core.model.TimelineNode;
import picocli.CommandLine;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Rewind CLI.
 */
public class ConsoleOutput {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) REWIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [REWIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void fileChange(String action, String path) {
        String symbol = switch (action) {
            case "added" -> "@|fg(green) +|@";
            case "deleted" -> "@|fg(red) -|@";
            default -> "@|fg(yellow) ~|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + symbol + " " + path));
    }

    public static void checkpointLine(Checkpoint checkpoint, boolean current) {
        String marker = current ? "@|bold,fg(green) *|@" : " ";
        String description = checkpoint.description() != null ? checkpoint.description() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %s @|fg(yellow) %s|@  %s  %3d files  %s",
                marker, checkpoint.shortId(), TIME.format(checkpoint.createdAt()),
                checkpoint.metadata().fileCount(), description)));
    }

    /**
     * Prints a timeline subtree, one checkpoint per line, children indented below their parent.
     * Ancestors owned by another session are labelled with that session.
     */
    public static void tree(List<TimelineNode> nodes, String sessionId, String currentId, String indent) {
        for (int i = 0; i < nodes.size(); i++) {
            TimelineNode node = nodes.get(i);
            boolean last = i == nodes.size() - 1;
            Checkpoint cp = node.checkpoint();
            String marker = cp.id().equals(currentId) ? " @|bold,fg(green) <- current|@" : "";
            String foreign = sessionId.equals(cp.sessionId()) ? "" : " @|faint (session " + cp.sessionId() + ")|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(indent + (last ? "└── " : "├── ")
                    + "@|fg(yellow) " + cp.shortId() + "|@ "
                    + (cp.description() != null ? cp.description() : "") + foreign + marker));
            tree(node.children(), sessionId, currentId, indent + (last ? "    " : "│   "));
        }
    }

    public static String formatSize(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.1f KB", bytes / 1024.0);
        return String.format("%.1f MB", bytes / (1024.0 * 1024.0));
    }
}
