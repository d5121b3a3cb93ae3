package com.rewind.core.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * One classified line of an agent session transcript (JSONL).
 * <p>
 * Only the fields the checkpoint engine needs are extracted. The role comes from the top-level
 * {@code type}, else from {@code message.role} or a top-level {@code role}. Lines that are not
 * JSON objects parse to type {@code unknown} and carry nothing but the raw text.
 *
 * @param raw            the line as received
 * @param type           {@code user}, {@code assistant}, {@code system}, ... or {@code unknown}
 * @param prompt         true for a user message typed by a person, false for tool results
 * @param promptText     text of the prompt when {@code prompt} is true
 * @param toolUses       tool invocations requested by an assistant message
 * @param toolResultIds  ids of tool uses this message reports results for
 * @param resultFilePath file named by a top-level {@code toolUseResult} (nullable)
 * @param inputTokens    usage reported by an assistant message
 * @param outputTokens   usage reported by an assistant message
 * @param model          model named by an assistant message (nullable)
 * @param timestamp      message timestamp (nullable)
 */
public record TranscriptMessage(
    String raw,
    String type,
    boolean prompt,
    String promptText,
    List<ToolUse> toolUses,
    List<String> toolResultIds,
    String resultFilePath,
    long inputTokens,
    long outputTokens,
    String model,
    Instant timestamp
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static TranscriptMessage parse(String line) {
        if (line == null || line.isBlank()) {
            return unknown(line);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            return unknown(line);
        }
        if (root == null || !root.isObject()) {
            return unknown(line);
        }

        // Records without a "message" envelope carry role and content at the top level.
        JsonNode message = root.path("message").isObject() ? root.path("message") : root;
        String type = firstText(root.path("type"), message.path("role"), root.path("role"));
        JsonNode content = message.path("content");

        var toolUses = new ArrayList<ToolUse>();
        var toolResultIds = new ArrayList<String>();
        var text = new StringBuilder();

        if (content.isTextual()) {
            text.append(content.asText());
        } else if (content.isArray()) {
            for (JsonNode block : content) {
                switch (block.path("type").asText()) {
                    case "text" -> {
                        if (text.length() > 0) text.append('\n');
                        text.append(block.path("text").asText());
                    }
                    case "tool_use" -> toolUses.add(toToolUse(block));
                    case "tool_result" -> toolResultIds.add(block.path("tool_use_id").asText());
                    default -> { }
                }
            }
        }
        String resultId = textOrNull(message.path("tool_use_id"));
        if (resultId != null) {
            toolResultIds.add(resultId);
        }

        boolean prompt = "user".equals(type) && toolResultIds.isEmpty() && text.length() > 0;
        JsonNode usage = message.path("usage");
        JsonNode toolUseResult = root.path("toolUseResult");
        String resultFilePath = toolUseResult.isObject() ? textOrNull(toolUseResult.path("filePath")) : null;

        return new TranscriptMessage(
                line,
                type,
                prompt,
                prompt ? text.toString() : null,
                List.copyOf(toolUses),
                List.copyOf(toolResultIds),
                resultFilePath,
                usage.path("input_tokens").asLong(0),
                usage.path("output_tokens").asLong(0),
                "assistant".equals(type) ? textOrNull(message.path("model")) : null,
                parseInstant(textOrNull(root.path("timestamp"))));
    }

    public boolean isAssistant() {
        return "assistant".equals(type);
    }

    public boolean isToolResult() {
        return !toolResultIds.isEmpty() || resultFilePath != null;
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    private static ToolUse toToolUse(JsonNode block) {
        JsonNode input = block.path("input");
        String filePath = textOrNull(input.path("file_path"));
        if (filePath == null) {
            filePath = textOrNull(input.path("notebook_path"));
        }
        return new ToolUse(
                textOrNull(block.path("id")),
                block.path("name").asText(),
                filePath,
                textOrNull(input.path("command")));
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode node : candidates) {
            String text = textOrNull(node);
            if (text != null) {
                return text;
            }
        }
        return "unknown";
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() && !node.asText().isEmpty() ? node.asText() : null;
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static TranscriptMessage unknown(String line) {
        return new TranscriptMessage(line, "unknown", false, null, List.of(), List.of(), null, 0, 0, null, null);
    }
}
