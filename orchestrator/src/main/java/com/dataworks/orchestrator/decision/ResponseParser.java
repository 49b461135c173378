package com.dataworks.orchestrator.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a model reply into a {@link Decision}.
 *
 * The reply must carry one JSON action object, either in a fenced block or
 * bare:
 * <pre>
 *   {"action": "read_file", "action_input": {"path": "notes.txt"}}
 *   {"action": "Final Answer", "action_input": "The file has 12 lines."}
 * </pre>
 * Text around the object (reasoning, "Thought:" lines) is ignored.
 */
public class ResponseParser {

    public static final String FINAL_ANSWER = "Final Answer";

    // Matches ```json ... ``` or ``` ... ``` (with optional language label)
    private static final Pattern FENCED_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n?(.*?)\\n?```",
            Pattern.DOTALL
    );

    private static final ObjectMapper JSON = new ObjectMapper();

    private ResponseParser() {}

    /**
     * @throws DecisionException of kind PARSE_ERROR when no usable action is found
     */
    public static Decision parse(String response) {
        if (response == null || response.isBlank()) {
            throw parseError("empty reply");
        }
        ObjectNode action = extractActionObject(response);

        JsonNode name = action.get("action");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw parseError("missing \"action\" field");
        }
        JsonNode input = action.get("action_input");

        if (name.asText().trim().equalsIgnoreCase(FINAL_ANSWER)) {
            if (input == null || input.isNull()) {
                throw parseError("final answer without \"action_input\"");
            }
            return Decision.finalAnswer(input.isTextual() ? input.asText() : input.toString());
        }
        return Decision.invoke(name.asText().trim(), toArguments(input));
    }

    /** Every fenced block is tried first, then the outermost braces of the whole reply. */
    private static ObjectNode extractActionObject(String response) {
        Matcher m = FENCED_BLOCK.matcher(response);
        while (m.find()) {
            ObjectNode node = readObject(m.group(1).strip());
            if (node != null && node.has("action")) {
                return node;
            }
        }
        int start = response.indexOf('{');
        int end   = response.lastIndexOf('}');
        if (start >= 0 && end > start) {
            ObjectNode node = readObject(response.substring(start, end + 1));
            if (node != null) {
                return node;
            }
        }
        throw parseError("no JSON action block found");
    }

    private static Map<String, Object> toArguments(JsonNode input) {
        if (input == null || input.isNull()) {
            return Map.of();
        }
        JsonNode args = input;
        // Some models double-encode the arguments as a JSON string.
        if (input.isTextual()) {
            args = readObject(input.asText());
            if (args == null) {
                throw parseError("\"action_input\" must be a JSON object");
            }
        }
        if (!args.isObject()) {
            throw parseError("\"action_input\" must be a JSON object");
        }
        return JSON.convertValue(args, JSON.getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, Object.class));
    }

    private static ObjectNode readObject(String text) {
        try {
            JsonNode node = JSON.readTree(text);
            return node != null && node.isObject() ? (ObjectNode) node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static DecisionException parseError(String problem) {
        return new DecisionException(DecisionException.Kind.PARSE_ERROR, problem);
    }
}
