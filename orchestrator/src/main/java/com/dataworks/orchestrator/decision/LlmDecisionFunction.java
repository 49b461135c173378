package com.dataworks.orchestrator.decision;

import com.dataworks.orchestrator.capability.CapabilityDescriptor;
import com.dataworks.orchestrator.conversation.Turn;
import com.dataworks.orchestrator.llm.LlmApiException;
import com.dataworks.orchestrator.llm.LlmClient;
import com.dataworks.orchestrator.llm.LlmClient.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decision function backed by a chat-completions model.
 *
 * The window is replayed as chat messages: HUMAN turns and observations as
 * user messages, decisions and final answers as the assistant's JSON actions.
 */
@Component
public class LlmDecisionFunction implements DecisionFunction {

    private static final Logger log = LoggerFactory.getLogger(LlmDecisionFunction.class);

    private final LlmClient     llm;
    private final SystemPrompts prompts;
    private final ObjectMapper  json;

    public LlmDecisionFunction(LlmClient llm, SystemPrompts prompts, ObjectMapper json) {
        this.llm     = llm;
        this.prompts = prompts;
        this.json    = json;
    }

    @Override
    public Decision decide(List<Turn> window, List<CapabilityDescriptor> capabilities) {
        List<Message> messages = toMessages(window, capabilities);

        String reply;
        try {
            reply = llm.complete(messages);
        } catch (LlmApiException e) {
            throw new DecisionException(DecisionException.Kind.UNAVAILABLE, e.getMessage(), e);
        }
        log.debug("Model reply ({} chars): {}", reply.length(), reply);
        return ResponseParser.parse(reply);
    }

    List<Message> toMessages(List<Turn> window, List<CapabilityDescriptor> capabilities) {
        List<Message> messages = new ArrayList<>();
        messages.add(new Message("system", prompts.get(capabilities)));
        for (Turn turn : window) {
            switch (turn.type()) {
                case HUMAN       -> messages.add(new Message("user", turn.content()));
                case DECISION    -> messages.add(new Message("assistant",
                        action(turn.capability(), turn.arguments())));
                case OBSERVATION -> messages.add(new Message("user", observation(turn)));
                case FINAL       -> messages.add(new Message("assistant",
                        action(ResponseParser.FINAL_ANSWER, turn.content())));
            }
        }
        return messages;
    }

    private String action(String name, Object input) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("action", name);
        action.put("action_input", input);
        try {
            return "```json\n" + json.writeValueAsString(action) + "\n```";
        } catch (JsonProcessingException e) {
            throw new DecisionException(DecisionException.Kind.PARSE_ERROR,
                    "could not encode previous action: " + e.getMessage(), e);
        }
    }

    private static String observation(Turn turn) {
        StringBuilder sb = new StringBuilder("Observation");
        if (turn.capability() != null) {
            sb.append(" (").append(turn.capability()).append(")");
        }
        sb.append(":\n");
        if (turn.error() != null) {
            sb.append("error: ").append(turn.error()).append("\n");
        }
        if (turn.content() != null) {
            sb.append(turn.content());
        }
        return sb.toString().stripTrailing();
    }
}
