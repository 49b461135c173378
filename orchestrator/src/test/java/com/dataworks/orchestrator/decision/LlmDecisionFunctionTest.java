package com.dataworks.orchestrator.decision;

import com.dataworks.orchestrator.capability.ArgumentSchema;
import com.dataworks.orchestrator.capability.ArgumentSpec;
import com.dataworks.orchestrator.capability.ArgumentType;
import com.dataworks.orchestrator.capability.CapabilityDescriptor;
import com.dataworks.orchestrator.capability.SideEffectClass;
import com.dataworks.orchestrator.conversation.Turn;
import com.dataworks.orchestrator.llm.LlmApiException;
import com.dataworks.orchestrator.llm.LlmClient;
import com.dataworks.orchestrator.llm.LlmClient.Message;
import com.dataworks.orchestrator.sandbox.SandboxPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmDecisionFunctionTest {

    @TempDir Path workspace;
    @Mock LlmClient llm;

    LlmDecisionFunction decisionFunction;

    static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    static final List<CapabilityDescriptor> CAPABILITIES = List.of(new CapabilityDescriptor(
            "read_file", "1.0.0", "Read a file.",
            ArgumentSchema.of(ArgumentSpec.required("path", ArgumentType.PATH, "file path")),
            SideEffectClass.READ_ONLY));

    @BeforeEach
    void setUp() {
        SystemPrompts prompts = new SystemPrompts(new SandboxPolicy(workspace, 4096));
        decisionFunction = new LlmDecisionFunction(llm, prompts, new ObjectMapper());
    }

    @Test
    void window_isReplayedAsChatMessages() throws Exception {
        List<Turn> window = List.of(
                Turn.human("count lines in a.txt", T0),
                Turn.decision("read_file", Map.of("path", "a.txt"), T0),
                Turn.observation("read_file", "one\ntwo", null, T0));
        when(llm.complete(anyList()))
                .thenReturn("{\"action\": \"Final Answer\", \"action_input\": \"2\"}");

        Decision decision = decisionFunction.decide(window, CAPABILITIES);

        assertThat(decision.answer()).isEqualTo("2");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> sent = ArgumentCaptor.forClass(List.class);
        verify(llm).complete(sent.capture());
        List<Message> messages = sent.getValue();
        assertThat(messages).extracting(Message::role)
                .containsExactly("system", "user", "assistant", "user");
        assertThat(messages.get(0).content())
                .contains("read_file(path: path)")
                .contains(workspace.toRealPath().toString())
                .doesNotContain("{{");
        assertThat(messages.get(2).content()).contains("\"action\":\"read_file\"").contains("\"path\":\"a.txt\"");
        assertThat(messages.get(3).content()).isEqualTo("Observation (read_file):\none\ntwo");
    }

    @Test
    void failedObservation_showsError() {
        List<Message> messages = decisionFunction.toMessages(List.of(
                Turn.human("t", T0),
                Turn.decision("delete_file", Map.of("path", "a"), T0),
                Turn.observation("delete_file", null, "rejected: delete not permitted", T0)), CAPABILITIES);

        assertThat(messages.get(3).content())
                .isEqualTo("Observation (delete_file):\nerror: rejected: delete not permitted");
    }

    @Test
    void upstreamError_becomesUnavailable() {
        when(llm.complete(anyList())).thenThrow(new LlmApiException(503, "overloaded"));

        assertThatThrownBy(() -> decisionFunction.decide(List.of(Turn.human("t", T0)), CAPABILITIES))
                .isInstanceOf(DecisionException.class)
                .extracting(e -> ((DecisionException) e).getKind())
                .isEqualTo(DecisionException.Kind.UNAVAILABLE);
    }

    @Test
    void unparseableReply_becomesParseError() {
        when(llm.complete(anyList())).thenReturn("Sure! Let me think about it.");

        assertThatThrownBy(() -> decisionFunction.decide(List.of(Turn.human("t", T0)), CAPABILITIES))
                .isInstanceOf(DecisionException.class)
                .extracting(e -> ((DecisionException) e).getKind())
                .isEqualTo(DecisionException.Kind.PARSE_ERROR);
    }
}
