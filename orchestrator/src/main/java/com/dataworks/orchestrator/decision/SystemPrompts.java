package com.dataworks.orchestrator.decision;

import com.dataworks.orchestrator.capability.CapabilityDescriptor;
import com.dataworks.orchestrator.capability.CapabilityRegistry;
import com.dataworks.orchestrator.sandbox.SandboxPolicy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * System prompt for the LLM-backed decision function.
 *
 * The capability list is rendered from descriptors on every call, so the
 * prompt always names exactly the capabilities the registry will accept.
 */
@Component
public class SystemPrompts {

    private final String workspaceRoot;

    public SystemPrompts(SandboxPolicy sandbox) {
        this.workspaceRoot = sandbox.workspaceRoot().toString();
    }

    public String get(List<CapabilityDescriptor> capabilities) {
        String names = capabilities.stream()
                .map(CapabilityDescriptor::name)
                .collect(Collectors.joining(", "));
        return PROMPT
                .replace("{{TOOL_DOCS}}", CapabilityRegistry.toolDocumentation(capabilities))
                .replace("{{TOOL_NAMES}}", names)
                .replace("{{WORKSPACE_ROOT}}", workspaceRoot);
    }

    // ------------------------------------------------------------------
    // Prompt  ({{...}} placeholders are replaced per call)
    // ------------------------------------------------------------------

    private static final String PROMPT = """
            You are a data-operations agent. You complete the user's task by calling
            capabilities one at a time and reading their observations.

            WORKSPACE: every file you read or write lives under {{WORKSPACE_ROOT}}.
            Paths may be relative to that directory. Paths outside it are refused.
            Deleting files is never permitted.

            {{TOOL_DOCS}}

            RESPONSE FORMAT: reply with exactly one JSON object in a ```json block:

            ```json
            {"action": "<one of: {{TOOL_NAMES}}>", "action_input": {<arguments>}}
            ```

            When the task is complete, reply with:

            ```json
            {"action": "Final Answer", "action_input": "<your answer to the user>"}
            ```

            RULES:
              - One action per reply. Wait for the observation before the next one.
              - Use only argument names listed above.
              - Read an observation's error before retrying; do not repeat a refused call.
              - Never invent file contents you have not read.
            """;
}
