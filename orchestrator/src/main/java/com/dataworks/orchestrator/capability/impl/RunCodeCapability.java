package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.*;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Executes a code snippet with an interpreter, in the workspace root.
 * Python is the default; shell snippets go through {@code sh -c}.
 */
@Component
public class RunCodeCapability implements Capability {

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
            "run_code", "1.0.0",
            "Run a code snippet in the workspace. Languages: python (default), sh. Returns {exit_code, stdout, stderr}.",
            ArgumentSchema.of(
                    ArgumentSpec.required("code", ArgumentType.COMMAND, "source code to run"),
                    ArgumentSpec.optional("language", ArgumentType.STRING, "python or sh (default python)")),
            SideEffectClass.PROCESS_EXEC);

    @Override public CapabilityDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) {
        String code     = CapabilityArgs.string(arguments, "code");
        String language = CapabilityArgs.string(arguments, "language", "python").trim().toLowerCase(Locale.ROOT);

        List<String> command = switch (language) {
            case "python", "python3", "py" -> List.of("python3", "-c", code);
            case "sh", "bash", "shell"     -> List.of("sh", "-c", code);
            default -> throw new CapabilityException(CapabilityException.Kind.INVALID_ARGUMENT,
                    "unsupported language: " + language);
        };
        return ProcessRunner.run(command, ctx.sandbox().workspaceRoot(), ctx);
    }
}
