package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.*;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Component
public class RunCommandCapability implements Capability {

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
            "run_command", "1.0.0",
            "Run a shell command (sh -c) with the workspace as working directory. Returns {exit_code, stdout, stderr}.",
            ArgumentSchema.of(
                    ArgumentSpec.required("command", ArgumentType.COMMAND, "shell command line"),
                    ArgumentSpec.optional("working_dir", ArgumentType.PATH,
                            "directory to run in (default: workspace root)")),
            SideEffectClass.PROCESS_EXEC);

    @Override public CapabilityDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) {
        String command = CapabilityArgs.string(arguments, "command");
        String rawDir  = CapabilityArgs.string(arguments, "working_dir", ".");

        Path dir = ctx.sandbox().resolve(rawDir);
        if (!Files.isDirectory(dir)) {
            return CapabilityResult.failure("directory not found: " + rawDir);
        }
        return ProcessRunner.run(List.of("sh", "-c", command), dir, ctx);
    }
}
