package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a UTF-8 text file inside the workspace.
 */
@Component
public class ReadFileCapability implements Capability {

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
            "read_file", "1.0.0",
            "Read a text file inside the workspace. Returns its content (long files are truncated).",
            ArgumentSchema.of(
                    ArgumentSpec.required("path", ArgumentType.PATH,
                            "file path, relative to the workspace root or absolute inside it")),
            SideEffectClass.READ_ONLY);

    @Override public CapabilityDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) {
        String raw = CapabilityArgs.string(arguments, "path");
        Path file = ctx.sandbox().resolve(raw);
        if (!Files.isRegularFile(file)) {
            return CapabilityResult.failure("file not found: " + raw);
        }
        try {
            return CapabilityResult.ok(ctx.clip(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new CapabilityException(CapabilityException.Kind.EXECUTION_ERROR,
                    "could not read " + raw + ": " + e.getMessage(), e);
        }
    }
}
