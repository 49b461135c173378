package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

@Component
public class WriteFileCapability implements Capability {

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
            "write_file", "1.0.0",
            "Write text to a file inside the workspace, creating parent directories. Overwrites unless append is true.",
            ArgumentSchema.of(
                    ArgumentSpec.required("path", ArgumentType.PATH, "target file path inside the workspace"),
                    ArgumentSpec.required("content", ArgumentType.STRING, "text to write"),
                    ArgumentSpec.optional("append", ArgumentType.BOOLEAN, "append instead of overwriting (default false)")),
            SideEffectClass.FILESYSTEM_WRITE);

    @Override public CapabilityDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) {
        String raw     = CapabilityArgs.string(arguments, "path");
        String content = CapabilityArgs.string(arguments, "content");
        boolean append = CapabilityArgs.bool(arguments, "append", false);

        Path file = ctx.sandbox().resolve(raw);
        if (Files.isDirectory(file)) {
            return CapabilityResult.failure("path is a directory: " + raw);
        }
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            if (append) {
                Files.writeString(file, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(file, content, StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new CapabilityException(CapabilityException.Kind.EXECUTION_ERROR,
                    "could not write " + raw + ": " + e.getMessage(), e);
        }
        return CapabilityResult.ok("wrote %d characters to %s"
                .formatted(content.length(), ctx.sandbox().relativize(file)));
    }
}
