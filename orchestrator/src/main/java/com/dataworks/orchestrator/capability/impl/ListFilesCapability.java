package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Lists regular files under a workspace directory, relative to that directory.
 * Symbolic links are not followed, so the walk cannot leave the workspace.
 */
@Component
public class ListFilesCapability implements Capability {

    private static final int MAX_ENTRIES = 1000;

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
            "list_files", "1.0.0",
            "List files under a workspace directory matching a glob pattern (sorted, at most 1000 entries).",
            ArgumentSchema.of(
                    ArgumentSpec.optional("path", ArgumentType.PATH, "directory to list (default: workspace root)"),
                    ArgumentSpec.optional("pattern", ArgumentType.STRING, "glob such as **/*.md (default: **)")),
            SideEffectClass.READ_ONLY);

    @Override public CapabilityDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) {
        String raw     = CapabilityArgs.string(arguments, "path", ".");
        String pattern = CapabilityArgs.string(arguments, "pattern", "**");

        Path dir = ctx.sandbox().resolve(raw);
        if (!Files.isDirectory(dir)) {
            return CapabilityResult.failure("directory not found: " + raw);
        }

        PathMatcher matcher;
        try {
            matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        } catch (IllegalArgumentException e) {
            throw new CapabilityException(CapabilityException.Kind.INVALID_ARGUMENT,
                    "invalid glob pattern: " + pattern, e);
        }

        try (Stream<Path> walk = Files.walk(dir)) {
            List<String> files = walk
                    .filter(Files::isRegularFile)
                    .map(dir::relativize)
                    // "**/*.md" needs a separator, so also try the bare file name
                    .filter(rel -> matcher.matches(rel) || matcher.matches(rel.getFileName()))
                    .map(rel -> rel.toString().replace('\\', '/'))
                    .sorted()
                    .limit(MAX_ENTRIES)
                    .toList();
            return CapabilityResult.ok(files);
        } catch (IOException e) {
            throw new CapabilityException(CapabilityException.Kind.EXECUTION_ERROR,
                    "could not list " + raw + ": " + e.getMessage(), e);
        }
    }
}
