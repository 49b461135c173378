package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.*;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Declared so that a decision function asking to delete something gets an
 * explicit refusal instead of "unknown capability". The sandbox guard rejects
 * every FILESYSTEM_DELETE call before it gets here.
 */
@Component
public class DeleteFileCapability implements Capability {

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
            "delete_file", "1.0.0",
            "Delete a file. Deletion is never permitted in this workspace; calls are always refused.",
            ArgumentSchema.of(
                    ArgumentSpec.required("path", ArgumentType.PATH, "file to delete")),
            SideEffectClass.FILESYSTEM_DELETE);

    @Override public CapabilityDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) {
        throw new CapabilityException(CapabilityException.Kind.POLICY_VIOLATION, "delete not permitted");
    }
}
