package com.dataworks.orchestrator.capability;

import java.time.Duration;

/**
 * Identity, schema and risk class of a capability.
 *
 * @param name        unique registry key, also the action name the decision function emits
 * @param version     bumped when the argument contract changes
 * @param description one-sentence docstring shown in the tool documentation
 * @param schema      declared arguments
 * @param sideEffect  what the capability may touch; drives guard rules and default timeout
 * @param timeout     capability-specific timeout, or null to use the side-effect class default
 */
public record CapabilityDescriptor(
        String          name,
        String          version,
        String          description,
        ArgumentSchema  schema,
        SideEffectClass sideEffect,
        Duration        timeout) {

    public CapabilityDescriptor(String name, String version, String description,
                                ArgumentSchema schema, SideEffectClass sideEffect) {
        this(name, version, description, schema, sideEffect, null);
    }

    public String signature() {
        return schema.signature(name);
    }
}
