package com.dataworks.orchestrator.capability;

import com.dataworks.orchestrator.sandbox.SandboxPolicy;

import java.util.UUID;

/**
 * Runtime context passed to every capability invocation.
 *
 * The sandbox policy is the only ambient state a capability may use: paths
 * are resolved through it so a capability never opens a file the guard did
 * not approve.
 */
public record CapabilityContext(UUID taskId, SandboxPolicy sandbox, int maxOutputChars) {

    /** Truncates {@code text} to the configured output limit, marking the cut. */
    public String clip(String text) {
        if (text == null || text.length() <= maxOutputChars) {
            return text;
        }
        return text.substring(0, maxOutputChars)
                + "\n... [truncated " + (text.length() - maxOutputChars) + " chars]";
    }
}
