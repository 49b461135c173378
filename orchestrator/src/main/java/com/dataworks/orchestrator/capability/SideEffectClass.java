package com.dataworks.orchestrator.capability;

/**
 * What a capability can do to the world outside the JVM.
 *
 * READ_ONLY:         reads workspace files, changes nothing.
 * FILESYSTEM_WRITE:  creates or modifies files inside the workspace.
 * FILESYSTEM_DELETE: removes files. Always refused by the sandbox guard.
 * NETWORK:           talks to remote hosts.
 * PROCESS_EXEC:      spawns an OS process. High risk: the guard checks its
 *                    declared arguments but does not interpret command text.
 */
public enum SideEffectClass {
    READ_ONLY,
    FILESYSTEM_WRITE,
    FILESYSTEM_DELETE,
    NETWORK,
    PROCESS_EXEC
}
