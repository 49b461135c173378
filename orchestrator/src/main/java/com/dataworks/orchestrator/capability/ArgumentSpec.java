package com.dataworks.orchestrator.capability;

/**
 * One named argument of a capability.
 *
 * @param name        key the decision function must use in its arguments object
 * @param type        declared type; PATH and COMMAND drive sandbox checks
 * @param required    whether the argument must be present
 * @param description one-line hint injected into the tool documentation
 */
public record ArgumentSpec(String name, ArgumentType type, boolean required, String description) {

    public static ArgumentSpec required(String name, ArgumentType type, String description) {
        return new ArgumentSpec(name, type, true, description);
    }

    public static ArgumentSpec optional(String name, ArgumentType type, String description) {
        return new ArgumentSpec(name, type, false, description);
    }
}
