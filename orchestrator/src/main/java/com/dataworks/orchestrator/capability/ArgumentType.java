package com.dataworks.orchestrator.capability;

/**
 * Declared type of a capability argument.
 *
 * PATH and COMMAND are strings that carry sandbox meaning: every PATH value is
 * resolved and confined to the workspace root, and a COMMAND value is
 * length-checked before a process is spawned.
 */
public enum ArgumentType {
    STRING,
    PATH,
    COMMAND,
    INTEGER,
    BOOLEAN,
    OBJECT;

    boolean accepts(Object value) {
        return switch (this) {
            case STRING, PATH, COMMAND -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT  -> value instanceof java.util.Map<?, ?>;
        };
    }

    /** Lower-case name shown to the decision function, e.g. "path". */
    public String label() {
        return name().toLowerCase();
    }
}
