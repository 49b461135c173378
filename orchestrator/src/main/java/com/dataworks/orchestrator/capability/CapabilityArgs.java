package com.dataworks.orchestrator.capability;

import java.util.Map;

/**
 * Typed accessors over an already schema-checked argument map.
 */
public final class CapabilityArgs {

    private CapabilityArgs() {}

    public static String string(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (!(value instanceof String)) {
            throw new CapabilityException(CapabilityException.Kind.INVALID_ARGUMENT,
                    "argument '" + name + "' is required");
        }
        return (String) value;
    }

    public static String string(Map<String, Object> args, String name, String defaultValue) {
        Object value = args.get(name);
        return value instanceof String ? (String) value : defaultValue;
    }

    public static boolean bool(Map<String, Object> args, String name, boolean defaultValue) {
        Object value = args.get(name);
        return value instanceof Boolean ? (Boolean) value : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> object(Map<String, Object> args, String name) {
        Object value = args.get(name);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }
}
