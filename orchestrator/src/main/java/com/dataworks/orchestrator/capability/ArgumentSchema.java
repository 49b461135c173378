package com.dataworks.orchestrator.capability;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered argument declaration for a capability.
 *
 * The registry checks every invocation against it before the capability runs,
 * and the sandbox guard uses it to find PATH and COMMAND arguments.
 */
public record ArgumentSchema(List<ArgumentSpec> arguments) {

    public ArgumentSchema {
        arguments = List.copyOf(arguments);
    }

    public static ArgumentSchema of(ArgumentSpec... arguments) {
        return new ArgumentSchema(List.of(arguments));
    }

    public List<ArgumentSpec> ofType(ArgumentType type) {
        return arguments.stream().filter(a -> a.type() == type).toList();
    }

    /**
     * Returns a human-readable list of problems with {@code args}; empty when valid.
     * Null values are treated as absent.
     */
    public List<String> validate(Map<String, Object> args) {
        List<String> problems = new ArrayList<>();
        for (ArgumentSpec spec : arguments) {
            Object value = args.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    problems.add("missing required argument '" + spec.name() + "'");
                }
            } else if (!spec.type().accepts(value)) {
                problems.add("argument '" + spec.name() + "' must be of type " + spec.type().label());
            }
        }
        for (String key : args.keySet()) {
            if (arguments.stream().noneMatch(a -> a.name().equals(key))) {
                problems.add("unknown argument '" + key + "'");
            }
        }
        return problems;
    }

    /** Python-style signature, e.g. {@code write_file(path: path, content: string, append?: boolean)}. */
    public String signature(String capabilityName) {
        return arguments.stream()
                .map(a -> a.name() + (a.required() ? "" : "?") + ": " + a.type().label())
                .collect(Collectors.joining(", ", capabilityName + "(", ")"));
    }
}
