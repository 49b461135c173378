package com.dataworks.orchestrator.sandbox;

import com.dataworks.orchestrator.capability.ArgumentSpec;
import com.dataworks.orchestrator.capability.ArgumentType;
import com.dataworks.orchestrator.capability.CapabilityDescriptor;
import com.dataworks.orchestrator.capability.SideEffectClass;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * The single enforcement point for "stay inside the workspace" and "never delete".
 *
 * Runs before every capability invocation and has no side effects. Rules, in order:
 * <ol>
 *   <li>FILESYSTEM_DELETE capabilities are refused whatever their arguments.</li>
 *   <li>Every PATH argument must resolve (after symlink and {@code ..}
 *       resolution) to the workspace root or below.</li>
 *   <li>PROCESS_EXEC capabilities need non-blank COMMAND text no longer than
 *       the configured limit.</li>
 * </ol>
 *
 * <p>Known limitation: command text is not parsed. A shell command can still
 * reach outside the workspace or delete files through its own content; only
 * the declared arguments are policed here.
 */
@Component
public class SandboxGuard {

    public static final String DELETE_NOT_PERMITTED = "delete not permitted";

    private final SandboxPolicy policy;

    public SandboxGuard(SandboxPolicy policy) {
        this.policy = policy;
    }

    public ValidationResult validate(CapabilityDescriptor descriptor, Map<String, Object> arguments) {
        if (descriptor.sideEffect() == SideEffectClass.FILESYSTEM_DELETE && !policy.allowDelete()) {
            return ValidationResult.rejected(DELETE_NOT_PERMITTED);
        }

        for (ArgumentSpec spec : descriptor.schema().ofType(ArgumentType.PATH)) {
            Object value = arguments.get(spec.name());
            if (value == null) {
                continue;
            }
            if (!(value instanceof String)) {
                return ValidationResult.rejected("path argument '" + spec.name() + "' must be a string");
            }
            try {
                policy.resolve((String) value);
            } catch (SandboxViolationException e) {
                return ValidationResult.rejected(e.getReason());
            }
        }

        if (descriptor.sideEffect() == SideEffectClass.PROCESS_EXEC) {
            for (ArgumentSpec spec : descriptor.schema().ofType(ArgumentType.COMMAND)) {
                Object value = arguments.get(spec.name());
                if (!(value instanceof String) || ((String) value).isBlank()) {
                    return ValidationResult.rejected("empty command");
                }
                int length = ((String) value).length();
                if (length > policy.maxCommandLength()) {
                    return ValidationResult.rejected("command is %d characters (limit: %d)"
                            .formatted(length, policy.maxCommandLength()));
                }
            }
        }

        return ValidationResult.ok();
    }
}
