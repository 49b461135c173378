package com.dataworks.orchestrator.capability;

import java.util.Map;

/**
 * An executable action the orchestration loop can invoke by name.
 *
 * Implementations are Spring {@code @Component}s collected once into the
 * {@link CapabilityRegistry}. They are synchronous, keep no state between
 * calls, and may assume their arguments already passed both the schema check
 * and the sandbox guard.
 *
 * <p>Failures are reported either by returning {@link CapabilityResult#failure}
 * or by throwing; the registry converts anything thrown into a failed result,
 * so nothing escapes to the loop.
 */
public interface Capability {

    CapabilityDescriptor descriptor();

    /**
     * @throws CapabilityException on a controlled failure (bad input, I/O error)
     */
    CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) throws CapabilityException;
}
