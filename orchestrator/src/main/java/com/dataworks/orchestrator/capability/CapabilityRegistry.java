package com.dataworks.orchestrator.capability;

import com.dataworks.orchestrator.config.OrchestratorProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide capability table.
 *
 * All {@link Capability} beans are collected at startup via constructor
 * injection and frozen into an immutable name → capability map. There is no
 * runtime discovery: a capability the decision function asks for either is in
 * this table or yields an "unknown capability" result.
 *
 * <p>Responsibilities:
 * <ol>
 *   <li>Lookup by exact name ({@link #find}).</li>
 *   <li>Guarded execution ({@link #invoke}): schema check, per-capability
 *       timeout, exception capture, metrics. It never throws and never retries.</li>
 *   <li>Tool documentation for the decision function's prompt
 *       ({@link #buildToolDocumentation}).</li>
 * </ol>
 */
@Component
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, Capability> capabilities;
    private final MeterRegistry           meterRegistry;
    private final OrchestratorProperties.Capabilities settings;

    // Invocations run here so a stuck capability can be abandoned at its timeout.
    private final ExecutorService invocationPool;

    public CapabilityRegistry(List<Capability> allCapabilities,
                              MeterRegistry meterRegistry,
                              OrchestratorProperties properties) {
        this.meterRegistry = meterRegistry;
        this.settings      = properties.getCapabilities();

        Map<String, Capability> table = new LinkedHashMap<>();
        allCapabilities.stream()
                .sorted(Comparator.comparing(c -> c.descriptor().name()))
                .forEach(c -> {
                    CapabilityDescriptor d = c.descriptor();
                    if (table.putIfAbsent(d.name(), c) != null) {
                        throw new IllegalStateException("Duplicate capability name: " + d.name());
                    }
                    log.info("Registered capability '{}' v{} [{}] timeout={}",
                            d.name(), d.version(), d.sideEffect(), timeoutFor(d));
                });
        this.capabilities = Map.copyOf(table);

        AtomicInteger threadSeq = new AtomicInteger();
        this.invocationPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "capability-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        invocationPool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<Capability> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(capabilities.get(name));
    }

    /** All descriptors, sorted by name. */
    public List<CapabilityDescriptor> descriptors() {
        return capabilities.values().stream()
                .map(Capability::descriptor)
                .sorted(Comparator.comparing(CapabilityDescriptor::name))
                .toList();
    }

    public List<String> capabilityNames() {
        return capabilities.keySet().stream().sorted().toList();
    }

    /**
     * Effective timeout: configured override for the name, else the
     * descriptor's own value, else the default for its side-effect class.
     */
    public Duration timeoutFor(CapabilityDescriptor d) {
        Duration override = settings.getTimeouts().get(d.name());
        if (override != null) {
            return override;
        }
        if (d.timeout() != null) {
            return d.timeout();
        }
        return switch (d.sideEffect()) {
            case NETWORK      -> settings.getNetworkTimeout();
            case PROCESS_EXEC -> settings.getProcessTimeout();
            default           -> settings.getDefaultTimeout();
        };
    }

    // ------------------------------------------------------------------
    // Guarded execution
    // ------------------------------------------------------------------

    public CapabilityResult invoke(String name, Map<String, Object> arguments, CapabilityContext ctx) {
        return invoke(name, arguments, ctx, null);
    }

    /**
     * Invoke a capability by name and always return a result.
     *
     * Every call is timed and counted:
     * <pre>
     *   dataworks.capability.calls{capability, status="success|failure|timeout|unknown|invalid"}
     *   dataworks.capability.duration{capability, side_effect}
     * </pre>
     *
     * @param budget upper bound on how long the caller can wait (e.g. time left
     *               before the run deadline); null means no extra bound
     */
    public CapabilityResult invoke(String name, Map<String, Object> arguments,
                                   CapabilityContext ctx, Duration budget) {
        Capability capability = name == null ? null : capabilities.get(name);
        if (capability == null) {
            count(String.valueOf(name), "unknown");
            return CapabilityResult.failure(CapabilityResult.UNKNOWN_CAPABILITY);
        }

        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        CapabilityDescriptor d = capability.descriptor();
        List<String> problems = d.schema().validate(args);
        if (!problems.isEmpty()) {
            count(name, "invalid");
            return CapabilityResult.failure("invalid arguments: " + String.join("; ", problems));
        }

        Duration timeout = timeoutFor(d);
        if (budget != null && budget.compareTo(timeout) < 0) {
            timeout = budget.isNegative() ? Duration.ZERO : budget;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        CapabilityResult result = runWithTimeout(capability, args, ctx, timeout);
        sample.stop(meterRegistry.timer("dataworks.capability.duration",
                "capability", name, "side_effect", d.sideEffect().name().toLowerCase()));

        String status = result.success() ? "success" : result.isTimeout() ? "timeout" : "failure";
        count(name, status);
        return result;
    }

    private CapabilityResult runWithTimeout(Capability capability, Map<String, Object> args,
                                            CapabilityContext ctx, Duration timeout) {
        String name = capability.descriptor().name();
        Future<CapabilityResult> future = invocationPool.submit(() -> capability.invoke(args, ctx));
        try {
            CapabilityResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : CapabilityResult.ok(null);
        } catch (TimeoutException e) {
            // Best effort: interrupts the worker; side effects already applied stay applied.
            future.cancel(true);
            log.warn("Capability '{}' timed out after {}", name, timeout);
            return CapabilityResult.timeout();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CapabilityException
                    && ((CapabilityException) cause).getKind() == CapabilityException.Kind.TIMEOUT) {
                return CapabilityResult.timeout();
            }
            log.warn("Capability '{}' failed: {}", name, cause.toString());
            return CapabilityResult.failure(describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return CapabilityResult.failure("interrupted");
        }
    }

    private static String describe(Throwable t) {
        if (t instanceof CapabilityException) {
            return t.getMessage();
        }
        String message = t.getMessage();
        return t.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private void count(String name, String status) {
        meterRegistry.counter("dataworks.capability.calls", "capability", name, "status", status).increment();
    }

    // ------------------------------------------------------------------
    // Tool documentation
    // ------------------------------------------------------------------

    /**
     * The AVAILABLE CAPABILITIES block injected into the decision prompt.
     * Derived from live descriptors, so it always matches the registered set.
     */
    public String buildToolDocumentation() {
        return toolDocumentation(descriptors());
    }

    public static String toolDocumentation(List<CapabilityDescriptor> descriptors) {
        StringBuilder sb = new StringBuilder("AVAILABLE CAPABILITIES:\n");
        for (CapabilityDescriptor d : descriptors) {
            sb.append("  ").append(d.signature())
              .append("  [").append(d.sideEffect().name().toLowerCase()).append("]\n");
            sb.append("      ").append(d.description()).append("\n");
            d.schema().arguments().forEach(a ->
                    sb.append("        - ").append(a.name()).append(": ").append(a.description()).append("\n"));
            sb.append("\n");
        }
        return sb.toString();
    }
}
