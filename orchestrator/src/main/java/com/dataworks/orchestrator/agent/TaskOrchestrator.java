package com.dataworks.orchestrator.agent;

import com.dataworks.orchestrator.capability.Capability;
import com.dataworks.orchestrator.capability.CapabilityContext;
import com.dataworks.orchestrator.capability.CapabilityRegistry;
import com.dataworks.orchestrator.capability.CapabilityResult;
import com.dataworks.orchestrator.config.OrchestratorProperties;
import com.dataworks.orchestrator.conversation.ConversationStore;
import com.dataworks.orchestrator.conversation.Turn;
import com.dataworks.orchestrator.decision.Decision;
import com.dataworks.orchestrator.decision.DecisionException;
import com.dataworks.orchestrator.decision.DecisionFunction;
import com.dataworks.orchestrator.sandbox.SandboxGuard;
import com.dataworks.orchestrator.sandbox.SandboxPolicy;
import com.dataworks.orchestrator.sandbox.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The decide → validate → invoke → record loop.
 *
 * For one task this class:
 *   1. Appends the task as a HUMAN turn to the session's conversation
 *   2. Asks the decision function for the next step, showing it a bounded
 *      window of recent turns
 *   3. For a capability request: appends a DECISION turn, runs the sandbox
 *      guard, invokes the capability through the registry and appends exactly
 *      one OBSERVATION turn with the result, whatever it was
 *   4. Repeats until a final answer, or until the iteration cap, the
 *      deadline or a cancellation stops it
 *
 * The loop never throws: every path ends in a {@link RunReport}.
 */
@Component
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final CapabilityRegistry     registry;
    private final SandboxGuard           guard;
    private final SandboxPolicy          sandbox;
    private final DecisionFunction       decisionFunction;
    private final MeterRegistry          meterRegistry;
    private final ObjectMapper           objectMapper;
    private final Clock                  clock;
    private final OrchestratorProperties properties;

    public TaskOrchestrator(CapabilityRegistry registry,
                            SandboxGuard guard,
                            SandboxPolicy sandbox,
                            DecisionFunction decisionFunction,
                            MeterRegistry meterRegistry,
                            ObjectMapper objectMapper,
                            Clock clock,
                            OrchestratorProperties properties) {
        this.registry         = registry;
        this.guard            = guard;
        this.sandbox          = sandbox;
        this.decisionFunction = decisionFunction;
        this.meterRegistry    = meterRegistry;
        this.objectMapper     = objectMapper;
        this.clock            = clock;
        this.properties       = properties;
    }

    // ------------------------------------------------------------------
    // Entry point (called by TaskService on a worker thread)
    // ------------------------------------------------------------------

    /**
     * Run one task to a terminal state against the given conversation.
     *
     * The caller must hold the session lease for {@code conversation}.
     */
    public RunReport run(Task task, String sessionId, ConversationStore conversation) {
        MDC.put("taskId",    task.id().toString());
        MDC.put("sessionId", sessionId);
        try {
            Instant started = clock.instant();
            OrchestratorProperties.Loop loop = properties.getLoop();
            RunState state = new RunState(loop.getIterationCap(), started.plus(loop.getDeadline()));

            int firstTurn = conversation.size();
            Turn human = Turn.human(task.description(), started);
            conversation.append(human);
            log.info("Run started: cap={} deadline={}", loop.getIterationCap(), loop.getDeadline());

            RunReport report;
            try {
                report = loop(task, sessionId, conversation, state, human, firstTurn, started);
            } catch (RuntimeException e) {
                log.error("Run aborted by unexpected error: {}", e.toString(), e);
                report = RunReport.fatal(task.id(), sessionId, "unexpected error: " + e.getMessage(),
                        state.iterations(), elapsedSince(started), conversation.since(firstTurn));
            }

            meterRegistry.counter("dataworks.task.runs",
                    "outcome", report.outcome().name().toLowerCase()).increment();
            if (report.outcome() == RunOutcome.FATAL) {
                log.error("Run failed after {} iterations: {}", report.iterations(), report.reason());
            } else {
                log.info("Run finished: outcome={} iterations={} elapsed={}",
                        report.outcome(), report.iterations(), report.elapsed());
            }
            return report;
        } finally {
            // Worker threads are pooled; context must not leak into the next run.
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private RunReport loop(Task task, String sessionId, ConversationStore conversation,
                           RunState state, Turn human, int firstTurn, Instant started) {
        int windowSize      = properties.getLoop().getWindowSize();
        int decisionRetries = properties.getLoop().getDecisionRetries();

        while (true) {
            String stop = stopReason(state);
            if (stop != null) {
                log.warn("Run exhausted: {}", stop);
                return RunReport.exhausted(task.id(), sessionId, stop,
                        state.iterations(), elapsedSince(started), conversation.since(firstTurn));
            }

            state.beginDecision();
            log.debug("Iteration {}/{}", state.iterations(), state.iterationCap());

            Decision decision;
            try {
                decision = decisionFunction.decide(
                        window(conversation, windowSize, human, firstTurn), registry.descriptors());
            } catch (DecisionException e) {
                int failures = state.recordDecisionFailure();
                if (e.getKind() == DecisionException.Kind.PARSE_ERROR) {
                    conversation.append(Turn.parseFailure(e.getMessage(), clock.instant()));
                }
                log.warn("Decision failed ({}, {} in a row): {}", e.getKind(), failures, e.getMessage());
                if (failures > decisionRetries) {
                    return RunReport.fatal(task.id(), sessionId,
                            "decision function failed %d times in a row: %s".formatted(failures, e.getMessage()),
                            state.iterations(), elapsedSince(started), conversation.since(firstTurn));
                }
                continue;
            }
            state.resetDecisionFailures();

            if (decision == null) {
                throw new IllegalStateException("decision function returned null");
            }
            if (decision.isFinal()) {
                String answer = decision.answer() == null ? "" : decision.answer();
                conversation.append(Turn.finalAnswer(answer, clock.instant()));
                return RunReport.success(task.id(), sessionId, answer,
                        state.iterations(), elapsedSince(started), conversation.since(firstTurn));
            }

            String name = decision.capability();
            Map<String, Object> arguments = decision.arguments() == null ? Map.of() : decision.arguments();
            conversation.append(Turn.decision(name, arguments, clock.instant()));

            CapabilityResult result = execute(task, name, arguments, state);
            conversation.append(Turn.observation(name, render(result.payload()), result.error(), clock.instant()));
        }
    }

    /** Null while the run may continue; otherwise why it must stop. */
    private String stopReason(RunState state) {
        if (state.capReached()) {
            return "iteration cap of " + state.iterationCap() + " reached";
        }
        if (state.deadlinePassed(clock.instant())) {
            return "deadline of " + properties.getLoop().getDeadline() + " exceeded";
        }
        if (Thread.currentThread().isInterrupted()) {
            return "cancelled";
        }
        return null;
    }

    /** Validate, then invoke. A rejected call never reaches the capability. */
    private CapabilityResult execute(Task task, String name, Map<String, Object> arguments, RunState state) {
        Optional<Capability> capability = registry.find(name);
        if (capability.isPresent()) {
            ValidationResult validation = guard.validate(capability.get().descriptor(), arguments);
            if (validation.rejected()) {
                log.warn("Rejected {}: {}", name, validation.reason());
                return CapabilityResult.rejected(validation.reason());
            }
        }
        CapabilityContext ctx = new CapabilityContext(task.id(), sandbox,
                properties.getCapabilities().getMaxOutputChars());
        CapabilityResult result = registry.invoke(name, arguments, ctx, state.remaining(clock.instant()));
        if (!result.success()) {
            log.warn("Capability {} failed: {}", name, result.error());
        } else {
            log.debug("Capability {} succeeded", name);
        }
        return result;
    }

    /**
     * The last {@code size} turns, with this run's HUMAN turn put back in
     * front when it has scrolled out.
     */
    static List<Turn> window(ConversationStore conversation, int size, Turn human, int humanIndex) {
        List<Turn> recent = conversation.window(size);
        int firstShown = conversation.size() - recent.size();
        if (firstShown <= humanIndex) {
            return recent;
        }
        List<Turn> withTask = new ArrayList<>(recent.size() + 1);
        withTask.add(human);
        withTask.addAll(recent);
        return withTask;
    }

    private String render(Object payload) {
        if (payload == null || payload instanceof String) {
            return (String) payload;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return String.valueOf(payload);
        }
    }

    private Duration elapsedSince(Instant started) {
        return Duration.between(started, clock.instant());
    }
}
