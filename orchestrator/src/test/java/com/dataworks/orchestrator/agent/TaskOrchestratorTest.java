package com.dataworks.orchestrator.agent;

import com.dataworks.orchestrator.capability.*;
import com.dataworks.orchestrator.capability.impl.DeleteFileCapability;
import com.dataworks.orchestrator.capability.impl.ReadFileCapability;
import com.dataworks.orchestrator.capability.impl.WriteFileCapability;
import com.dataworks.orchestrator.config.OrchestratorProperties;
import com.dataworks.orchestrator.conversation.ConversationStore;
import com.dataworks.orchestrator.conversation.Turn;
import com.dataworks.orchestrator.conversation.TurnType;
import com.dataworks.orchestrator.decision.Decision;
import com.dataworks.orchestrator.decision.DecisionException;
import com.dataworks.orchestrator.decision.DecisionFunction;
import com.dataworks.orchestrator.sandbox.SandboxGuard;
import com.dataworks.orchestrator.sandbox.SandboxPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Orchestrator loop with real capabilities, guard and registry.
 * The decision function is scripted; no Spring context.
 */
class TaskOrchestratorTest {

    @TempDir Path workspace;

    OrchestratorProperties properties;
    SimpleMeterRegistry    meters;
    MutableClock           clock;
    CapabilityRegistry     registry;
    ScriptedDecisions      decisions;
    TaskOrchestrator       orchestrator;
    ConversationStore      conversation;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.getLoop().setIterationCap(10);
        meters   = new SimpleMeterRegistry();
        clock    = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        registry = new CapabilityRegistry(List.of(
                new ReadFileCapability(), new WriteFileCapability(), new DeleteFileCapability(), new Slow()),
                meters, properties);
        SandboxPolicy policy = new SandboxPolicy(workspace, 4096);
        decisions    = new ScriptedDecisions();
        orchestrator = new TaskOrchestrator(registry, new SandboxGuard(policy), policy, decisions,
                meters, new ObjectMapper(), clock, properties);
        conversation = new ConversationStore();
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private RunReport run(String task) {
        return orchestrator.run(new Task(UUID.randomUUID(), task, clock.instant()), "s-1", conversation);
    }

    private static Decision invoke(String capability, Map<String, Object> args) {
        return Decision.invoke(capability, args);
    }

    private static DecisionException parseError() {
        return new DecisionException(DecisionException.Kind.PARSE_ERROR, "no JSON action block found");
    }

    private static DecisionException unavailable() {
        return new DecisionException(DecisionException.Kind.UNAVAILABLE, "LLM API error 503");
    }

    // ------------------------------------------------------------------
    // Capability outcomes
    // ------------------------------------------------------------------

    @Test
    void writeThenFinal_succeeds() throws Exception {
        decisions.then(invoke("write_file", Map.of("path", "out.txt", "content", "hello")))
                 .then(Decision.finalAnswer("done"));

        RunReport report = run("write hello to out.txt");

        assertThat(report.outcome()).isEqualTo(RunOutcome.SUCCESS);
        assertThat(report.answer()).isEqualTo("done");
        assertThat(report.iterations()).isEqualTo(2);
        assertThat(Files.readString(workspace.resolve("out.txt"))).isEqualTo("hello");
        assertThat(report.turns()).extracting(Turn::type).containsExactly(
                TurnType.HUMAN, TurnType.DECISION, TurnType.OBSERVATION, TurnType.FINAL);
        assertThat(report.turns().get(2).error()).isNull();
        assertThat(meters.counter("dataworks.task.runs", "outcome", "success").count()).isEqualTo(1.0);
    }

    @Test
    void deleteRejected_loopContinues() throws Exception {
        Files.writeString(workspace.resolve("a.txt"), "keep me");
        decisions.then(invoke("delete_file", Map.of("path", "a.txt")))
                 .then(Decision.finalAnswer("could not delete"));

        RunReport report = run("delete a.txt");

        assertThat(report.outcome()).isEqualTo(RunOutcome.SUCCESS);
        assertThat(report.turns().get(2).error()).isEqualTo("rejected: delete not permitted");
        assertThat(workspace.resolve("a.txt")).exists();
    }

    @Test
    void readOutsideWorkspace_rejectedWithoutContent() {
        decisions.then(invoke("read_file", Map.of("path", "/etc/passwd")))
                 .then(Decision.finalAnswer("refused"));

        RunReport report = run("show /etc/passwd");

        Turn observation = report.turns().get(2);
        assertThat(observation.error()).isEqualTo("rejected: path outside workspace: /etc/passwd");
        assertThat(observation.content()).isNull();
        assertThat(report.turns()).noneMatch(t -> t.content() != null && t.content().contains("root:"));
    }

    @Test
    void timeoutRecorded_loopContinues() {
        decisions.then(invoke("slow", Map.of()))
                 .then(Decision.finalAnswer("gave up waiting"));

        RunReport report = run("do something slow");

        assertThat(report.outcome()).isEqualTo(RunOutcome.SUCCESS);
        assertThat(report.turns().get(2).error()).isEqualTo("timeout");
        assertThat(report.iterations()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Recording
    // ------------------------------------------------------------------

    @Test
    void unknownCapability_recordedAsObservation() {
        decisions.then(invoke("teleport", Map.of("to", "mars")))
                 .then(Decision.finalAnswer("no teleporter"));

        RunReport report = run("go to mars");

        assertThat(report.turns().get(2).capability()).isEqualTo("teleport");
        assertThat(report.turns().get(2).error()).isEqualTo("unknown capability");
    }

    @Test
    void successfulPayload_renderedIntoObservation() throws Exception {
        Files.writeString(workspace.resolve("n.txt"), "forty-two");
        decisions.then(invoke("read_file", Map.of("path", "n.txt")))
                 .then(Decision.finalAnswer("42"));

        RunReport report = run("read n.txt");

        assertThat(report.turns().get(2).content()).isEqualTo("forty-two");
    }

    @Test
    void everyDecision_hasExactlyOneObservation() throws Exception {
        Files.writeString(workspace.resolve("x.txt"), "x");
        decisions.then(invoke("read_file", Map.of("path", "x.txt")))
                 .then(parseError())
                 .then(invoke("delete_file", Map.of("path", "x.txt")))
                 .then(invoke("read_file", Map.of()))
                 .then(unavailable())
                 .then(invoke("nope", Map.of()))
                 .then(invoke("slow", Map.of()))
                 .then(Decision.finalAnswer("ok"));

        RunReport report = run("mixed bag");

        List<Turn> turns = report.turns();
        long decisionTurns = turns.stream().filter(t -> t.type() == TurnType.DECISION).count();
        long answered      = turns.stream().filter(Turn::answersDecision).count();
        assertThat(decisionTurns).isEqualTo(5);
        assertThat(answered).isEqualTo(decisionTurns);
        for (int i = 0; i < turns.size(); i++) {
            if (turns.get(i).type() == TurnType.DECISION) {
                assertThat(turns.get(i + 1).answersDecision()).isTrue();
                assertThat(turns.get(i + 1).capability()).isEqualTo(turns.get(i).capability());
            }
        }
    }

    // ------------------------------------------------------------------
    // Budgets
    // ------------------------------------------------------------------

    @Test
    void iterationCap_haltsRun() {
        properties.getLoop().setIterationCap(5);
        decisions.fallback = invoke("read_file", Map.of("path", "missing.txt"));

        RunReport report = run("loop forever");

        assertThat(report.outcome()).isEqualTo(RunOutcome.EXHAUSTED);
        assertThat(report.reason()).isEqualTo("iteration cap of 5 reached");
        assertThat(decisions.calls()).isEqualTo(5);
        assertThat(report.iterations()).isEqualTo(5);
    }

    @Test
    void deadline_haltsRun() {
        properties.getLoop().setDeadline(Duration.ofMinutes(2).plusSeconds(30));
        decisions.fallback = invoke("read_file", Map.of("path", "missing.txt"));
        decisions.onCall = () -> clock.advance(Duration.ofMinutes(1));

        RunReport report = run("slow thinker");

        assertThat(report.outcome()).isEqualTo(RunOutcome.EXHAUSTED);
        assertThat(report.reason()).startsWith("deadline of");
        assertThat(decisions.calls()).isEqualTo(3);
        assertThat(report.elapsed()).isEqualTo(Duration.ofMinutes(3));
    }

    @Test
    void interruptedThread_endsRunAsCancelled() {
        decisions.fallback = Decision.finalAnswer("never");
        Thread.currentThread().interrupt();
        try {
            RunReport report = run("cancel me");

            assertThat(report.outcome()).isEqualTo(RunOutcome.EXHAUSTED);
            assertThat(report.reason()).isEqualTo("cancelled");
            assertThat(decisions.calls()).isZero();
        } finally {
            Thread.interrupted();
        }
    }

    // ------------------------------------------------------------------
    // Decision failures
    // ------------------------------------------------------------------

    @Test
    void parseError_thenRecovery_succeeds() {
        decisions.then(parseError()).then(Decision.finalAnswer("fine"));

        RunReport report = run("t");

        assertThat(report.outcome()).isEqualTo(RunOutcome.SUCCESS);
        Turn synthetic = report.turns().get(1);
        assertThat(synthetic.type()).isEqualTo(TurnType.OBSERVATION);
        assertThat(synthetic.capability()).isNull();
        assertThat(synthetic.error()).contains("no JSON action block found");
    }

    @Test
    void repeatedParseErrors_becomeFatal() {
        decisions.fallback = parseError();

        RunReport report = run("t");

        assertThat(report.outcome()).isEqualTo(RunOutcome.FATAL);
        assertThat(decisions.calls()).isEqualTo(4);
        assertThat(report.reason()).startsWith("decision function failed 4 times in a row");
        assertThat(report.turns()).filteredOn(t -> t.type() == TurnType.OBSERVATION).hasSize(4);
        assertThat(meters.counter("dataworks.task.runs", "outcome", "fatal").count()).isEqualTo(1.0);
    }

    @Test
    void parseAndUpstreamFailures_shareOneCounter() {
        decisions.then(parseError()).then(unavailable()).then(parseError()).then(unavailable());

        RunReport report = run("t");

        assertThat(report.outcome()).isEqualTo(RunOutcome.FATAL);
        // upstream failures leave no turn behind
        assertThat(report.turns()).filteredOn(t -> t.type() == TurnType.OBSERVATION).hasSize(2);
    }

    @Test
    void successfulDecision_resetsFailureCounter() {
        decisions.then(parseError()).then(parseError()).then(parseError())
                 .then(invoke("read_file", Map.of("path", "missing.txt")))
                 .then(parseError()).then(parseError()).then(parseError())
                 .then(Decision.finalAnswer("made it"));

        RunReport report = run("t");

        assertThat(report.outcome()).isEqualTo(RunOutcome.SUCCESS);
    }

    @Test
    void unexpectedException_isFatalNotThrown() {
        decisions.then(new IllegalStateException("boom"));

        RunReport report = run("t");

        assertThat(report.outcome()).isEqualTo(RunOutcome.FATAL);
        assertThat(report.reason()).isEqualTo("unexpected error: boom");
    }

    // ------------------------------------------------------------------
    // Window
    // ------------------------------------------------------------------

    @Test
    void window_alwaysContainsThisRunsHumanTurn() {
        properties.getLoop().setWindowSize(2);
        conversation.append(Turn.human("an earlier task", clock.instant()));
        conversation.append(Turn.finalAnswer("earlier answer", clock.instant()));
        decisions.then(invoke("read_file", Map.of("path", "a")))
                 .then(invoke("read_file", Map.of("path", "b")))
                 .then(Decision.finalAnswer("done"));

        run("the current task");

        assertThat(decisions.windows).hasSize(3);
        for (List<Turn> window : decisions.windows) {
            assertThat(window).anyMatch(t -> t.type() == TurnType.HUMAN && t.content().equals("the current task"));
            assertThat(window.size()).isLessThanOrEqualTo(3);
        }
        // once this run's task has scrolled out, it is put back in front
        assertThat(decisions.windows.get(2)).extracting(Turn::type)
                .containsExactly(TurnType.HUMAN, TurnType.DECISION, TurnType.OBSERVATION);
    }

    @Test
    void priorTurnsOfSession_areKeptButNotReported() {
        conversation.append(Turn.human("earlier", clock.instant()));
        decisions.then(Decision.finalAnswer("now"));

        RunReport report = run("current");

        assertThat(conversation.size()).isEqualTo(3);
        assertThat(report.turns()).hasSize(2);
        assertThat(report.sessionId()).isEqualTo("s-1");
    }

    // ------------------------------------------------------------------
    // Test doubles
    // ------------------------------------------------------------------

    /** Returns scripted steps in order, then {@link #fallback} forever. */
    static class ScriptedDecisions implements DecisionFunction {
        final Deque<Object>    script  = new ArrayDeque<>();
        final List<List<Turn>> windows = new ArrayList<>();
        Object   fallback;
        Runnable onCall = () -> {};

        ScriptedDecisions then(Object step) {
            script.add(step);
            return this;
        }

        int calls() {
            return windows.size();
        }

        @Override
        public Decision decide(List<Turn> window, List<CapabilityDescriptor> capabilities) {
            windows.add(window);
            onCall.run();
            Object step = script.isEmpty() ? fallback : script.poll();
            if (step instanceof RuntimeException) {
                throw (RuntimeException) step;
            }
            return (Decision) step;
        }
    }

    static class Slow implements Capability {
        @Override public CapabilityDescriptor descriptor() {
            return new CapabilityDescriptor("slow", "1.0.0", "Never finishes in time.",
                    ArgumentSchema.of(), SideEffectClass.NETWORK, Duration.ofMillis(100));
        }
        @Override public CapabilityResult invoke(Map<String, Object> args, CapabilityContext ctx) {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CapabilityResult.ok("late");
        }
    }

    static class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) { this.now = start; }

        void advance(Duration d) { now = now.plus(d); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }
}
