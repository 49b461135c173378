package com.dataworks.orchestrator.service;

import com.dataworks.orchestrator.agent.RunReport;
import com.dataworks.orchestrator.agent.Task;
import com.dataworks.orchestrator.agent.TaskOrchestrator;
import com.dataworks.orchestrator.config.OrchestratorProperties;
import com.dataworks.orchestrator.conversation.ConversationSessions;
import com.dataworks.orchestrator.conversation.ConversationStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Task intake.
 *
 * Each task runs on a fixed pool of worker threads so the number of
 * concurrent runs (and concurrent model conversations) is capped by
 * {@code dataworks.workers}. The HTTP thread waits for the result.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    // How long past the run deadline we wait before giving up on a worker.
    static final Duration GRACE = Duration.ofSeconds(30);

    private final TaskOrchestrator       orchestrator;
    private final ConversationSessions   sessions;
    private final OrchestratorProperties properties;
    private final Clock                  clock;
    private final ExecutorService        workers;
    private final Duration               grace;

    @Autowired
    public TaskService(TaskOrchestrator orchestrator,
                       ConversationSessions sessions,
                       OrchestratorProperties properties,
                       Clock clock) {
        this(orchestrator, sessions, properties, clock, GRACE);
    }

    TaskService(TaskOrchestrator orchestrator,
                ConversationSessions sessions,
                OrchestratorProperties properties,
                Clock clock,
                Duration grace) {
        this.grace        = grace;
        this.orchestrator = orchestrator;
        this.sessions     = sessions;
        this.properties   = properties;
        this.clock        = clock;

        AtomicInteger threadSeq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(properties.getWorkers(), r -> {
            Thread t = new Thread(r, "task-worker-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    /**
     * Run a task to completion and return its terminal report.
     *
     * The wait of deadline plus grace starts when a worker picks the
     * task up, so time spent queued is not charged to it. The session stays
     * leased until the worker has actually returned, even after the caller
     * gave up on it. A session the server named for this run is discarded
     * afterwards instead of kept.
     *
     * @param sessionId existing or new session; null or blank starts a fresh one
     * @throws com.dataworks.orchestrator.conversation.SessionBusyException
     *         if another task is running on the same session
     */
    public RunReport run(String description, String sessionId) {
        boolean anonymous = sessionId == null || sessionId.isBlank();
        String session = anonymous ? sessions.newSessionId() : sessionId;
        ConversationStore conversation = sessions.lease(session);
        Task task = Task.of(description, clock);
        Instant submitted = clock.instant();
        Duration wait = properties.getLoop().getDeadline().plus(grace);

        // Whoever sets this first owns the lease: the worker when it starts,
        // or the caller abandoning a task that is still queued.
        AtomicBoolean claimed = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);
        Future<RunReport> future;
        try {
            future = workers.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                started.countDown();
                try {
                    return orchestrator.run(task, session, conversation);
                } finally {
                    close(session, anonymous);
                }
            });
        } catch (RejectedExecutionException e) {
            close(session, anonymous);
            throw e;
        }

        try {
            if (!awaitStart(started)) {
                abandonQueued(future, claimed, session, anonymous);
                return RunReport.exhausted(task.id(), session, "worker pool shut down before the task started",
                        0, Duration.between(submitted, clock.instant()), List.of());
            }
            return future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Task {} did not finish within {} of starting; cancelled", task.id(), wait);
            return RunReport.exhausted(task.id(), session, "run did not finish within " + wait,
                    0, Duration.between(submitted, clock.instant()), List.of());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unhandled error running task {}: {}", task.id(), cause.getMessage(), cause);
            return RunReport.fatal(task.id(), session, "unexpected error: " + cause.getMessage(),
                    0, Duration.between(submitted, clock.instant()), List.of());
        } catch (InterruptedException e) {
            abandonQueued(future, claimed, session, anonymous);
            Thread.currentThread().interrupt();
            return RunReport.exhausted(task.id(), session, "cancelled",
                    0, Duration.between(submitted, clock.instant()), List.of());
        }
    }

    private boolean awaitStart(CountDownLatch started) throws InterruptedException {
        while (!started.await(1, TimeUnit.SECONDS)) {
            if (workers.isShutdown()) {
                return started.getCount() == 0;
            }
        }
        return true;
    }

    // Cancels the task; releases the lease here only if the worker never took it.
    private void abandonQueued(Future<RunReport> future, AtomicBoolean claimed,
                               String session, boolean anonymous) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            close(session, anonymous);
        }
    }

    private void close(String session, boolean anonymous) {
        if (anonymous) {
            sessions.discard(session);
        } else {
            sessions.release(session);
        }
    }
}
