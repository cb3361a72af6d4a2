package com.taskpilot.engine.service;

import com.taskpilot.engine.agent.ExecutionEngine;
import com.taskpilot.engine.agent.ExecutionOutcome;
import com.taskpilot.engine.checkpoint.CheckpointCorruptedException;
import com.taskpilot.engine.checkpoint.CheckpointStore;
import com.taskpilot.engine.config.AgentProperties;
import com.taskpilot.engine.interrupt.InterruptRouter;
import com.taskpilot.engine.model.IllegalTaskTransitionException;
import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskComment;
import com.taskpilot.engine.model.TaskStatus;
import com.taskpilot.engine.retry.FailureClassifier;
import com.taskpilot.engine.retry.FailureKind;
import com.taskpilot.engine.retry.RetryPolicy;
import com.taskpilot.engine.store.TaskStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The top-level control loop.
 *
 * Every cycle, unless paused or already busy:
 *   1. Recovery: an IN_PROGRESS task that nobody is running (left behind by a
 *      crash or by a failed interrupt routing) is picked up from its checkpoint
 *   2. Otherwise the next eligible task is claimed:
 *        USER_INPUT_RECEIVED, then NEW, then WAITING once its recheck interval
 *        has passed; oldest first within each status; tasks still inside their
 *        thread-stabilization window are skipped
 *   3. The task goes to IN_PROGRESS and the execution engine runs it; the
 *      outcome decides where it goes next:
 *        Completed  → DONE (or CANCELLED if the agent asked for it)
 *        Suspended  → interrupt router (NEEDS_REVIEW + comment)
 *        Deferred   → WAITING
 *        Failed     → retried with backoff while retryable and budget remains,
 *                     then ERROR + error comment
 *   When nothing was eligible the loop sleeps for the poll interval.
 *
 * Single-flight: {@link #inFlight} holds the one task being executed. The loop
 * and {@link #forceProcess} both claim through it, so at most one task is ever
 * IN_PROGRESS on behalf of this instance.
 *
 * Pause only gates step 2 and 3 of the next cycle; a running task is never
 * interrupted by it. {@link #stop()} waits up to the shutdown timeout for the
 * running task, then persists the run state.
 */
@Component
public class AgentScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AgentScheduler.class);

    static final Set<TaskStatus> HISTORY_STATUSES = EnumSet.of(
            TaskStatus.DONE, TaskStatus.NEEDS_REVIEW, TaskStatus.WAITING, TaskStatus.ERROR, TaskStatus.CANCELLED);

    static final String NO_RESPONSE = "No response received";

    private static final String STABILIZING_KEY      = "is_thread_stabilizing";
    private static final String STABILIZATION_END_KEY = "thread_stabilization_ends_at";

    private enum Mode { POLL, FORCE, RECOVER }

    private final TaskStore              taskStore;
    private final ExecutionEngine        engine;
    private final InterruptRouter        router;
    private final CheckpointStore        checkpoints;
    private final AgentRunStatePersister persister;
    private final AgentProperties        props;
    private final MeterRegistry          meterRegistry;
    private final Clock                  clock;
    private final RetryPolicy            taskRetry;
    private final AgentRunState          runState;

    private final AtomicReference<UUID> inFlight = new AtomicReference<>();
    private final AtomicBoolean         paused   = new AtomicBoolean(false);
    private final Object                wakeLock = new Object();
    private final ExecutorService       forceWorker;

    private volatile boolean running;
    private volatile Thread  loopThread;

    public AgentScheduler(TaskStore taskStore,
                          ExecutionEngine engine,
                          InterruptRouter router,
                          CheckpointStore checkpoints,
                          AgentRunStatePersister persister,
                          AgentProperties props,
                          MeterRegistry meterRegistry,
                          Clock clock) {
        this.taskStore     = taskStore;
        this.engine        = engine;
        this.router        = router;
        this.checkpoints   = checkpoints;
        this.persister     = persister;
        this.props         = props;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.runState      = new AgentRunState(clock);
        this.taskRetry     = RetryPolicy.builder()
                .maxRetries(props.maxRetries())
                .baseDelay(props.errorRetryInterval())
                .maxDelay(props.errorRetryInterval().multipliedBy(12))
                .build();
        this.forceWorker   = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "taskpilot-force");
            t.setDaemon(true);
            return t;
        });
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    public boolean isAutoStartup() {
        return props.autoStart();
    }

    @Override
    public synchronized void start() {
        if (running) return;
        try {
            persister.load().ifPresent(runState::restoreCounters);
        } catch (RuntimeException e) {
            log.warn("Could not restore previous run state: {}", e.getMessage());
        }
        runState.started(paused.get());
        persist();
        running = true;
        Thread t = new Thread(this::run, "taskpilot-scheduler");
        t.setDaemon(true);
        loopThread = t;
        t.start();
        log.info("Scheduler started (poll interval {}, max retries {})", props.pollInterval(), props.maxRetries());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        log.info("Scheduler stopping; waiting up to {} for the in-flight task", props.shutdownTimeout());
        running = false;
        wakeUp();

        long deadline = System.nanoTime() + props.shutdownTimeout().toNanos();
        Thread t = loopThread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("Scheduler loop did not finish within {}; interrupting it", props.shutdownTimeout());
                t.interrupt();
            }
        }

        forceWorker.shutdown();
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!forceWorker.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                log.warn("Forced task did not finish within {}; interrupting it", props.shutdownTimeout());
                forceWorker.shutdownNow();
            }
        } catch (InterruptedException e) {
            forceWorker.shutdownNow();
            Thread.currentThread().interrupt();
        }

        persist();
        log.info("Scheduler stopped: {}", runState.snapshot());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ------------------------------------------------------------------
    // Loop
    // ------------------------------------------------------------------

    /** Blocking loop; runs until {@link #stop()}. Started on its own thread by {@link #start()}. */
    public void run() {
        log.info("Scheduler loop running");
        while (running) {
            boolean worked;
            try {
                worked = runCycle();
                runState.loopRecovered(paused.get());
            } catch (RuntimeException e) {
                log.error("Error in scheduler loop", e);
                runState.loopFailed(FailureClassifier.describe(e));
                persist();
                sleep(props.errorRetryInterval());
                continue;
            }
            if (!worked) {
                sleep(props.pollInterval());
            }
        }
        log.info("Scheduler loop exited");
    }

    /**
     * One poll cycle.
     *
     * @return true if a task was processed, i.e. the next cycle should start immediately
     */
    public boolean runCycle() {
        if (paused.get()) {
            return false;
        }
        UUID busy = inFlight.get();
        if (busy != null) {
            reportIfStuck(busy);
            return false;
        }

        Optional<Task> orphan = taskStore.listEligible(EnumSet.of(TaskStatus.IN_PROGRESS)).stream().findFirst();
        if (orphan.isPresent()) {
            return claimAndProcess(orphan.get().getId(), Mode.RECOVER);
        }

        Optional<Task> next = selectNext(taskStore.listEligible(TaskStatus.ELIGIBLE), clock.instant());
        if (next.isEmpty()) {
            log.debug("No tasks to process");
            return false;
        }
        return claimAndProcess(next.get().getId(), Mode.POLL);
    }

    // ------------------------------------------------------------------
    // Controls
    // ------------------------------------------------------------------

    public void pause() {
        paused.set(true);
        runState.paused();
        persist();
        log.info("Scheduler paused");
    }

    public void resume() {
        paused.set(false);
        runState.resumed();
        persist();
        wakeUp();
        log.info("Scheduler resumed");
    }

    public boolean isPaused() {
        return paused.get();
    }

    /**
     * Run {@code taskId} now, whatever its status, on the force worker.
     *
     * The task skips the eligibility filter; terminal tasks are re-entered.
     * Unless a human reply is waiting to be consumed, the execution starts
     * fresh and any old checkpoint is dropped. Single-flight still applies.
     *
     * @throws com.taskpilot.engine.model.TaskNotFoundException if the task does not exist
     */
    public ForceProcessResult forceProcess(UUID taskId) {
        taskStore.get(taskId);
        if (!inFlight.compareAndSet(null, taskId)) {
            return taskId.equals(inFlight.get()) ? ForceProcessResult.ALREADY_RUNNING : ForceProcessResult.BUSY;
        }
        try {
            forceWorker.submit(() -> process(taskId, Mode.FORCE));
        } catch (RejectedExecutionException e) {
            inFlight.compareAndSet(taskId, null);
            throw new IllegalStateException("Scheduler is shut down", e);
        }
        log.info("Force-processing task {}", taskId);
        return ForceProcessResult.ACCEPTED;
    }

    public AgentRunSnapshot getStatus() {
        return runState.snapshot();
    }

    /** Most recently updated tasks that the engine has finished with or handed to a human. */
    public List<Task> getRecentHistory(int limit) {
        return taskStore.listRecent(HISTORY_STATUSES, limit);
    }

    // ------------------------------------------------------------------
    // Selection
    // ------------------------------------------------------------------

    Optional<Task> selectNext(List<Task> candidates, Instant now) {
        Instant waitingCutoff = now.minus(props.waitingRecheckInterval());
        return candidates.stream()
                .filter(t -> TaskStatus.ELIGIBLE.contains(t.getStatus()))
                .filter(t -> t.getStatus() != TaskStatus.WAITING || !t.getUpdatedAt().isAfter(waitingCutoff))
                .filter(t -> !isStabilizing(t, now))
                .min(Comparator.comparingInt((Task t) -> priority(t.getStatus()))
                        .thenComparing(Task::getUpdatedAt));
    }

    private static int priority(TaskStatus status) {
        return switch (status) {
            case USER_INPUT_RECEIVED -> 0;
            case NEW                 -> 1;
            default                  -> 2;
        };
    }

    /**
     * A task is held back while its metadata says the thread it came from is
     * still settling. A missing or unreadable end time lets it through.
     */
    static boolean isStabilizing(Task task, Instant now) {
        Map<String, Object> metadata = task.getMetadata();
        if (metadata == null) return false;
        Object flag = metadata.get(STABILIZING_KEY);
        if (flag == null || !Boolean.parseBoolean(flag.toString())) return false;
        Object endsAt = metadata.get(STABILIZATION_END_KEY);
        if (endsAt == null) return false;
        Instant end = parseInstant(endsAt.toString());
        return end != null && end.isAfter(now);
    }

    private static Instant parseInstant(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e2) {
                log.debug("Unreadable stabilization end time '{}'", text);
                return null;
            }
        }
    }

    // ------------------------------------------------------------------
    // Processing
    // ------------------------------------------------------------------

    private boolean claimAndProcess(UUID taskId, Mode mode) {
        if (!inFlight.compareAndSet(null, taskId)) {
            return false;
        }
        return process(taskId, mode);
    }

    /**
     * Runs with the claim on {@code taskId} held; always releases it.
     *
     * @return false if the task could not be taken through a full attempt
     */
    private boolean process(UUID taskId, Mode mode) {
        try {
            Task task = taskStore.get(taskId);
            TaskStatus from = task.getStatus();
            String resumeInput = switch (from) {
                case USER_INPUT_RECEIVED -> latestHumanReply(task);
                case IN_PROGRESS         -> unconsumedReply(task);
                default                  -> null;
            };

            if (from != TaskStatus.IN_PROGRESS) {
                from.checkTransition(TaskStatus.IN_PROGRESS, mode == Mode.FORCE);
                taskStore.updateStatus(taskId, TaskStatus.IN_PROGRESS);
            }
            if (mode == Mode.FORCE && from != TaskStatus.USER_INPUT_RECEIVED) {
                checkpoints.discard(taskId);
            }

            runState.taskStarted(taskId);
            persist();
            log.info("Processing task {} '{}' ({}, was {})", taskId, task.getTitle(), mode, from);

            ExecutionOutcome outcome = executeWithRetry(task, resumeInput);
            if (outcome == null) {
                return false;
            }
            return handleOutcome(task, outcome);
        } catch (IllegalTaskTransitionException e) {
            log.warn("Task {} not processed: {}", taskId, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Unhandled error while processing task {}", taskId, e);
            runState.taskFailed(FailureClassifier.describe(e));
            return false;
        } finally {
            inFlight.compareAndSet(taskId, null);
            runState.taskFinished(paused.get());
            persist();
        }
    }

    /**
     * Run the engine, retrying retryable failures in place. The task stays
     * IN_PROGRESS between attempts and each retry resumes from the checkpoint.
     *
     * @return the final outcome, or null if shutdown cut the retries short
     */
    private ExecutionOutcome executeWithRetry(Task task, String resumeInput) {
        int retries = 0;
        while (true) {
            ExecutionOutcome outcome = engine.run(task, resumeInput);
            if (!(outcome instanceof ExecutionOutcome.Failed failed)) {
                return outcome;
            }
            if (shuttingDown()) {
                log.warn("Task {} failed during shutdown; left IN_PROGRESS for recovery", task.getId());
                return null;
            }
            if (failed.kind() != FailureKind.RETRYABLE || !taskRetry.shouldRetry(failed.error(), retries)) {
                return outcome;
            }
            Duration delay = taskRetry.delayFor(retries);
            retries++;
            String description = FailureClassifier.describe(failed.error());
            runState.retryScheduled(description);
            persist();
            log.warn("Task {} failed transiently (retry {}/{} in {} ms): {}",
                    task.getId(), retries, taskRetry.maxRetries(), delay.toMillis(), description);
            if (!sleep(delay) || shuttingDown()) {
                log.warn("Retry of task {} abandoned for shutdown; left IN_PROGRESS for recovery", task.getId());
                return null;
            }
        }
    }

    /** @return false if the outcome could not be written back, so the loop should back off */
    private boolean handleOutcome(Task task, ExecutionOutcome outcome) {
        UUID taskId = task.getId();
        if (outcome instanceof ExecutionOutcome.Completed completed) {
            if (applyStatus(taskId, completed.status())) {
                runState.taskCompleted();
                count("completed");
            }
        } else if (outcome instanceof ExecutionOutcome.Suspended suspended) {
            count("suspended");
            if (!stillInProgress(taskId)) {
                checkpoints.discard(taskId);
            } else if (!router.route(task, suspended.interrupt())) {
                log.warn("Task {} left IN_PROGRESS until its interrupt can be routed", taskId);
                return false;
            }
        } else if (outcome instanceof ExecutionOutcome.Deferred deferred) {
            if (applyStatus(taskId, TaskStatus.WAITING)) {
                log.info("Task {} deferred: {}", taskId, deferred.reason());
            }
            count("deferred");
        } else if (outcome instanceof ExecutionOutcome.Failed failed) {
            failTask(taskId, failed.error());
            count("failed");
        }
        return true;
    }

    private void failTask(UUID taskId, Throwable error) {
        String description = FailureClassifier.describe(error);
        log.error("Task {} failed: {}", taskId, description, error);
        runState.taskFailed(description);
        if (applyStatus(taskId, TaskStatus.ERROR)) {
            taskStore.appendComment(taskId, props.author(),
                    props.author() + " encountered an error while processing this task:\n\n" + description);
        }
    }

    /**
     * Move the task out of IN_PROGRESS unless someone else (a cancellation,
     * typically) changed it while it was executing.
     */
    private boolean applyStatus(UUID taskId, TaskStatus target) {
        if (!stillInProgress(taskId)) {
            return false;
        }
        taskStore.updateStatus(taskId, target);
        return true;
    }

    private boolean stillInProgress(UUID taskId) {
        TaskStatus current = taskStore.get(taskId).getStatus();
        if (current != TaskStatus.IN_PROGRESS) {
            log.warn("Task {} was changed to {} while executing; outcome not applied", taskId, current);
            return false;
        }
        return true;
    }

    /** The newest comment not written by the engine, i.e. the human's reply. */
    String latestHumanReply(Task task) {
        List<TaskComment> comments = task.getComments();
        for (int i = comments.size() - 1; i >= 0; i--) {
            TaskComment c = comments.get(i);
            if (!props.author().equals(c.getAuthor())) {
                return c.getContent();
            }
        }
        return NO_RESPONSE;
    }

    /**
     * A reply that was claimed (USER_INPUT_RECEIVED → IN_PROGRESS) but never
     * checkpointed before a crash: the checkpoint still waits on the interrupt
     * and the newest comment is the human's.
     *
     * @return the reply, or null if there is nothing left to hand over
     */
    private String unconsumedReply(Task task) {
        List<TaskComment> comments = task.getComments();
        if (comments.isEmpty() || props.author().equals(comments.get(comments.size() - 1).getAuthor())) {
            return null;
        }
        try {
            boolean waiting = checkpoints.load(task.getId())
                    .map(state -> state.getPendingInterrupt() != null)
                    .orElse(false);
            return waiting ? latestHumanReply(task) : null;
        } catch (CheckpointCorruptedException e) {
            // The engine hits the same checkpoint and fails the task.
            log.warn("Cannot inspect checkpoint of task {}: {}", task.getId(), e.getMessage());
            return null;
        }
    }

    private void reportIfStuck(UUID taskId) {
        Instant since = runState.snapshot().currentTaskSince();
        if (since != null && since.isBefore(clock.instant().minus(props.stuckTimeout()))) {
            log.warn("Task {} has been executing since {}, longer than {}", taskId, since, props.stuckTimeout());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean shuttingDown() {
        return (loopThread != null && !running) || Thread.currentThread().isInterrupted();
    }

    /** Sleep until woken, stopped or the delay passes. Returns false if interrupted. */
    private boolean sleep(Duration delay) {
        long millis = delay.toMillis();
        if (millis <= 0) return !Thread.currentThread().isInterrupted();
        synchronized (wakeLock) {
            try {
                wakeLock.wait(millis);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private void wakeUp() {
        synchronized (wakeLock) {
            wakeLock.notifyAll();
        }
    }

    private void persist() {
        try {
            persister.save(runState.snapshot());
        } catch (RuntimeException e) {
            log.warn("Could not persist run state: {}", e.getMessage());
        }
    }

    private void count(String outcome) {
        meterRegistry.counter("taskpilot.scheduler.outcomes", "outcome", outcome).increment();
    }
}
