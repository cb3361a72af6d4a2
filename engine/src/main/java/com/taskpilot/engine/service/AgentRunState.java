package com.taskpilot.engine.service;

import com.taskpilot.engine.model.AgentRunStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * The scheduler loop's own status, owned by one {@link AgentScheduler}.
 *
 * Transitions:
 *   IDLE        → PROCESSING   (task claimed)
 *   PROCESSING  → IDLE|PAUSED  (task finished; PAUSED if a pause was requested meanwhile)
 *   IDLE        ↔ PAUSED       (pause / resume)
 *   any         → ERROR        (the loop itself failed; cleared by the next clean cycle)
 *
 * Read from status threads while the loop and the force worker write, so
 * every method is synchronized.
 */
public class AgentRunState {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final Clock clock;

    private AgentRunStatus status = AgentRunStatus.IDLE;
    private UUID           currentTaskId;
    private Instant        currentTaskSince;
    private long           totalTasksProcessed;
    private long           errorCount;
    private long           retryCount;
    private String         lastError;
    private Instant        startedAt;
    private Instant        lastActivity;

    public AgentRunState(Clock clock) {
        this.clock = clock;
    }

    /** Carry the counters of a previous run over into this one. */
    public synchronized void restoreCounters(AgentRunSnapshot previous) {
        this.totalTasksProcessed = previous.totalTasksProcessed();
        this.errorCount          = previous.errorCount();
        this.retryCount          = previous.retryCount();
        this.lastError           = previous.lastError();
    }

    public synchronized void started(boolean paused) {
        this.startedAt = clock.instant();
        this.status    = paused ? AgentRunStatus.PAUSED : AgentRunStatus.IDLE;
        touch();
    }

    public synchronized void taskStarted(UUID taskId) {
        this.status           = AgentRunStatus.PROCESSING;
        this.currentTaskId    = taskId;
        this.currentTaskSince = clock.instant();
        touch();
    }

    public synchronized void taskFinished(boolean paused) {
        this.status           = paused ? AgentRunStatus.PAUSED : AgentRunStatus.IDLE;
        this.currentTaskId    = null;
        this.currentTaskSince = null;
        touch();
    }

    public synchronized void taskCompleted() {
        totalTasksProcessed++;
        touch();
    }

    public synchronized void retryScheduled(String error) {
        retryCount++;
        lastError = truncate(error);
        touch();
    }

    public synchronized void taskFailed(String error) {
        errorCount++;
        lastError = truncate(error);
        touch();
    }

    public synchronized void loopFailed(String error) {
        status = AgentRunStatus.ERROR;
        errorCount++;
        lastError = truncate(error);
        touch();
    }

    /** A clean cycle after a loop failure. */
    public synchronized void loopRecovered(boolean paused) {
        if (status == AgentRunStatus.ERROR) {
            status = paused ? AgentRunStatus.PAUSED : AgentRunStatus.IDLE;
        }
    }

    public synchronized void paused() {
        if (status != AgentRunStatus.PROCESSING) {
            status = AgentRunStatus.PAUSED;
        }
        touch();
    }

    public synchronized void resumed() {
        if (status == AgentRunStatus.PAUSED) {
            status = AgentRunStatus.IDLE;
        }
        touch();
    }

    public synchronized AgentRunSnapshot snapshot() {
        return new AgentRunSnapshot(status, currentTaskId, currentTaskSince,
                totalTasksProcessed, errorCount, retryCount, lastError, startedAt, lastActivity);
    }

    private void touch() {
        lastActivity = clock.instant();
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) return error;
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
