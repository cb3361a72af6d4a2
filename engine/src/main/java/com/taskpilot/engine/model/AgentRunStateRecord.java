package com.taskpilot.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted copy of the scheduler's run state.
 *
 * There is exactly one row (id = 1). It is rewritten on every state change
 * and once more on shutdown, so external status reporters can read the last
 * known state even while the engine is down.
 *
 * DB table: agent_run_state  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "agent_run_state")
public class AgentRunStateRecord {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id = SINGLETON_ID;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AgentRunStatus status = AgentRunStatus.IDLE;

    @Column(name = "current_task_id")
    private UUID currentTaskId;

    @Column(name = "total_tasks_processed", nullable = false)
    private long totalTasksProcessed;

    @Column(name = "error_count", nullable = false)
    private long errorCount;

    @Column(name = "retry_count", nullable = false)
    private long retryCount;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "last_activity")
    private Instant lastActivity;

    public AgentRunStateRecord() {}

    public Integer        getId()                  { return id; }
    public AgentRunStatus getStatus()              { return status; }
    public UUID           getCurrentTaskId()       { return currentTaskId; }
    public long           getTotalTasksProcessed() { return totalTasksProcessed; }
    public long           getErrorCount()          { return errorCount; }
    public long           getRetryCount()          { return retryCount; }
    public String         getLastError()           { return lastError; }
    public Instant        getStartedAt()           { return startedAt; }
    public Instant        getLastActivity()        { return lastActivity; }

    public void setStatus(AgentRunStatus status)       { this.status = status; }
    public void setCurrentTaskId(UUID currentTaskId)   { this.currentTaskId = currentTaskId; }
    public void setTotalTasksProcessed(long v)         { this.totalTasksProcessed = v; }
    public void setErrorCount(long v)                  { this.errorCount = v; }
    public void setRetryCount(long v)                  { this.retryCount = v; }
    public void setLastError(String lastError)         { this.lastError = lastError; }
    public void setStartedAt(Instant startedAt)        { this.startedAt = startedAt; }
    public void setLastActivity(Instant lastActivity)  { this.lastActivity = lastActivity; }
}
