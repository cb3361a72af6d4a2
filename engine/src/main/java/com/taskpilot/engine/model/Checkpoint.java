package com.taskpilot.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Serialized execution state of one task's action loop.
 *
 * Keyed by task id, so there is at most one checkpoint per task; saving
 * again overwrites it. {@code stateJson} is written by the checkpoint store
 * and is opaque at this level.
 *
 * DB table: checkpoints  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "checkpoints")
public class Checkpoint {

    @Id
    @Column(name = "task_id")
    private UUID taskId;

    @Column(name = "state_json", nullable = false, columnDefinition = "TEXT")
    private String stateJson;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected Checkpoint() {}   // required by JPA

    public Checkpoint(UUID taskId, String stateJson) {
        this.taskId    = taskId;
        this.stateJson = stateJson;
    }

    public UUID    getTaskId()    { return taskId; }
    public String  getStateJson() { return stateJson; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setStateJson(String stateJson) {
        this.stateJson = stateJson;
        this.updatedAt = Instant.now();
    }
}
