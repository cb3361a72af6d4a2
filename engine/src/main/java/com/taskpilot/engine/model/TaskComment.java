package com.taskpilot.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One entry in a task's comment thread. Comments are the only user-visible
 * channel for escalations and errors.
 *
 * DB table: task_comments  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "task_comments")
public class TaskComment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false)
    private Task task;

    // "user" for humans, the configured agent author for the engine.
    @Column(nullable = false, length = 100)
    private String author;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected TaskComment() {}   // required by JPA

    public TaskComment(Task task, String author, String content) {
        this.task    = task;
        this.author  = author;
        this.content = content;
    }

    public UUID    getId()        { return id; }
    public Task    getTask()      { return task; }
    public String  getAuthor()    { return author; }
    public String  getContent()   { return content; }
    public Instant getCreatedAt() { return createdAt; }
}
