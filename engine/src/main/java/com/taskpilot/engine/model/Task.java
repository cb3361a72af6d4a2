package com.taskpilot.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A unit of work tracked through the {@link TaskStatus} lifecycle.
 *
 * Tasks are created by external producers (ingestion pipeline, users) in
 * status NEW. The engine only changes {@code status} and appends comments.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.NEW;

    @Convert(converter = JsonListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> tags = new ArrayList<>();

    // Linked people / projects, thread-stabilization markers, etc.
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @OneToMany(mappedBy = "task", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("createdAt ASC")
    private List<TaskComment> comments = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(String title, String description) {
        this.title       = title;
        this.description = description;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                getId()          { return id; }
    public String              getTitle()       { return title; }
    public String              getDescription() { return description; }
    public TaskStatus          getStatus()      { return status; }
    public List<String>        getTags()        { return tags; }
    public Map<String, Object> getMetadata()    { return metadata; }
    public Instant             getCreatedAt()   { return createdAt; }
    public Instant             getUpdatedAt()   { return updatedAt; }
    public List<TaskComment>   getComments()    { return comments; }

    public void setStatus(TaskStatus status)              { this.status = status; }
    public void setTags(List<String> tags)                { this.tags = tags; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
    public void setUpdatedAt(Instant updatedAt)           { this.updatedAt = updatedAt; }

    public TaskComment addComment(String author, String content) {
        TaskComment comment = new TaskComment(this, author, content);
        comments.add(comment);
        return comment;
    }
}
