package com.taskpilot.engine.service;

import com.taskpilot.engine.model.AgentRunStateRecord;
import com.taskpilot.engine.repository.AgentRunStateRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Writes {@link AgentRunSnapshot}s to the singleton {@code agent_run_state} row.
 */
@Component
public class AgentRunStatePersister {

    private final AgentRunStateRepository repo;

    public AgentRunStatePersister(AgentRunStateRepository repo) {
        this.repo = repo;
    }

    @Transactional
    public void save(AgentRunSnapshot snapshot) {
        AgentRunStateRecord row = repo.findById(AgentRunStateRecord.SINGLETON_ID)
                .orElseGet(AgentRunStateRecord::new);
        row.setStatus(snapshot.status());
        row.setCurrentTaskId(snapshot.currentTaskId());
        row.setTotalTasksProcessed(snapshot.totalTasksProcessed());
        row.setErrorCount(snapshot.errorCount());
        row.setRetryCount(snapshot.retryCount());
        row.setLastError(snapshot.lastError());
        row.setStartedAt(snapshot.startedAt());
        row.setLastActivity(snapshot.lastActivity());
        repo.save(row);
    }

    @Transactional(readOnly = true)
    public Optional<AgentRunSnapshot> load() {
        return repo.findById(AgentRunStateRecord.SINGLETON_ID)
                .map(row -> new AgentRunSnapshot(
                        row.getStatus(),
                        row.getCurrentTaskId(),
                        null,
                        row.getTotalTasksProcessed(),
                        row.getErrorCount(),
                        row.getRetryCount(),
                        row.getLastError(),
                        row.getStartedAt(),
                        row.getLastActivity()));
    }
}
