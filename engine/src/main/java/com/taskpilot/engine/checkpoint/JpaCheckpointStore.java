package com.taskpilot.engine.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.engine.agent.ExecutionState;
import com.taskpilot.engine.model.Checkpoint;
import com.taskpilot.engine.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Checkpoints stored as JSON in the {@code checkpoints} table.
 *
 * {@link #save} flushes inside its own transaction, so the row is committed
 * before the engine reports a suspension.
 */
@Service
public class JpaCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCheckpointStore.class);

    private final CheckpointRepository repo;
    private final ObjectMapper         json;

    public JpaCheckpointStore(CheckpointRepository repo, ObjectMapper json) {
        this.repo = repo;
        this.json = json;
    }

    @Override
    @Transactional
    public void save(UUID taskId, ExecutionState state) {
        String serialized;
        try {
            serialized = json.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize execution state for task " + taskId, e);
        }
        Checkpoint checkpoint = repo.findById(taskId).orElse(null);
        if (checkpoint == null) {
            checkpoint = new Checkpoint(taskId, serialized);
        } else {
            checkpoint.setStateJson(serialized);
        }
        repo.saveAndFlush(checkpoint);
        log.debug("Checkpoint saved for task {} (turn {}, {} messages)",
                taskId, state.getTurn(), state.getHistory().size());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ExecutionState> load(UUID taskId) {
        Optional<Checkpoint> stored = repo.findById(taskId);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(json.readValue(stored.get().getStateJson(), ExecutionState.class));
        } catch (JsonProcessingException e) {
            throw new CheckpointCorruptedException(taskId, e);
        }
    }

    @Override
    @Transactional
    public void discard(UUID taskId) {
        if (repo.existsById(taskId)) {
            repo.deleteById(taskId);
            log.debug("Checkpoint discarded for task {}", taskId);
        }
    }
}
