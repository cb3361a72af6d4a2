package com.taskpilot.engine.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.engine.agent.ExecutionState;
import com.taskpilot.engine.checkpoint.CheckpointCorruptedException;
import com.taskpilot.engine.checkpoint.CheckpointStore;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoints held as JSON strings, so every save/load goes through the same
 * serialization as the real store and a resumed state never shares objects
 * with the one that was suspended.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ObjectMapper        json  = new ObjectMapper();
    private final Map<UUID, String>   saved = new ConcurrentHashMap<>();
    private int saves;

    @Override
    public void save(UUID taskId, ExecutionState state) {
        try {
            saved.put(taskId, json.writeValueAsString(state));
            saves++;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public Optional<ExecutionState> load(UUID taskId) {
        String stored = saved.get(taskId);
        if (stored == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(json.readValue(stored, ExecutionState.class));
        } catch (JsonProcessingException e) {
            throw new CheckpointCorruptedException(taskId, e);
        }
    }

    @Override
    public void discard(UUID taskId) {
        saved.remove(taskId);
    }

    public boolean contains(UUID taskId) {
        return saved.containsKey(taskId);
    }

    public void corrupt(UUID taskId) {
        saved.put(taskId, "{not json");
    }

    public int saveCount() {
        return saves;
    }
}
