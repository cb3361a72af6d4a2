package com.taskpilot.engine.repository;

import com.taskpilot.engine.model.Checkpoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface CheckpointRepository extends JpaRepository<Checkpoint, UUID> {
}
