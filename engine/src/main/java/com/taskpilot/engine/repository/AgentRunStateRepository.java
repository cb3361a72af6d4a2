package com.taskpilot.engine.repository;

import com.taskpilot.engine.model.AgentRunStateRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AgentRunStateRepository extends JpaRepository<AgentRunStateRecord, Integer> {
}
