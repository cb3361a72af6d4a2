package com.taskpilot.engine.service;

import com.taskpilot.engine.model.AgentRunStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AgentRunStateTest {

    final Clock clock = Clock.fixed(Instant.parse("2026-05-04T09:00:00Z"), ZoneOffset.UTC);
    final AgentRunState state = new AgentRunState(clock);

    @Test
    void taskLifecycle_tracksCurrentTask() {
        UUID taskId = UUID.randomUUID();
        state.started(false);

        state.taskStarted(taskId);
        AgentRunSnapshot busy = state.snapshot();
        assertThat(busy.status()).isEqualTo(AgentRunStatus.PROCESSING);
        assertThat(busy.currentTaskId()).isEqualTo(taskId);
        assertThat(busy.currentTaskSince()).isEqualTo(clock.instant());

        state.taskCompleted();
        state.taskFinished(false);
        AgentRunSnapshot idle = state.snapshot();
        assertThat(idle.status()).isEqualTo(AgentRunStatus.IDLE);
        assertThat(idle.currentTaskId()).isNull();
        assertThat(idle.totalTasksProcessed()).isEqualTo(1);
    }

    @Test
    void pauseDuringTask_takesEffectWhenTaskFinishes() {
        state.started(false);
        state.taskStarted(UUID.randomUUID());

        state.paused();
        assertThat(state.snapshot().status()).isEqualTo(AgentRunStatus.PROCESSING);

        state.taskFinished(true);
        assertThat(state.snapshot().status()).isEqualTo(AgentRunStatus.PAUSED);

        state.resumed();
        assertThat(state.snapshot().status()).isEqualTo(AgentRunStatus.IDLE);
    }

    @Test
    void loopFailure_isClearedByNextCleanCycle() {
        state.started(false);

        state.loopFailed("DataAccessResourceFailureException: down");
        assertThat(state.snapshot().status()).isEqualTo(AgentRunStatus.ERROR);
        assertThat(state.snapshot().errorCount()).isEqualTo(1);

        state.loopRecovered(false);
        assertThat(state.snapshot().status()).isEqualTo(AgentRunStatus.IDLE);
        assertThat(state.snapshot().lastError()).contains("down");
    }

    @Test
    void lastError_isTruncated() {
        state.taskFailed("x".repeat(5000));

        assertThat(state.snapshot().lastError()).hasSize(1000);
    }

    @Test
    void restoreCounters_carriesTotalsOver() {
        AgentRunSnapshot previous = new AgentRunSnapshot(AgentRunStatus.IDLE, null, null,
                42, 3, 7, "old error", Instant.EPOCH, Instant.EPOCH);

        state.restoreCounters(previous);
        state.started(true);

        AgentRunSnapshot now = state.snapshot();
        assertThat(now.totalTasksProcessed()).isEqualTo(42);
        assertThat(now.retryCount()).isEqualTo(7);
        assertThat(now.status()).isEqualTo(AgentRunStatus.PAUSED);
        assertThat(now.startedAt()).isEqualTo(clock.instant());
    }
}
