package com.taskpilot.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Scheduler loop and execution engine settings ({@code taskpilot.agent.*}).
 *
 * @param pollInterval           sleep between polls when no task is eligible
 * @param errorRetryInterval     base delay before retrying a task after a transient failure
 * @param maxRetries             transient-failure retries per task before it goes to ERROR
 * @param maxTurns               LLM turns per execution before giving up
 * @param shutdownTimeout        how long stop() waits for the in-flight task
 * @param waitingRecheckInterval a WAITING task is re-examined once it has been idle this long
 * @param stuckTimeout           in-flight executions older than this are reported as stuck
 * @param author                 author name on comments written by the engine
 * @param autoStart              start the loop with the application context
 */
@ConfigurationProperties(prefix = "taskpilot.agent")
public record AgentProperties(
        @DefaultValue("30s") Duration pollInterval,
        @DefaultValue("5s")  Duration errorRetryInterval,
        @DefaultValue("3")   int      maxRetries,
        @DefaultValue("25")  int      maxTurns,
        @DefaultValue("5s")  Duration shutdownTimeout,
        @DefaultValue("15m") Duration waitingRecheckInterval,
        @DefaultValue("30m") Duration stuckTimeout,
        @DefaultValue("taskpilot") String author,
        @DefaultValue("true") boolean autoStart) {
}
