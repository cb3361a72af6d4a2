package com.taskpilot.engine.agent;

import com.taskpilot.engine.action.ActionContext;
import com.taskpilot.engine.action.ActionException;
import com.taskpilot.engine.action.ActionRegistry;
import com.taskpilot.engine.action.impl.AskUserAction;
import com.taskpilot.engine.checkpoint.CheckpointStore;
import com.taskpilot.engine.config.AgentProperties;
import com.taskpilot.engine.interrupt.Interrupt;
import com.taskpilot.engine.interrupt.ToolApprovalRequest;
import com.taskpilot.engine.interrupt.UserQuestion;
import com.taskpilot.engine.llm.ActionCall;
import com.taskpilot.engine.llm.ActionResult;
import com.taskpilot.engine.llm.ConversationMessage;
import com.taskpilot.engine.llm.LlmClient;
import com.taskpilot.engine.llm.LlmReply;
import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskStatus;
import com.taskpilot.engine.permission.PermissionEvaluator;
import com.taskpilot.engine.permission.PermissionPattern;
import com.taskpilot.engine.permission.PermissionRuleSource;
import com.taskpilot.engine.retry.FailureClassifier;
import com.taskpilot.engine.retry.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Runs one task's action loop until it completes, needs a human, defers, or fails.
 *
 * Each turn:
 *   1. Send the conversation and the action definitions to the LLM
 *   2. A reply without action calls is the final answer → Completed
 *   3. Otherwise work through the calls in order:
 *        ask_user                 → UserQuestion interrupt, suspend
 *        not approved by the rules → ToolApprovalRequest interrupt, suspend
 *        approved                 → execute, collect the result
 *   4. Feed the results back, checkpoint, next turn
 *
 * The state is checkpointed after every LLM turn and before every suspension.
 * A later run for the same task picks up from that checkpoint; the human's
 * reply becomes the result of the call that suspended. Exceptions from the LLM
 * or from actions are classified and returned as {@link ExecutionOutcome.Failed}.
 */
@Component
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final LlmClient            llm;
    private final ActionRegistry       actions;
    private final PermissionEvaluator  permissions;
    private final PermissionRuleSource ruleSource;
    private final CheckpointStore      checkpoints;
    private final SystemPrompts        prompts;
    private final AgentProperties      props;

    public ExecutionEngine(LlmClient llm,
                           ActionRegistry actions,
                           PermissionEvaluator permissions,
                           PermissionRuleSource ruleSource,
                           CheckpointStore checkpoints,
                           SystemPrompts prompts,
                           AgentProperties props) {
        this.llm         = llm;
        this.actions     = actions;
        this.permissions = permissions;
        this.ruleSource  = ruleSource;
        this.checkpoints = checkpoints;
        this.prompts     = prompts;
        this.props       = props;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * @param task        the task, with its comments loaded
     * @param resumeInput the human's reply when resuming after an interrupt, otherwise null
     */
    public ExecutionOutcome run(Task task, String resumeInput) {
        MDC.put("taskId",  task.getId().toString());
        MDC.put("resumed", String.valueOf(resumeInput != null));
        try {
            ExecutionState state = null;
            try {
                state = restoreOrStart(task, resumeInput);
                return drive(task, state);
            } catch (RuntimeException e) {
                return fail(task.getId(), state, e);
            }
        } finally {
            MDC.remove("taskId");
            MDC.remove("resumed");
        }
    }

    // ------------------------------------------------------------------
    // Restore
    // ------------------------------------------------------------------

    private ExecutionState restoreOrStart(Task task, String resumeInput) {
        Optional<ExecutionState> saved = checkpoints.load(task.getId());
        if (saved.isEmpty()) {
            log.info("Starting execution of task {} '{}'", task.getId(), task.getTitle());
            return ExecutionState.start(prompts.initialPrompt(task, resumeInput));
        }

        ExecutionState state = saved.get();
        log.info("Resuming task {} from checkpoint (turn {}, {} messages)",
                task.getId(), state.getTurn(), state.getHistory().size());

        // Without a pending interrupt the reply was already applied by an earlier attempt.
        if (state.getPendingInterrupt() != null && resumeInput != null) {
            applyHumanReply(task, state, resumeInput);
        }
        return state;
    }

    /** Inject the reply as the result of the call that suspended the loop. */
    private void applyHumanReply(Task task, ExecutionState state, String reply) {
        Interrupt interrupt = state.getPendingInterrupt();
        ActionCall call = state.currentCall();
        ActionResult result = switch (interrupt.kind()) {
            case TOOL_APPROVAL_REQUEST -> resolveApproval(task, state, (ToolApprovalRequest) interrupt, call, reply);
            case USER_QUESTION, UNKNOWN -> ActionResult.ok(call.id(), reply);
        };
        state.setPendingInterrupt(null);
        state.resolveCurrentCall(result);
    }

    private ActionResult resolveApproval(Task task,
                                         ExecutionState state,
                                         ToolApprovalRequest request,
                                         ActionCall call,
                                         String reply) {
        ApprovalDecision decision = ApprovalDecision.parse(reply);
        log.info("Approval reply for {} on task {}: {}", request.pattern(), task.getId(), decision);
        return switch (decision) {
            case APPROVE      -> execute(task, state, call);
            case ALWAYS_ALLOW -> {
                addAllowRule(request);
                yield execute(task, state, call);
            }
            case DENY         -> ActionResult.error(call.id(),
                    "Action " + call.name() + " was denied by user. Response: " + reply);
        };
    }

    private void addAllowRule(ToolApprovalRequest request) {
        String rule = PermissionPattern.format(request.actionName(),
                PermissionPattern.semanticArguments(request.actionArgs()));
        try {
            ruleSource.addAllowRule(rule);
            log.info("Added allow rule '{}'", rule);
        } catch (RuntimeException e) {
            log.error("Failed to add allow rule '{}'", rule, e);
        }
    }

    // ------------------------------------------------------------------
    // Loop
    // ------------------------------------------------------------------

    private ExecutionOutcome drive(Task task, ExecutionState state) {
        UUID taskId = task.getId();

        if (state.getPendingInterrupt() != null) {
            log.info("Task {} is still waiting for a human reply", taskId);
            return new ExecutionOutcome.Suspended(state.getPendingInterrupt());
        }

        while (true) {
            while (state.hasUnresolvedCalls()) {
                ActionCall call = state.currentCall();
                Optional<Interrupt> gate = gate(call);
                if (gate.isPresent()) {
                    state.setPendingInterrupt(gate.get());
                    checkpoints.save(taskId, state);
                    log.info("Task {} suspended at turn {} on '{}'", taskId, state.getTurn(), call.name());
                    return new ExecutionOutcome.Suspended(gate.get());
                }
                state.resolveCurrentCall(execute(task, state, call));
            }
            state.closeTurn();

            if (state.getRequestedStatus() != null) {
                checkpoints.discard(taskId);
                if (state.getRequestedStatus() == TaskStatus.WAITING) {
                    log.info("Task {} deferred after {} turns", taskId, state.getTurn());
                    return new ExecutionOutcome.Deferred(state.getRequestReason());
                }
                log.info("Task {} completed after {} turns with requested status {}",
                        taskId, state.getTurn(), state.getRequestedStatus());
                return new ExecutionOutcome.Completed(state.lastAssistantText(), state.getRequestedStatus());
            }

            if (state.getTurn() >= props.maxTurns()) {
                throw new IllegalStateException(
                        "Max turns (" + props.maxTurns() + ") reached without a final answer");
            }

            log.debug("Turn {}/{} for task {}", state.getTurn() + 1, props.maxTurns(), taskId);
            LlmReply reply = llm.complete(prompts.system(), state.getHistory(), actions.definitions());
            state.beginTurn(ConversationMessage.assistant(reply.text(), reply.actionCalls()));

            if (reply.isFinal()) {
                checkpoints.discard(taskId);
                log.info("Task {} completed after {} turns", taskId, state.getTurn());
                return new ExecutionOutcome.Completed(reply.text(), TaskStatus.DONE);
            }
            checkpoints.save(taskId, state);
        }
    }

    /** The interrupt a call must raise before it may run, if any. */
    private Optional<Interrupt> gate(ActionCall call) {
        if (AskUserAction.NAME.equals(call.name())) {
            Object question = call.arguments().get("question");
            return Optional.of(new UserQuestion(question == null ? null : question.toString()));
        }
        if (actions.contains(call.name()) && !permissions.isApproved(call.name(), call.arguments())) {
            return Optional.of(new ToolApprovalRequest(call.name(), call.arguments()));
        }
        return Optional.empty();
    }

    /**
     * Execute one call. Rejected input and unknown actions become error
     * observations for the LLM; any other exception ends the run.
     */
    private ActionResult execute(Task task, ExecutionState state, ActionCall call) {
        if (!actions.contains(call.name())) {
            log.info("LLM called unknown action '{}' on task {}", call.name(), task.getId());
            return ActionResult.error(call.id(), "Unknown action '" + call.name() + "'. Available actions: "
                    + actions.definitions().stream().map(d -> d.name()).toList());
        }
        ActionContext ctx = new ActionContext(task, props.author());
        try {
            String output = actions.execute(call.name(), call.arguments(), ctx);
            if (ctx.requestedStatus() != null) {
                state.setRequestedStatus(ctx.requestedStatus());
                state.setRequestReason(ctx.requestReason());
            }
            return ActionResult.ok(call.id(), output);
        } catch (ActionException e) {
            log.info("Action '{}' rejected input on task {}: {}", call.name(), task.getId(), e.getMessage());
            return ActionResult.error(call.id(), "Error: " + e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Failure
    // ------------------------------------------------------------------

    /**
     * Keep whatever progress was made so a retry (or a later look at the
     * checkpoint) starts from it. A state that could not be restored is left alone.
     */
    private ExecutionOutcome fail(UUID taskId, ExecutionState state, RuntimeException error) {
        FailureKind kind = FailureClassifier.classify(error);
        if (state != null) {
            try {
                checkpoints.save(taskId, state);
            } catch (RuntimeException saveError) {
                log.warn("Could not checkpoint task {} after failure: {}", taskId, saveError.getMessage());
            }
        }
        log.warn("Execution of task {} failed ({}): {}", taskId, kind, FailureClassifier.describe(error));
        return new ExecutionOutcome.Failed(error, kind);
    }
}
