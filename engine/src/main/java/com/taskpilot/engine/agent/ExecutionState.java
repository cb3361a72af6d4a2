package com.taskpilot.engine.agent;

import com.taskpilot.engine.interrupt.Interrupt;
import com.taskpilot.engine.llm.ActionCall;
import com.taskpilot.engine.llm.ActionResult;
import com.taskpilot.engine.llm.ConversationMessage;
import com.taskpilot.engine.model.TaskStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything needed to continue a task's action loop exactly where it stopped.
 *
 * {@code history} holds every completed exchange with the LLM. The calls of
 * the latest assistant message are being worked through: {@code nextCallIndex}
 * points at the first unresolved one and {@code collectedResults} holds the
 * results of those before it. When a call suspends the loop,
 * {@code pendingInterrupt} records why; it is cleared once the human reply is
 * injected as that call's result.
 *
 * Plain mutable bean so that Jackson can write and read it as a checkpoint.
 */
public class ExecutionState {

    private List<ConversationMessage> history          = new ArrayList<>();
    private List<ActionCall>          pendingCalls     = new ArrayList<>();
    private int                       nextCallIndex;
    private List<ActionResult>        collectedResults = new ArrayList<>();
    private int                       turn;
    private TaskStatus                requestedStatus;
    private String                    requestReason;
    private Interrupt                 pendingInterrupt;

    public ExecutionState() {}

    public static ExecutionState start(String initialPrompt) {
        ExecutionState state = new ExecutionState();
        state.history.add(ConversationMessage.user(initialPrompt));
        return state;
    }

    // -------------------------------------------------------------------------
    // Loop bookkeeping
    // -------------------------------------------------------------------------

    /** Record an assistant turn; its calls become the pending calls. */
    void beginTurn(ConversationMessage assistantMessage) {
        history.add(assistantMessage);
        pendingCalls     = new ArrayList<>(assistantMessage.actionCalls());
        nextCallIndex    = 0;
        collectedResults = new ArrayList<>();
        turn++;
    }

    boolean hasUnresolvedCalls() {
        return nextCallIndex < pendingCalls.size();
    }

    ActionCall currentCall() {
        return pendingCalls.get(nextCallIndex);
    }

    void resolveCurrentCall(ActionResult result) {
        collectedResults.add(result);
        nextCallIndex++;
    }

    /** Once every pending call has a result, hand the results to the LLM as the next user message. */
    void closeTurn() {
        if (!pendingCalls.isEmpty() && !hasUnresolvedCalls()) {
            history.add(ConversationMessage.results(collectedResults));
            pendingCalls     = new ArrayList<>();
            collectedResults = new ArrayList<>();
            nextCallIndex    = 0;
        }
    }

    /** Text of the most recent assistant message, or null. */
    String lastAssistantText() {
        for (int i = history.size() - 1; i >= 0; i--) {
            ConversationMessage m = history.get(i);
            if (m.role() == ConversationMessage.Role.ASSISTANT) {
                return m.text();
            }
        }
        return null;
    }

    // -------------------------------------------------------------------------
    // Bean accessors (Jackson)
    // -------------------------------------------------------------------------

    public List<ConversationMessage> getHistory()          { return history; }
    public List<ActionCall>          getPendingCalls()     { return pendingCalls; }
    public int                       getNextCallIndex()    { return nextCallIndex; }
    public List<ActionResult>        getCollectedResults() { return collectedResults; }
    public int                       getTurn()             { return turn; }
    public TaskStatus                getRequestedStatus()  { return requestedStatus; }
    public String                    getRequestReason()    { return requestReason; }
    public Interrupt                 getPendingInterrupt() { return pendingInterrupt; }

    public void setHistory(List<ConversationMessage> history)          { this.history = new ArrayList<>(history); }
    public void setPendingCalls(List<ActionCall> pendingCalls)         { this.pendingCalls = new ArrayList<>(pendingCalls); }
    public void setNextCallIndex(int nextCallIndex)                    { this.nextCallIndex = nextCallIndex; }
    public void setCollectedResults(List<ActionResult> results)        { this.collectedResults = new ArrayList<>(results); }
    public void setTurn(int turn)                                      { this.turn = turn; }
    public void setRequestedStatus(TaskStatus requestedStatus)         { this.requestedStatus = requestedStatus; }
    public void setRequestReason(String requestReason)                 { this.requestReason = requestReason; }
    public void setPendingInterrupt(Interrupt pendingInterrupt)        { this.pendingInterrupt = pendingInterrupt; }
}
