package com.taskpilot.engine.interrupt;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.taskpilot.engine.permission.PermissionPattern;

import java.util.Map;

/**
 * The LLM asked for an action that the permission rules do not allow.
 */
public record ToolApprovalRequest(String actionName, Map<String, Object> actionArgs) implements Interrupt {

    public ToolApprovalRequest {
        actionArgs = actionArgs == null ? Map.of() : actionArgs;
    }

    @Override
    public InterruptKind kind() { return InterruptKind.TOOL_APPROVAL_REQUEST; }

    /** Canonical pattern, e.g. {@code update_task(status=done)}. */
    @JsonIgnore
    public String pattern() {
        return PermissionPattern.format(actionName, actionArgs);
    }
}
