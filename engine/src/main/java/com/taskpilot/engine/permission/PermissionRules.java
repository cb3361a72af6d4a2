package com.taskpilot.engine.permission;

import java.util.List;

/**
 * One snapshot of the configured rule sets. Deny rules always win over allow rules.
 */
public record PermissionRules(List<String> allow, List<String> deny) {

    public PermissionRules {
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny  = deny  == null ? List.of() : List.copyOf(deny);
    }
}
