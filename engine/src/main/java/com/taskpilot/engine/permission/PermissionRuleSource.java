package com.taskpilot.engine.permission;

/**
 * Read-through provider of the current permission rules.
 *
 * Rules may change between two calls (file edits, "always allow" answers),
 * so callers must ask for {@link #current()} on every evaluation and never
 * keep the result.
 */
public interface PermissionRuleSource {

    PermissionRules current();

    /** Append a pattern to the allow-set. No-op if it is already present. */
    void addAllowRule(String pattern);
}
