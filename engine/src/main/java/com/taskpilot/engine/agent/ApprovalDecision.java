package com.taskpilot.engine.agent;

import java.util.Locale;

/**
 * A human's answer to a tool approval request.
 * Anything that is not recognisably an approval is a denial.
 */
public enum ApprovalDecision {
    APPROVE,
    ALWAYS_ALLOW,
    DENY;

    public static ApprovalDecision parse(String reply) {
        if (reply == null) {
            return DENY;
        }
        String normalized = reply.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "approve", "approved", "yes", "y" -> APPROVE;
            case "always_allow", "always"          -> ALWAYS_ALLOW;
            default                                -> DENY;
        };
    }
}
