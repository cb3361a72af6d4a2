package com.taskpilot.engine.permission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Decides whether an action call may run without asking a human.
 *
 * Deny rules are checked first and always win. Anything matched by neither
 * set is not approved.
 *
 * <p>A rule matches a call's {@link PermissionPattern} when, in order:
 * <ol>
 *   <li>it is exactly equal to the pattern;</li>
 *   <li>it has the form {@code name(*)} and the pattern starts with
 *       {@code name(}, i.e. the call carries arguments;</li>
 *   <li>it is a bare name (no parentheses, '=' or ','): only an exact
 *       match counts, which rule 1 already decided;</li>
 *   <li>its text occurs anywhere inside the pattern. This is a plain
 *       substring test, not argument matching: {@code status=done} matches
 *       {@code update_task(id=1,status=done)}, but {@code a=1} also matches
 *       {@code b(a=10)}.</li>
 * </ol>
 */
@Component
public class PermissionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PermissionEvaluator.class);

    private final PermissionRuleSource rules;

    public PermissionEvaluator(PermissionRuleSource rules) {
        this.rules = rules;
    }

    public boolean isApproved(String actionName, Map<String, ?> actionArgs) {
        String candidate = PermissionPattern.format(actionName, actionArgs);
        PermissionRules current = rules.current();

        if (matchesAny(current.deny(), candidate)) {
            log.debug("Action call denied by deny rule: {}", candidate);
            return false;
        }
        if (matchesAny(current.allow(), candidate)) {
            log.debug("Action call pre-approved: {}", candidate);
            return true;
        }
        log.debug("Action call requires approval: {}", candidate);
        return false;
    }

    private static boolean matchesAny(List<String> ruleSet, String candidate) {
        for (String rule : ruleSet) {
            if (matches(rule, candidate)) {
                return true;
            }
        }
        return false;
    }

    static boolean matches(String rule, String candidate) {
        if (rule == null || rule.isEmpty()) {
            return false;
        }
        if (rule.equals(candidate)) {
            return true;
        }
        if (rule.endsWith("(*)")) {
            return candidate.startsWith(rule.substring(0, rule.length() - 2));
        }
        if (isBareName(rule)) {
            return false;
        }
        return candidate.contains(rule);
    }

    private static boolean isBareName(String rule) {
        return rule.indexOf('(') < 0 && rule.indexOf(')') < 0
            && rule.indexOf('=') < 0 && rule.indexOf(',') < 0;
    }
}
