package com.taskpilot.engine.permission;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Canonical string form of an action call, used for allow/deny matching and
 * in approval-request comments.
 *
 * <pre>
 *   get_tasks                              (no arguments)
 *   update_task(status=done)
 *   send_email(subject=hi,to=a@b.com)      (keys sorted lexicographically)
 * </pre>
 */
public final class PermissionPattern {

    // Argument names that always carry user data (never semantic).
    private static final Set<String> USER_DATA_KEYS = Set.of(
            "id", "task_id", "uuid", "execution_id", "thread_id", "run_id",
            "email", "username", "user_id", "user_identifier", "display_name",
            "name", "title", "description", "content", "body", "message",
            "password", "token", "secret", "key", "api_key");

    // Argument names that describe the kind of operation.
    private static final Set<String> SEMANTIC_KEYS = Set.of(
            "status", "type", "action", "mode", "state", "priority", "level",
            "category", "kind", "role", "permission", "access", "visibility");

    private PermissionPattern() {}

    /**
     * Format an action call. The same argument map yields the same string
     * regardless of its iteration order.
     */
    public static String format(String actionName, Map<String, ?> args) {
        if (args == null || args.isEmpty()) {
            return actionName;
        }
        String rendered = new TreeMap<>(args).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
        return actionName + "(" + rendered + ")";
    }

    /**
     * Keep only arguments that describe the type of operation (status=done,
     * mode=draft) and drop user-specific data (ids, emails, free text).
     * Used when a human answers "always allow", so the stored rule covers
     * the operation rather than one particular call.
     */
    public static Map<String, Object> semanticArguments(Map<String, ?> args) {
        Map<String, Object> kept = new LinkedHashMap<>();
        if (args == null) return kept;
        args.forEach((k, v) -> {
            if (isSemantic(k, v)) kept.put(k, v);
        });
        return kept;
    }

    static boolean isSemantic(String key, Object value) {
        String k = key.toLowerCase();
        if (USER_DATA_KEYS.contains(k)) return false;
        if (SEMANTIC_KEYS.contains(k))  return true;

        if (value instanceof Boolean || value instanceof Number) {
            return true;
        }
        if (value instanceof String s) {
            if (s.isBlank())                                          return false;
            if (s.contains("@"))                                      return false;
            if (s.startsWith("http://") || s.startsWith("https://")) return false;
            if (s.length() > 30)                                      return false;
            return !(s.contains(" ") && s.length() > 15);
        }
        return false;
    }
}
