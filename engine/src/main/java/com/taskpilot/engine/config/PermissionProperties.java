package com.taskpilot.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Permission rule settings ({@code taskpilot.permissions.*}).
 *
 * @param file  YAML rule file; re-read on every evaluation. When blank or
 *              missing, {@code allow}/{@code deny} are used instead.
 * @param allow default allow-set
 * @param deny  default deny-set
 */
@ConfigurationProperties(prefix = "taskpilot.permissions")
public record PermissionProperties(
        String file,
        @DefaultValue({"get_tasks", "get_task", "add_comment"}) List<String> allow,
        @DefaultValue({"mcp_tool(*)", "update_task(status=done)", "update_task(status=cancelled)"})
        List<String> deny) {
}
