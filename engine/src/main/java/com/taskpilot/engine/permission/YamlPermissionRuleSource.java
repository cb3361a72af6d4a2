package com.taskpilot.engine.permission;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.taskpilot.engine.config.PermissionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Permission rules backed by a YAML file:
 *
 * <pre>
 * permissions:
 *   allow:
 *     - get_tasks
 *   deny:
 *     - mcp_tool(*)
 * </pre>
 *
 * The file is read on every {@link #current()} call, so edits take effect on
 * the next evaluation without a restart. Without a file the configured
 * defaults are used, plus any rules added at runtime.
 */
@Component
public class YamlPermissionRuleSource implements PermissionRuleSource {

    private static final Logger log = LoggerFactory.getLogger(YamlPermissionRuleSource.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleFile(Section permissions) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Section(List<String> allow, List<String> deny) {}

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private final Path file;
    private final List<String> defaultAllow;
    private final List<String> defaultDeny;

    public YamlPermissionRuleSource(PermissionProperties props) {
        this.file         = props.file() == null || props.file().isBlank() ? null : Path.of(props.file());
        this.defaultAllow = new CopyOnWriteArrayList<>(props.allow() == null ? List.of() : props.allow());
        this.defaultDeny  = List.copyOf(props.deny() == null ? List.of() : props.deny());
    }

    @Override
    public PermissionRules current() {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            RuleFile parsed = yaml.readValue(file.toFile(), RuleFile.class);
            if (parsed == null || parsed.permissions() == null) {
                return new PermissionRules(List.of(), List.of());
            }
            return new PermissionRules(parsed.permissions().allow(), parsed.permissions().deny());
        } catch (IOException e) {
            log.error("Cannot read permission rules from {}, using defaults: {}", file, e.getMessage());
            return defaults();
        }
    }

    @Override
    public synchronized void addAllowRule(String pattern) {
        if (file == null) {
            if (!defaultAllow.contains(pattern)) {
                defaultAllow.add(pattern);
                log.info("Added allow rule (in memory): {}", pattern);
            }
            return;
        }
        PermissionRules now = current();
        if (now.allow().contains(pattern)) {
            return;
        }
        List<String> allow = new ArrayList<>(now.allow());
        allow.add(pattern);
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            yaml.writeValue(file.toFile(), new RuleFile(new Section(allow, now.deny())));
            log.info("Added allow rule to {}: {}", file, pattern);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write permission rules to " + file, e);
        }
    }

    private PermissionRules defaults() {
        return new PermissionRules(defaultAllow, defaultDeny);
    }
}
