package com.taskpilot.engine.llm;

import java.util.Map;

/**
 * A callable action as advertised to the LLM.
 *
 * @param inputSchema JSON Schema object describing the arguments
 */
public record ActionDefinition(String name, String description, Map<String, Object> inputSchema) {}
