package com.taskpilot.engine.interrupt;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An interrupt payload whose type is not known to this build.
 * Routed like a question, with a generic message.
 */
@JsonTypeName("unrecognized")
public final class UnrecognizedInterrupt implements Interrupt {

    private final Map<String, Object> payload = new LinkedHashMap<>();

    public UnrecognizedInterrupt() {}

    public UnrecognizedInterrupt(Map<String, Object> payload) {
        if (payload != null) this.payload.putAll(payload);
    }

    @JsonAnySetter
    void put(String key, Object value) {
        payload.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> payload() { return Collections.unmodifiableMap(payload); }

    @Override
    @JsonIgnore
    public InterruptKind kind() { return InterruptKind.UNKNOWN; }

    @Override
    public String toString() {
        return "UnrecognizedInterrupt" + payload;
    }
}
