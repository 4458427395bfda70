package com.eainde.admission.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry of the append-only per-application event log.
 */
public record AgentLogEntry(
        Instant timestamp,
        String agent,
        String action,
        Map<String, Object> details
) {
    public AgentLogEntry {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static AgentLogEntry of(Instant timestamp, String agent, String action) {
        return new AgentLogEntry(timestamp, agent, action, Map.of());
    }
}
