package com.eainde.admission.rag;

import java.time.Instant;

public record RuleIndexStatus(
        boolean ready,
        int chunkCount,
        String buildId,
        Instant builtAt
) {
    public static RuleIndexStatus notInitialized() {
        return new RuleIndexStatus(false, 0, null, null);
    }
}
