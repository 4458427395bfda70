package com.eainde.admission.rag;

import java.util.List;

public record RuleAnswer(String question, String answer, List<RuleReference> sources) {

    public RuleAnswer {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
