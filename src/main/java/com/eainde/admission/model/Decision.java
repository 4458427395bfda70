package com.eainde.admission.model;

import java.util.List;

/**
 * Final output of the decision stage.
 */
public record Decision(
        DecisionStatus status,
        double confidence,
        String reasoning,
        List<Citation> citations,
        List<RuleEvaluation> evaluations,
        List<String> missingDocuments,
        RetrievalTrace retrieval
) {
    public Decision {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        citations = citations == null ? List.of() : List.copyOf(citations);
        evaluations = evaluations == null ? List.of() : List.copyOf(evaluations);
        missingDocuments = missingDocuments == null ? List.of() : List.copyOf(missingDocuments);
    }
}
