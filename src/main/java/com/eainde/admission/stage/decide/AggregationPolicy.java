package com.eainde.admission.stage.decide;

import com.eainde.admission.model.DecisionStatus;
import com.eainde.admission.model.RuleEvaluation;
import com.eainde.admission.model.RuleOutcome;

import java.util.List;

/**
 * Turns rule evaluations and the aggregate confidence into a decision status.
 *
 * <p>Precedence is fixed for every policy: any required {@code INSUFFICIENT_DATA} gives
 * {@link DecisionStatus#MISSING_DOCS}; otherwise a policy-specific rejection check runs;
 * otherwise confidence below the review threshold gives
 * {@link DecisionStatus#REVIEW_REQUIRED}; otherwise {@link DecisionStatus#APPROVED}.</p>
 */
public interface AggregationPolicy {

    default DecisionStatus aggregate(List<RuleEvaluation> evaluations, double confidence, double reviewThreshold) {
        boolean insufficient = evaluations.stream()
                .anyMatch(e -> e.required() && e.outcome() == RuleOutcome.INSUFFICIENT_DATA);
        if (insufficient) {
            return DecisionStatus.MISSING_DOCS;
        }
        if (rejects(evaluations)) {
            return DecisionStatus.REJECTED;
        }
        if (confidence < reviewThreshold) {
            return DecisionStatus.REVIEW_REQUIRED;
        }
        return DecisionStatus.APPROVED;
    }

    /**
     * @param evaluations evaluations without any required insufficient-data outcome
     */
    boolean rejects(List<RuleEvaluation> evaluations);
}
