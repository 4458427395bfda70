package com.eainde.admission.stage.decide;

import com.eainde.admission.model.RuleEvaluation;
import com.eainde.admission.model.RuleOutcome;

import java.util.List;

public class StrictAggregationPolicy implements AggregationPolicy {

    @Override
    public boolean rejects(List<RuleEvaluation> evaluations) {
        return evaluations.stream()
                .anyMatch(e -> e.required() && e.outcome() == RuleOutcome.NOT_SATISFIED);
    }
}
