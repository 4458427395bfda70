package com.eainde.admission.stage.decide;

import com.eainde.admission.model.RuleEvaluation;
import com.eainde.admission.model.RuleOutcome;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Required rules without a pathway are mandatory. Required rules sharing a pathway name
 * form one alternative route; the application passes when every mandatory rule holds and,
 * if any pathway exists, at least one pathway has all its rules satisfied.
 */
public class AlternativePathwayAggregationPolicy implements AggregationPolicy {

    @Override
    public boolean rejects(List<RuleEvaluation> evaluations) {
        boolean mandatoryFailed = evaluations.stream()
                .anyMatch(e -> e.required() && e.pathway() == null && e.outcome() == RuleOutcome.NOT_SATISFIED);
        if (mandatoryFailed) {
            return true;
        }
        Map<String, List<RuleEvaluation>> pathways = evaluations.stream()
                .filter(e -> e.required() && e.pathway() != null)
                .collect(Collectors.groupingBy(RuleEvaluation::pathway));
        if (pathways.isEmpty()) {
            return false;
        }
        return pathways.values().stream()
                .noneMatch(rules -> rules.stream().allMatch(e -> e.outcome() == RuleOutcome.SATISFIED));
    }
}
