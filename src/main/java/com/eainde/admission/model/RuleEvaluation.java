package com.eainde.admission.model;

/**
 * One evaluated rule within a decision.
 *
 * @param ruleId     stable id within the decision (chunk id or document requirement id)
 * @param ruleText   text of the rule as evaluated
 * @param outcome    interpreter verdict
 * @param required   whether the rule governs admission for this applicant
 * @param pathway    alternative admission route the rule belongs to, null for mandatory rules
 * @param confidence confidence of the verdict in [0,1]
 * @param reasoning  interpreter explanation
 * @param citation   source chunk, null for rules not drawn from the rulebook
 */
public record RuleEvaluation(
        String ruleId,
        String ruleText,
        RuleOutcome outcome,
        boolean required,
        String pathway,
        double confidence,
        String reasoning,
        Citation citation
) {}
