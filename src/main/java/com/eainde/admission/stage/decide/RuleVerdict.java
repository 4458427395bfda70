package com.eainde.admission.stage.decide;

import com.eainde.admission.model.RuleOutcome;

/**
 * Interpreter verdict for one rulebook passage.
 *
 * @param required whether the passage governs admission to the target program for this applicant
 * @param pathway  alternative route the rule belongs to, null for mandatory rules
 */
public record RuleVerdict(
        RuleOutcome outcome,
        boolean required,
        String pathway,
        double confidence,
        String reasoning
) {}
