package com.eainde.admission.stage.decide;

import com.eainde.admission.model.ApplicantProfile;
import com.eainde.admission.rag.RuleChunk;

/**
 * Evaluates a single rulebook passage against an applicant profile.
 */
public interface RuleInterpreter {

    /**
     * @throws com.eainde.admission.exception.StageExecutionException when the verdict
     *         cannot be obtained or does not fit the expected schema
     */
    RuleVerdict evaluate(RuleChunk rule, ApplicantProfile profile, String targetProgram, String entity);
}
