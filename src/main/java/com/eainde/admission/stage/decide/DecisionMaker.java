package com.eainde.admission.stage.decide;

import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.Decision;
import com.eainde.admission.stage.StageExecutor;

/**
 * Produces the admission decision for an assembled profile.
 */
public interface DecisionMaker extends StageExecutor<DecisionRequest, Decision> {

    @Override
    default ApplicationStage stage() {
        return ApplicationStage.DECIDING;
    }
}
