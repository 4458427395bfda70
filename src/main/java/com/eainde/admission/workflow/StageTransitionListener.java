package com.eainde.admission.workflow;

import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;

/**
 * Callback fired after every committed stage transition. Hook for downstream
 * notification delivery.
 */
public interface StageTransitionListener {

    void onTransition(ApplicationStage from, ApplicationRecord committed);
}
