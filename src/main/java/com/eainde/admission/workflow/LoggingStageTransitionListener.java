package com.eainde.admission.workflow;

import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

@Log4j2
@Component
public class LoggingStageTransitionListener implements StageTransitionListener {

    @Override
    public void onTransition(ApplicationStage from, ApplicationRecord committed) {
        if (committed.currentStage() == ApplicationStage.ERROR) {
            log.warn("Application {} moved {} -> ERROR: {}", committed.id(), from,
                    committed.failure() == null ? "" : committed.failure().detail());
        } else if (committed.currentStage() == ApplicationStage.DECISION_MADE && committed.decision() != null) {
            log.info("Application {} moved {} -> DECISION_MADE ({})", committed.id(), from,
                    committed.decision().status());
        } else {
            log.info("Application {} moved {} -> {}", committed.id(), from, committed.currentStage());
        }
    }
}
