package com.eainde.admission.exception;

import com.eainde.admission.model.ApplicationStage;

/**
 * A stage could not produce its output: the backing capability failed after bounded
 * retries, returned data that does not fit the expected schema, or the result was
 * below the stage's confidence floor. The application moves to
 * {@link ApplicationStage#ERROR}.
 */
public class StageExecutionException extends AdmissionException {

    private final ApplicationStage stage;

    public StageExecutionException(ApplicationStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageExecutionException(ApplicationStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public ApplicationStage getStage() {
        return stage;
    }
}
