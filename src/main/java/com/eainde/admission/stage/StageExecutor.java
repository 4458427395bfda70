package com.eainde.admission.stage;

import com.eainde.admission.exception.StageExecutionException;
import com.eainde.admission.model.ApplicationStage;

/**
 * A typed transform run by one workflow stage.
 *
 * @param <I> stage input
 * @param <O> stage output, committed to the application record on success
 */
public interface StageExecutor<I, O> {

    /**
     * @throws StageExecutionException when no acceptable output can be produced
     */
    O execute(I input);

    /**
     * The stage the application is in while this executor runs.
     */
    ApplicationStage stage();
}
