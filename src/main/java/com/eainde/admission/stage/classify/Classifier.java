package com.eainde.admission.stage.classify;

import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.ClassifiedDocument;
import com.eainde.admission.model.DocumentDescriptor;
import com.eainde.admission.stage.StageExecutor;

import java.util.List;

/**
 * Assigns every uploaded document a label from the fixed vocabulary.
 */
public interface Classifier extends StageExecutor<List<DocumentDescriptor>, List<ClassifiedDocument>> {

    @Override
    default ApplicationStage stage() {
        return ApplicationStage.CLASSIFYING;
    }
}
