package com.eainde.admission.stage.extract;

import com.eainde.admission.model.ApplicantProfile;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.ClassifiedDocument;
import com.eainde.admission.stage.StageExecutor;

import java.util.List;

/**
 * Pulls structured applicant data out of classified documents.
 */
public interface Extractor extends StageExecutor<List<ClassifiedDocument>, ApplicantProfile> {

    @Override
    default ApplicationStage stage() {
        return ApplicationStage.EXTRACTING;
    }
}
