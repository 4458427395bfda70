package com.eainde.admission.stage.decide;

import com.eainde.admission.model.ApplicantProfile;
import com.eainde.admission.model.DocumentLabel;

import java.util.Set;

/**
 * Everything the decision stage needs about one application.
 *
 * @param providedLabels labels of the documents the applicant uploaded, after classification
 */
public record DecisionRequest(
        String applicationId,
        ApplicantProfile profile,
        String targetProgram,
        String entity,
        Set<DocumentLabel> providedLabels
) {
    public DecisionRequest {
        providedLabels = providedLabels == null ? Set.of() : Set.copyOf(providedLabels);
    }
}
