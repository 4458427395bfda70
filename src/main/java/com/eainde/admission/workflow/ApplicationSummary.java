package com.eainde.admission.workflow;

import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.DecisionStatus;

import java.time.Instant;

public record ApplicationSummary(
        String applicationId,
        String applicantId,
        String targetProgram,
        String entity,
        ApplicationStage stage,
        Instant createdAt,
        int documentCount,
        DecisionStatus decisionStatus
) {
    public static ApplicationSummary from(ApplicationRecord record) {
        return new ApplicationSummary(record.id(), record.applicantId(), record.targetProgram(), record.entity(),
                record.currentStage(), record.createdAt(), record.documents().size(),
                record.decision() == null ? null : record.decision().status());
    }
}
