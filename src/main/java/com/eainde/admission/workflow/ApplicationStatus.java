package com.eainde.admission.workflow;

import com.eainde.admission.model.AgentLogEntry;
import com.eainde.admission.model.ApplicantProfile;
import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.ClassifiedDocument;
import com.eainde.admission.model.Decision;
import com.eainde.admission.model.StageFailure;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of an application as last committed.
 */
public record ApplicationStatus(
        String applicationId,
        String applicantId,
        String targetProgram,
        String entity,
        ApplicationStage stage,
        List<ClassifiedDocument> classifiedDocuments,
        ApplicantProfile profile,
        Decision decision,
        StageFailure failure,
        List<AgentLogEntry> events,
        Instant createdAt,
        Instant updatedAt
) {
    public static ApplicationStatus from(ApplicationRecord record) {
        return new ApplicationStatus(record.id(), record.applicantId(), record.targetProgram(), record.entity(),
                record.currentStage(), record.classifiedDocuments(), record.profile(), record.decision(),
                record.failure(), record.events(), record.createdAt(), record.updatedAt());
    }

    public Optional<Decision> findDecision() {
        return Optional.ofNullable(decision);
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }
}
