package com.eainde.admission.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of one admission application.
 *
 * <p>Every mutation returns a new snapshot. Stage-changing methods enforce
 * {@link ApplicationStage#canTransitionTo(ApplicationStage)} so a record can only move
 * forward one stage at a time or jump once to {@link ApplicationStage#ERROR}.</p>
 */
public record ApplicationRecord(
        String id,
        String applicantId,
        String targetProgram,
        String entity,
        List<DocumentDescriptor> documents,
        ApplicationStage currentStage,
        List<ClassifiedDocument> classifiedDocuments,
        ApplicantProfile profile,
        Decision decision,
        StageFailure failure,
        Instant createdAt,
        Instant updatedAt,
        List<AgentLogEntry> events
) {
    public ApplicationRecord {
        documents = documents == null ? List.of() : List.copyOf(documents);
        classifiedDocuments = classifiedDocuments == null ? List.of() : List.copyOf(classifiedDocuments);
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static ApplicationRecord create(String id,
                                           String applicantId,
                                           String targetProgram,
                                           String entity,
                                           List<DocumentDescriptor> documents,
                                           Instant now) {
        return new ApplicationRecord(id, applicantId, targetProgram, entity, documents,
                ApplicationStage.READY, List.of(), null, null, null, now, now, List.of());
    }

    public ApplicationRecord startClassification(Instant now) {
        return transition(ApplicationStage.CLASSIFYING, classifiedDocuments, profile, decision, null, now);
    }

    public ApplicationRecord withClassification(List<ClassifiedDocument> classified, Instant now) {
        return transition(ApplicationStage.EXTRACTING, classified, profile, decision, null, now);
    }

    public ApplicationRecord withProfile(ApplicantProfile extracted, Instant now) {
        return transition(ApplicationStage.DECIDING, classifiedDocuments, extracted, decision, null, now);
    }

    public ApplicationRecord withDecision(Decision made, Instant now) {
        return transition(ApplicationStage.DECISION_MADE, classifiedDocuments, profile, made, null, now);
    }

    public ApplicationRecord fail(StageFailure stageFailure, Instant now) {
        return transition(ApplicationStage.ERROR, classifiedDocuments, profile, decision, stageFailure, now);
    }

    public ApplicationRecord appendEvent(AgentLogEntry entry) {
        List<AgentLogEntry> appended = new ArrayList<>(events);
        appended.add(entry);
        Instant touched = entry.timestamp() != null && entry.timestamp().isAfter(updatedAt)
                ? entry.timestamp() : updatedAt;
        return new ApplicationRecord(id, applicantId, targetProgram, entity, documents, currentStage,
                classifiedDocuments, profile, decision, failure, createdAt, touched, appended);
    }

    public boolean isTerminal() {
        return currentStage.isTerminal();
    }

    private ApplicationRecord transition(ApplicationStage next,
                                         List<ClassifiedDocument> classified,
                                         ApplicantProfile nextProfile,
                                         Decision nextDecision,
                                         StageFailure nextFailure,
                                         Instant now) {
        if (!currentStage.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Application " + id + " cannot move from " + currentStage + " to " + next);
        }
        return new ApplicationRecord(id, applicantId, targetProgram, entity, documents, next,
                classified, nextProfile, nextDecision, nextFailure, createdAt, now, events);
    }
}
