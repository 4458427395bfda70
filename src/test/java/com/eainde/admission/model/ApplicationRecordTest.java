package com.eainde.admission.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplicationRecordTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static ApplicationRecord ready() {
        return ApplicationRecord.create("APP-0000000A", "applicant-1", "Finanzmanagement", "DE",
                List.of(new DocumentDescriptor("DOC-000001", "abitur.pdf", "application/pdf", 42)), T0);
    }

    private static Decision approved() {
        return new Decision(DecisionStatus.APPROVED, 0.95, "ok", List.of(), List.of(), List.of(),
                new RetrievalTrace("q", List.of()));
    }

    @Nested
    @DisplayName("stage transitions")
    class Transitions {

        @Test
        @DisplayName("happy path walks every stage in order")
        void happyPath() {
            ApplicationRecord record = ready()
                    .startClassification(T0.plusSeconds(1))
                    .withClassification(List.of(), T0.plusSeconds(2))
                    .withProfile(ApplicantProfile.builder().build(), T0.plusSeconds(3))
                    .withDecision(approved(), T0.plusSeconds(4));

            assertThat(record.currentStage()).isEqualTo(ApplicationStage.DECISION_MADE);
            assertThat(record.isTerminal()).isTrue();
            assertThat(record.updatedAt()).isEqualTo(T0.plusSeconds(4));
            assertThat(record.createdAt()).isEqualTo(T0);
        }

        @Test
        @DisplayName("skipping a stage is rejected")
        void skipRejected() {
            assertThatThrownBy(() -> ready().withClassification(List.of(), T0))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("READY")
                    .hasMessageContaining("EXTRACTING");
        }

        @Test
        @DisplayName("terminal records never transition again")
        void terminalIsFinal() {
            ApplicationRecord failed = ready().fail(new StageFailure(ApplicationStage.READY, "boom"), T0);

            assertThat(failed.currentStage()).isEqualTo(ApplicationStage.ERROR);
            assertThatThrownBy(() -> failed.startClassification(T0)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> failed.fail(new StageFailure(ApplicationStage.ERROR, "again"), T0))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("failure keeps outputs of earlier stages")
        void failureKeepsOutputs() {
            ApplicationRecord record = ready()
                    .startClassification(T0)
                    .withClassification(List.of(), T0)
                    .fail(new StageFailure(ApplicationStage.EXTRACTING, "no data"), T0);

            assertThat(record.failure().stage()).isEqualTo(ApplicationStage.EXTRACTING);
            assertThat(record.classifiedDocuments()).isEmpty();
            assertThat(record.profile()).isNull();
        }

        @Test
        @DisplayName("events can be appended to terminal records")
        void appendOnTerminal() {
            ApplicationRecord failed = ready().fail(new StageFailure(ApplicationStage.READY, "boom"), T0);
            ApplicationRecord appended = failed.appendEvent(AgentLogEntry.of(T0.plusSeconds(9), "Workflow", "resubmitted"));

            assertThat(appended.events()).extracting(AgentLogEntry::action).containsExactly("resubmitted");
            assertThat(appended.currentStage()).isEqualTo(ApplicationStage.ERROR);
            assertThat(appended.updatedAt()).isEqualTo(T0.plusSeconds(9));
            assertThat(failed.events()).isEmpty();
        }
    }

    @Nested
    @DisplayName("ApplicationStage")
    class Stages {

        @ParameterizedTest
        @EnumSource(value = ApplicationStage.class, names = {"READY", "CLASSIFYING", "EXTRACTING", "DECIDING"})
        @DisplayName("ERROR is reachable from every non-terminal stage")
        void errorReachable(ApplicationStage stage) {
            assertThat(stage.canTransitionTo(ApplicationStage.ERROR)).isTrue();
        }

        @Test
        @DisplayName("stages never regress")
        void noRegression() {
            assertThat(ApplicationStage.EXTRACTING.canTransitionTo(ApplicationStage.CLASSIFYING)).isFalse();
            assertThat(ApplicationStage.DECIDING.canTransitionTo(ApplicationStage.DECIDING)).isFalse();
            assertThat(ApplicationStage.DECISION_MADE.canTransitionTo(ApplicationStage.ERROR)).isFalse();
        }
    }

    @Nested
    @DisplayName("vocabularies")
    class Vocabularies {

        @Test
        @DisplayName("unseen document types map to other")
        void unseenLabel() {
            assertThat(DocumentLabel.fromValue("passport")).isEqualTo(DocumentLabel.OTHER);
            assertThat(DocumentLabel.fromValue(null)).isEqualTo(DocumentLabel.OTHER);
            assertThat(DocumentLabel.fromValue("Qualification_Certificate"))
                    .isEqualTo(DocumentLabel.QUALIFICATION_CERTIFICATE);
            assertThat(DocumentLabel.fromValue("work certificate")).isEqualTo(DocumentLabel.WORK_CERTIFICATE);
        }

        @Test
        @DisplayName("rule outcomes parse leniently and reject unknown values")
        void outcomes() {
            assertThat(RuleOutcome.parse("not-satisfied")).contains(RuleOutcome.NOT_SATISFIED);
            assertThat(RuleOutcome.parse(" insufficient_data ")).contains(RuleOutcome.INSUFFICIENT_DATA);
            assertThat(RuleOutcome.parse("maybe")).isEmpty();
        }

        @Test
        @DisplayName("decision confidence must lie within [0,1]")
        void decisionConfidenceBounds() {
            assertThatThrownBy(() -> new Decision(DecisionStatus.APPROVED, 1.2, "", null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new Decision(DecisionStatus.APPROVED, Double.NaN, "", null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("profile reports missing fields")
        void missingFields() {
            ApplicantProfile profile = ApplicantProfile.builder().qualificationType("Abitur").build();

            assertThat(profile.missingFields())
                    .containsExactly(ApplicantProfile.NORMALIZED_GRADE, ApplicantProfile.WORK_EXPERIENCE_MONTHS);
        }
    }
}
