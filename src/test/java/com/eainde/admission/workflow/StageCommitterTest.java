package com.eainde.admission.workflow;

import com.eainde.admission.model.ApplicationRecord;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.repository.InMemoryApplicationRepository;
import com.eainde.admission.rag.RulebookFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageCommitterTest {

    private InMemoryApplicationRepository repository;
    private final List<String> transitions = new ArrayList<>();
    private StageCommitter committer;

    @BeforeEach
    void setUp() {
        repository = new InMemoryApplicationRepository();
        repository.create(ApplicationRecord.create("APP-00000001", "A-1", "Finanzmanagement", "DE", List.of(),
                RulebookFixtures.CLOCK.instant()));
        StageTransitionListener recording = (from, committed) -> transitions.add(from + "->" + committed.currentStage());
        StageTransitionListener broken = (from, committed) -> {
            throw new IllegalStateException("mail server down");
        };
        committer = new StageCommitter(repository, List.of(broken, recording), RulebookFixtures.CLOCK);
    }

    @Test
    @DisplayName("a commit changes stage and appends the event in one update")
    void commit() {
        ApplicationRecord committed = committer.commit("APP-00000001", (current, now) -> current.startClassification(now),
                "Workflow", "start_classification", Map.of("documents", 1));

        assertThat(committed.currentStage()).isEqualTo(ApplicationStage.CLASSIFYING);
        assertThat(committed.events()).singleElement()
                .satisfies(e -> assertThat(e.action()).isEqualTo("start_classification"));
        assertThat(transitions).containsExactly("READY->CLASSIFYING");
    }

    @Test
    @DisplayName("failing a terminal application changes nothing")
    void failIsIdempotent() {
        committer.fail("APP-00000001", ApplicationStage.READY, "first");
        ApplicationRecord second = committer.fail("APP-00000001", ApplicationStage.CLASSIFYING, "second");

        assertThat(second.failure().detail()).isEqualTo("first");
        assertThat(second.events()).hasSize(1);
        assertThat(transitions).containsExactly("READY->ERROR");
    }

    @Test
    @DisplayName("an illegal transition is refused and the record is left untouched")
    void illegalTransition() {
        assertThatThrownBy(() -> committer.commit("APP-00000001", (current, now) -> current.withProfile(null, now),
                "DataExtractor", "extract_data", Map.of()))
                .isInstanceOf(IllegalStateException.class);

        assertThat(repository.findById("APP-00000001")).get()
                .satisfies(r -> {
                    assertThat(r.currentStage()).isEqualTo(ApplicationStage.READY);
                    assertThat(r.events()).isEmpty();
                });
        assertThat(transitions).isEmpty();
    }
}
