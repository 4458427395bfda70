package com.eainde.admission.repository;

import com.eainde.admission.exception.ApplicationNotFoundException;
import com.eainde.admission.model.AgentLogEntry;
import com.eainde.admission.model.ApplicationRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryApplicationRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryApplicationRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryApplicationRepository();
    }

    private static ApplicationRecord record(String id, Instant createdAt) {
        return ApplicationRecord.create(id, "applicant", "Program", "DE", List.of(), createdAt);
    }

    @Test
    @DisplayName("duplicate ids are rejected")
    void duplicateRejected() {
        repository.create(record("APP-1", T0));

        assertThatThrownBy(() -> repository.create(record("APP-1", T0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("updating an unknown id fails")
    void unknownUpdate() {
        assertThatThrownBy(() -> repository.update("APP-404", r -> r))
                .isInstanceOf(ApplicationNotFoundException.class);
    }

    @Test
    @DisplayName("findAll is ordered by creation time")
    void orderedByCreation() {
        repository.create(record("APP-B", T0.plusSeconds(5)));
        repository.create(record("APP-A", T0));

        assertThat(repository.findAll()).extracting(ApplicationRecord::id).containsExactly("APP-A", "APP-B");
    }

    @Test
    @DisplayName("an update may not change the record id")
    void idIsStable() {
        repository.create(record("APP-1", T0));

        assertThatThrownBy(() -> repository.update("APP-1", r -> record("APP-2", T0)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(repository.findById("APP-2")).isEmpty();
    }

    @Test
    @DisplayName("concurrent updates of one record are serialized")
    void concurrentUpdatesSerialized() throws Exception {
        repository.create(record("APP-1", T0));
        int writers = 16;
        int appendsPerWriter = 50;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < appendsPerWriter; i++) {
                        repository.update("APP-1", r -> r.appendEvent(AgentLogEntry.of(T0, "test", "tick")));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(repository.findById("APP-1")).get()
                .extracting(r -> r.events().size())
                .isEqualTo(writers * appendsPerWriter);
    }

    @Test
    @DisplayName("document store returns copies of the stored bytes")
    void documentStoreCopies() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        byte[] content = {1, 2, 3};
        store.put("DOC-1", content);
        content[0] = 9;

        assertThat(store.get("DOC-1")).get().isEqualTo(new byte[]{1, 2, 3});
        assertThat(store.get("DOC-2")).isEmpty();
    }
}
