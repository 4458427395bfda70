package com.eainde.admission.repository;

import com.eainde.admission.model.ApplicationRecord;

import java.util.Collection;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed store of application snapshots.
 *
 * <p>Reads return the last committed snapshot and never wait for writers. Updates for the
 * same id are serialized; the update function sees the latest snapshot and its result
 * replaces it as a whole.</p>
 */
public interface ApplicationRepository {

    /**
     * Stores a new record.
     *
     * @throws IllegalStateException if a record with the same id already exists
     */
    void create(ApplicationRecord record);

    Optional<ApplicationRecord> findById(String id);

    Collection<ApplicationRecord> findAll();

    /**
     * Atomically replaces the record with {@code mutation.apply(current)}.
     *
     * @return the committed snapshot
     * @throws com.eainde.admission.exception.ApplicationNotFoundException for unknown ids
     */
    ApplicationRecord update(String id, UnaryOperator<ApplicationRecord> mutation);
}
