package com.eainde.admission.repository;

import com.eainde.admission.exception.ApplicationNotFoundException;
import com.eainde.admission.model.ApplicationRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Process-wide application store: an indexed map of immutable snapshots with one lock per key.
 */
public class InMemoryApplicationRepository implements ApplicationRepository {

    private final Map<String, ApplicationRecord> storage = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public void create(ApplicationRecord record) {
        locks.computeIfAbsent(record.id(), k -> new ReentrantLock());
        ApplicationRecord existing = storage.putIfAbsent(record.id(), record);
        if (existing != null) {
            throw new IllegalStateException("Application already exists: " + record.id());
        }
    }

    @Override
    public Optional<ApplicationRecord> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public Collection<ApplicationRecord> findAll() {
        List<ApplicationRecord> all = new ArrayList<>(storage.values());
        all.sort(Comparator.comparing(ApplicationRecord::createdAt).thenComparing(ApplicationRecord::id));
        return Collections.unmodifiableList(all);
    }

    @Override
    public ApplicationRecord update(String id, UnaryOperator<ApplicationRecord> mutation) {
        ReentrantLock lock = locks.get(id);
        if (lock == null) {
            throw new ApplicationNotFoundException(id);
        }
        lock.lock();
        try {
            ApplicationRecord current = storage.get(id);
            if (current == null) {
                throw new ApplicationNotFoundException(id);
            }
            ApplicationRecord next = mutation.apply(current);
            if (next == null || !id.equals(next.id())) {
                throw new IllegalStateException("Update of " + id + " must return a snapshot of the same application");
            }
            storage.put(id, next);
            return next;
        } finally {
            lock.unlock();
        }
    }
}
