/* (C)2026 */
package com.ammann.intervals.store;

import com.ammann.intervals.model.IntervalRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Derived collection of interval counts, keyed by program name.
 *
 * <p>Holds at most one {@link IntervalRecord} per name. Written only by
 * {@link ProgramSynchronizer}; mutators are package-private and must run inside a
 * {@link StoreLock} write section.
 */
@ApplicationScoped
public class IntervalStore {

    private final StoreLock storeLock;
    private final Map<String, IntervalRecord> records = new LinkedHashMap<>();

    @Inject
    public IntervalStore(StoreLock storeLock) {
        this.storeLock = storeLock;
    }

    public Optional<IntervalRecord> find(String programName) {
        return storeLock.read(() -> Optional.ofNullable(records.get(programName)));
    }

    /**
     * Returns a copy of all records in insertion order.
     */
    public List<IntervalRecord> snapshot() {
        return storeLock.read(() -> List.copyOf(records.values()));
    }

    public int size() {
        return storeLock.read(records::size);
    }

    void upsert(String programName, int intervalCount) {
        storeLock.checkWriteLocked();
        Objects.requireNonNull(programName, "programName");
        records.put(programName, new IntervalRecord(programName, intervalCount));
    }

    boolean remove(String programName) {
        storeLock.checkWriteLocked();
        return records.remove(programName) != null;
    }

    void restore(Collection<IntervalRecord> state) {
        storeLock.checkWriteLocked();
        records.clear();
        state.forEach(r -> records.put(r.programName(), r));
    }
}
