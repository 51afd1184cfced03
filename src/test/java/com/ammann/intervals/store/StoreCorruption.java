/* (C)2026 */
package com.ammann.intervals.store;

import com.ammann.intervals.model.Program;

/**
 * Writes to the stores without going through {@link ProgramSynchronizer}, the way an
 * out-of-band edit of the underlying tables would.
 */
public final class StoreCorruption {

    private final ProgramStore programStore;
    private final IntervalStore intervalStore;
    private final StoreLock storeLock;

    public StoreCorruption(ProgramStore programStore, IntervalStore intervalStore, StoreLock storeLock) {
        this.programStore = programStore;
        this.intervalStore = intervalStore;
        this.storeLock = storeLock;
    }

    /** Adds a program without creating its interval record. */
    public void addProgram(Program program) {
        storeLock.write(() -> programStore.add(program));
    }

    /** Writes an interval record regardless of the program store. */
    public void putIntervalRecord(String name, int count) {
        storeLock.write(
                () -> {
                    intervalStore.upsert(name, count);
                    return null;
                });
    }

    public void removeIntervalRecord(String name) {
        storeLock.write(() -> intervalStore.remove(name));
    }
}
