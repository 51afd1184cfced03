/* (C)2026 */
package com.ammann.intervals.support;

import com.ammann.intervals.model.Program;
import com.ammann.intervals.model.TimeRange;
import com.ammann.intervals.service.IntegrityValidationService;
import com.ammann.intervals.store.IntervalStore;
import com.ammann.intervals.store.ProgramStore;
import com.ammann.intervals.store.ProgramSynchronizer;
import com.ammann.intervals.store.StoreCorruption;
import com.ammann.intervals.store.StoreLock;

/**
 * Wires the stores, synchronizer and validator by hand, as CDI would.
 */
public final class TestSchedule {

    public final StoreLock lock = new StoreLock();
    public final ProgramStore programs = new ProgramStore(lock);
    public final IntervalStore intervals = new IntervalStore(lock);
    public final ProgramSynchronizer synchronizer = new ProgramSynchronizer(programs, intervals, lock);
    public final IntegrityValidationService validator =
            new IntegrityValidationService(programs, intervals, lock);
    public final StoreCorruption corruption = new StoreCorruption(programs, intervals, lock);

    public static TimeRange range(String start, String end) {
        return TimeRange.parse(start, end);
    }

    public static Program program(String name, String start, String end) {
        return new Program(name, range(start, end));
    }

    /** Inserts {@code name} through the synchronizer. */
    public TestSchedule with(String name, String start, String end) {
        synchronizer.insert(name, range(start, end));
        return this;
    }

    /** A small evening line-up with no gaps, overlaps or findings of any kind. */
    public TestSchedule eveningLineUp() {
        return with("Evening News", "18:00", "19:00")
                .with("Quiz Hour", "19:00", "20:00")
                .with("Feature Film", "20:00", "22:30")
                .with("Late Talk", "22:30", "23:30");
    }
}
