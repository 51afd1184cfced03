/* (C)2026 */
package com.ammann.intervals.store;

import com.ammann.intervals.exception.ApiException;
import com.ammann.intervals.exception.DuplicateProgramException;
import com.ammann.intervals.exception.InvalidProgramNameException;
import com.ammann.intervals.exception.ProgramNotFoundException;
import com.ammann.intervals.exception.StorageFailureException;
import com.ammann.intervals.model.IntervalRecord;
import com.ammann.intervals.model.Program;
import com.ammann.intervals.model.TimeRange;
import com.ammann.intervals.service.IntervalCalculator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Single write path for the program schedule.
 *
 * <p>Every insert, update, rename and delete applied to {@link ProgramStore} is mirrored
 * into {@link IntervalStore} within one {@link StoreLock} write section, so the derived
 * interval counts always match the schedule as seen by readers:
 * <ul>
 *   <li>insert adds the program and upserts the record for its name;</li>
 *   <li>update replaces the program, dropping the record under the old name on rename and
 *       upserting the record under the new one;</li>
 *   <li>delete removes all programs with the name and their record.</li>
 * </ul>
 *
 * <p>Both stores are captured before a mutation. If a store write fails, both are
 * restored and the failure surfaces as {@link StorageFailureException}. No retries.
 */
@ApplicationScoped
public class ProgramSynchronizer {

    private static final Logger LOG = Logger.getLogger(ProgramSynchronizer.class);

    static final int DEFAULT_MAX_NAME_LENGTH = 255;

    /** Mutation kinds, used as the {@code operation} metric tag. */
    enum Operation {
        INSERT,
        UPDATE,
        DELETE;

        String tag() {
            return name().toLowerCase();
        }
    }

    private final ProgramStore programStore;
    private final IntervalStore intervalStore;
    private final StoreLock storeLock;

    @ConfigProperty(name = "programs.name.max-length", defaultValue = "255")
    int maxNameLength = DEFAULT_MAX_NAME_LENGTH;

    @Inject MeterRegistry meterRegistry;

    private final Map<Operation, Counter> mutationCounters = new EnumMap<>(Operation.class);
    private final Map<Operation, Counter> failureCounters = new EnumMap<>(Operation.class);

    @Inject
    public ProgramSynchronizer(
            ProgramStore programStore, IntervalStore intervalStore, StoreLock storeLock) {
        this.programStore = programStore;
        this.intervalStore = intervalStore;
        this.storeLock = storeLock;
    }

    @PostConstruct
    void init() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }
        for (Operation operation : Operation.values()) {
            mutationCounters.put(
                    operation,
                    Counter.builder("program_mutations_total")
                            .description("Program schedule mutations applied")
                            .tag("operation", operation.tag())
                            .register(meterRegistry));
            failureCounters.put(
                    operation,
                    Counter.builder("program_mutation_failures_total")
                            .description("Program schedule mutations rolled back")
                            .tag("operation", operation.tag())
                            .register(meterRegistry));
        }
    }

    /**
     * Adds a program and records its interval count.
     *
     * <p>A program whose name is already scheduled at a different time is accepted; the
     * record for the name then reflects the latest insert.
     *
     * @throws InvalidProgramNameException if the name is blank or too long
     * @throws DuplicateProgramException if the exact {@code (name, range)} pair exists
     * @throws StorageFailureException if a store write fails
     */
    public void insert(String name, TimeRange range) {
        validateName(name);
        Program program = new Program(name, range);

        mutate(
                Operation.INSERT,
                name,
                () -> {
                    if (!programStore.add(program)) {
                        throw new DuplicateProgramException(name, range);
                    }
                    int count = IntervalCalculator.count(range);
                    intervalStore.upsert(name, count);
                    LOG.infof("Inserted program '%s' %s -> %d intervals", name, range, count);
                    return null;
                });
    }

    /**
     * Moves a program to a new time slot, keeping its name.
     *
     * @see #update(String, String, TimeRange)
     */
    public void update(String name, TimeRange newRange) {
        update(name, name, newRange);
    }

    /**
     * Replaces the program called {@code name} with {@code (newName, newRange)}.
     *
     * <p>On rename the record under {@code name} is removed; the record under
     * {@code newName} always reflects {@code newRange}.
     *
     * @throws InvalidProgramNameException if either name is blank or too long
     * @throws ProgramNotFoundException if no program is called {@code name}
     * @throws DuplicateProgramException if the result would repeat a stored
     *     {@code (name, range)} pair, including several programs sharing {@code name}
     * @throws StorageFailureException if a store write fails
     */
    public void update(String name, String newName, TimeRange newRange) {
        validateName(name);
        validateName(newName);
        Program replacement = new Program(newName, newRange);

        mutate(
                Operation.UPDATE,
                name,
                () -> {
                    List<Program> matches = programStore.findByName(name);
                    if (matches.isEmpty()) {
                        throw new ProgramNotFoundException(name);
                    }
                    Program existing = matches.get(0);
                    if (matches.size() > 1
                            || (!existing.equals(replacement) && programStore.contains(replacement))) {
                        throw new DuplicateProgramException(newName, newRange);
                    }

                    programStore.replace(existing, replacement);
                    if (!name.equals(newName)) {
                        intervalStore.remove(name);
                    }
                    int count = IntervalCalculator.count(newRange);
                    intervalStore.upsert(newName, count);

                    if (name.equals(newName)) {
                        LOG.infof(
                                "Updated program '%s' %s -> %s, %d intervals",
                                name, existing.range(), newRange, count);
                    } else {
                        LOG.infof(
                                "Renamed program '%s' to '%s' %s -> %s, %d intervals",
                                name, newName, existing.range(), newRange, count);
                    }
                    return null;
                });
    }

    /**
     * Removes every program called {@code name} together with its interval record.
     * Unknown names are ignored.
     *
     * @return {@code true} if at least one program was removed
     * @throws StorageFailureException if a store write fails
     */
    public boolean delete(String name) {
        return mutate(
                Operation.DELETE,
                name,
                () -> {
                    List<Program> removed = programStore.removeByName(name);
                    if (removed.isEmpty()) {
                        LOG.debugf("Delete of unknown program '%s' ignored", name);
                        return false;
                    }
                    intervalStore.remove(name);
                    LOG.infof("Deleted program '%s' (%d rows)", name, removed.size());
                    return true;
                });
    }

    /**
     * Returns the stored interval count for {@code name}.
     */
    public Optional<Integer> getIntervalCount(String name) {
        return intervalStore.find(name).map(IntervalRecord::intervalCount);
    }

    /**
     * Lists scheduled programs.
     *
     * @param sortByStart order by start time instead of insertion order
     */
    public List<Program> listPrograms(boolean sortByStart) {
        List<Program> programs = programStore.snapshot();
        if (!sortByStart) {
            return programs;
        }
        List<Program> sorted = new ArrayList<>(programs);
        sorted.sort(ProgramStore.BY_START);
        return sorted;
    }

    public List<IntervalRecord> listIntervalRecords() {
        return intervalStore.snapshot();
    }

    private <T> T mutate(Operation operation, String name, Supplier<T> body) {
        return storeLock.write(
                () -> {
                    List<Program> programsBefore = programStore.snapshot();
                    List<IntervalRecord> recordsBefore = intervalStore.snapshot();
                    try {
                        T result = body.get();
                        incrementCounter(mutationCounters.get(operation));
                        return result;
                    } catch (ApiException e) {
                        rollback(programsBefore, recordsBefore);
                        throw e;
                    } catch (RuntimeException e) {
                        rollback(programsBefore, recordsBefore);
                        incrementCounter(failureCounters.get(operation));
                        LOG.errorf(
                                e,
                                "Failed to %s program '%s', changes rolled back",
                                operation.tag(), name);
                        throw new StorageFailureException(
                                String.format(
                                        "Failed to %s program '%s'; changes rolled back",
                                        operation.tag(), name),
                                e);
                    }
                });
    }

    private void rollback(List<Program> programs, List<IntervalRecord> records) {
        programStore.restore(programs);
        intervalStore.restore(records);
    }

    private void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw InvalidProgramNameException.blank();
        }
        if (name.length() > maxNameLength) {
            throw InvalidProgramNameException.tooLong(name.length(), maxNameLength);
        }
    }

    private static void incrementCounter(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
