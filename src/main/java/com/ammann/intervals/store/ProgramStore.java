/* (C)2026 */
package com.ammann.intervals.store;

import com.ammann.intervals.model.Program;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Authoritative collection of scheduled programs.
 *
 * <p>Enforces uniqueness of the {@code (name, range)} pair only; names on their own may
 * repeat. Programs are kept in insertion order.
 *
 * <p>Mutators are package-private and must run inside a {@link StoreLock} write section,
 * which only {@link ProgramSynchronizer} opens. Public readers take the read lock.
 */
@ApplicationScoped
public class ProgramStore {

    /** Orders programs by start time, then end time, then name. */
    public static final Comparator<Program> BY_START =
            Comparator.comparing((Program p) -> p.range().start())
                    .thenComparing(p -> p.range().end())
                    .thenComparing(Program::name, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final StoreLock storeLock;
    private final List<Program> programs = new ArrayList<>();

    @Inject
    public ProgramStore(StoreLock storeLock) {
        this.storeLock = storeLock;
    }

    /**
     * Returns a copy of all programs in insertion order.
     */
    public List<Program> snapshot() {
        return storeLock.read(() -> List.copyOf(programs));
    }

    public List<Program> findByName(String name) {
        return storeLock.read(
                () -> programs.stream().filter(p -> Objects.equals(p.name(), name)).toList());
    }

    public boolean contains(Program program) {
        return storeLock.read(() -> programs.contains(program));
    }

    public int size() {
        return storeLock.read(programs::size);
    }

    /**
     * Adds a program.
     *
     * @return {@code false} if the same {@code (name, range)} pair is already stored
     */
    boolean add(Program program) {
        storeLock.checkWriteLocked();
        if (programs.contains(program)) {
            return false;
        }
        programs.add(program);
        return true;
    }

    /**
     * Replaces {@code existing} with {@code replacement} at the same position.
     *
     * @return {@code false} if {@code existing} is not stored
     */
    boolean replace(Program existing, Program replacement) {
        storeLock.checkWriteLocked();
        int index = programs.indexOf(existing);
        if (index < 0) {
            return false;
        }
        programs.set(index, replacement);
        return true;
    }

    /**
     * Removes every program called {@code name}.
     *
     * @return the removed programs, empty when none matched
     */
    List<Program> removeByName(String name) {
        storeLock.checkWriteLocked();
        List<Program> removed = new ArrayList<>();
        programs.removeIf(
                p -> {
                    if (Objects.equals(p.name(), name)) {
                        removed.add(p);
                        return true;
                    }
                    return false;
                });
        return removed;
    }

    void restore(List<Program> state) {
        storeLock.checkWriteLocked();
        programs.clear();
        programs.addAll(state);
    }
}
