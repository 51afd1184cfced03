/* (C)2026 */
package com.ammann.intervals.service;

import com.ammann.intervals.dto.FindingDTO;
import com.ammann.intervals.dto.ValidationReportDTO;
import com.ammann.intervals.dto.ValidationSummaryDTO;
import com.ammann.intervals.enumeration.CheckCategory;
import com.ammann.intervals.exception.StorageFailureException;
import com.ammann.intervals.model.IntervalRecord;
import com.ammann.intervals.model.Program;
import com.ammann.intervals.model.TimeRange;
import com.ammann.intervals.store.IntervalStore;
import com.ammann.intervals.store.ProgramStore;
import com.ammann.intervals.store.StoreLock;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Audits the program schedule against its derived interval records.
 *
 * <p>Works from the stores' contents alone and does not assume that every mutation went
 * through the synchronizer, so it also catches out-of-band edits. Five categories are
 * checked:
 * <ul>
 *   <li>referential integrity: programs without a record, records without a program;</li>
 *   <li>interval calculations: stored counts that differ from the recomputed count;</li>
 *   <li>time constraints: overlapping programs and, when a contiguous schedule is
 *       expected, gaps between consecutive programs;</li>
 *   <li>data quality: blank, over-long and duplicate names, zero-duration slots;</li>
 *   <li>business rules (warnings only): suspicious names, implausible midnight
 *       wraparound, slots not aligned to 15 minutes.</li>
 * </ul>
 *
 * <p>Validation is read-only and deterministic: both stores are copied under the shared
 * read lock and every evidence list is sorted, so two runs over unchanged stores return
 * equal reports.
 */
@ApplicationScoped
public class IntegrityValidationService {

    private static final Logger LOG = Logger.getLogger(IntegrityValidationService.class);

    static final int DEFAULT_MAX_NAME_LENGTH = 255;
    static final List<String> DEFAULT_SUSPICIOUS_PATTERNS =
            List.of("'", ";", "--", "drop", "delete", "insert", "update", "select", "script");

    private static final LocalTime NOON = LocalTime.NOON;
    private static final int EVIDENCE_NAME_PREFIX = 40;

    private final ProgramStore programStore;
    private final IntervalStore intervalStore;
    private final StoreLock storeLock;

    @ConfigProperty(name = "programs.name.max-length", defaultValue = "255")
    int maxNameLength = DEFAULT_MAX_NAME_LENGTH;

    /**
     * When enabled, programs are expected to tile the whole day back to back and every
     * discontinuity between consecutive programs is an error.
     */
    @ConfigProperty(name = "integrity.schedule.expect-contiguous", defaultValue = "false")
    boolean expectContiguousSchedule;

    @ConfigProperty(
            name = "integrity.suspicious-patterns",
            defaultValue = "',;,--,drop,delete,insert,update,select,script")
    List<String> suspiciousPatterns = DEFAULT_SUSPICIOUS_PATTERNS;

    @Inject MeterRegistry meterRegistry;

    private Counter passedCounter;
    private Counter failedCounter;

    @Inject
    public IntegrityValidationService(
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
        passedCounter =
                Counter.builder("integrity_validations_total")
                        .description("Integrity validation runs")
                        .tag("result", "pass")
                        .register(meterRegistry);
        failedCounter =
                Counter.builder("integrity_validations_total")
                        .description("Integrity validation runs")
                        .tag("result", "fail")
                        .register(meterRegistry);
    }

    /**
     * Runs all check categories over a consistent copy of both stores.
     *
     * <p>Counts the run in {@code integrity_validations_total} and logs its summary at
     * INFO.
     *
     * @return report; {@code overallValid} is false iff any error was found
     * @throws StorageFailureException if the stores cannot be read
     */
    public ValidationReportDTO runValidation() {
        ValidationReportDTO report = validate(Logger.Level.INFO, Logger.Level.WARN);
        incrementCounter(report.overallValid() ? passedCounter : failedCounter);
        return report;
    }

    /**
     * Same checks as {@link #runValidation()} for periodic callers such as the readiness
     * check. The run is not counted and all its logging is at DEBUG.
     *
     * @throws StorageFailureException if the stores cannot be read
     */
    public ValidationReportDTO runSilentValidation() {
        return validate(Logger.Level.DEBUG, Logger.Level.DEBUG);
    }

    private ValidationReportDTO validate(Logger.Level summaryLevel, Logger.Level failureLevel) {
        ScheduleSnapshot snapshot = readSnapshot();
        List<Program> programs = snapshot.programs();
        List<IntervalRecord> records = snapshot.records();

        List<FindingDTO> errors = new ArrayList<>();
        errors.addAll(checkReferentialIntegrity(programs, records));
        errors.addAll(checkIntervalCalculations(programs, records));
        errors.addAll(checkTimeConstraints(programs));
        errors.addAll(checkDataQuality(programs, records));
        List<FindingDTO> warnings = checkBusinessRules(programs);

        for (CheckCategory category : CheckCategory.values()) {
            long failures = errors.stream().filter(f -> f.category() == category).count();
            if (failures > 0) {
                LOG.logf(
                        failureLevel,
                        "%s check failed with %d findings",
                        category.getTitle(),
                        failures);
            }
        }

        boolean valid = errors.isEmpty();
        ValidationSummaryDTO summary =
                new ValidationSummaryDTO(
                        CheckCategory.values().length,
                        errors.size(),
                        warnings.size(),
                        programs.size(),
                        records.size());

        LOG.logf(
                summaryLevel,
                "Integrity validation %s: %d errors, %d warnings (%d programs, %d interval"
                        + " records)",
                valid ? "passed" : "failed",
                errors.size(),
                warnings.size(),
                programs.size(),
                records.size());

        return new ValidationReportDTO(valid, errors, warnings, summary);
    }

    /**
     * Finds programs without an interval record and interval records without a program.
     */
    public List<FindingDTO> checkReferentialIntegrity(
            List<Program> programs, List<IntervalRecord> records) {
        TreeSet<String> programNames =
                programs.stream().map(Program::name).collect(Collectors.toCollection(TreeSet::new));
        TreeSet<String> recordNames =
                records.stream()
                        .map(IntervalRecord::programName)
                        .collect(Collectors.toCollection(TreeSet::new));

        List<String> missing = programNames.stream().filter(n -> !recordNames.contains(n)).toList();
        List<String> orphaned = recordNames.stream().filter(n -> !programNames.contains(n)).toList();

        List<FindingDTO> findings = new ArrayList<>();
        if (!missing.isEmpty()) {
            findings.add(
                    finding(
                            CheckCategory.REFERENTIAL_INTEGRITY,
                            String.format(
                                    "Found %d programs without interval records (missing interval"
                                            + " records)",
                                    missing.size()),
                            missing));
        }
        if (!orphaned.isEmpty()) {
            findings.add(
                    finding(
                            CheckCategory.REFERENTIAL_INTEGRITY,
                            String.format("Found %d orphaned interval records", orphaned.size()),
                            orphaned));
        }
        LOG.debugf(
                "Referential integrity: %d missing, %d orphaned", missing.size(), orphaned.size());
        return findings;
    }

    /**
     * Recomputes the interval count of every program that has a record and reports
     * mismatches as {@code name (stored=S, expected=E)}.
     */
    public List<FindingDTO> checkIntervalCalculations(
            List<Program> programs, List<IntervalRecord> records) {
        Map<String, IntervalRecord> recordIndex = indexByName(records);

        TreeSet<String> mismatches = new TreeSet<>();
        for (Program program : programs) {
            IntervalRecord record = recordIndex.get(program.name());
            if (record == null) {
                continue;
            }
            int expected = IntervalCalculator.count(program.range());
            if (record.intervalCount() != expected) {
                mismatches.add(
                        String.format(
                                "%s (stored=%d, expected=%d)",
                                program.name(), record.intervalCount(), expected));
            }
        }

        if (mismatches.isEmpty()) {
            return List.of();
        }
        return List.of(
                finding(
                        CheckCategory.INTERVAL_CALCULATIONS,
                        String.format(
                                "Found %d programs with incorrect interval calculations",
                                mismatches.size()),
                        List.copyOf(mismatches)));
    }

    /**
     * Reports overlapping programs and, when a contiguous schedule is expected, gaps.
     */
    public List<FindingDTO> checkTimeConstraints(List<Program> programs) {
        List<FindingDTO> findings = new ArrayList<>();

        List<String> overlaps = detectOverlaps(programs);
        if (!overlaps.isEmpty()) {
            findings.add(
                    finding(
                            CheckCategory.TIME_CONSTRAINTS,
                            String.format("Found %d overlapping program pairs", overlaps.size()),
                            overlaps));
        }

        if (expectContiguousSchedule) {
            List<String> gaps = detectScheduleGaps(programs);
            if (!gaps.isEmpty()) {
                findings.add(
                        finding(
                                CheckCategory.TIME_CONSTRAINTS,
                                String.format("Found %d schedule gaps", gaps.size()),
                                gaps));
            }
        }
        return findings;
    }

    /**
     * Detects overlapping pairs among programs that do not cross midnight.
     *
     * <p>Two slots overlap when {@code a.start < b.end && a.end > b.start}. Programs are
     * swept in start order, so each unordered pair is reported once and a program is never
     * compared with itself.
     *
     * @param programs programs in any order
     * @return sorted descriptions of overlapping pairs
     */
    public List<String> detectOverlaps(List<Program> programs) {
        List<Program> sorted =
                programs.stream()
                        .filter(p -> !p.range().wrapsMidnight())
                        .sorted(ProgramStore.BY_START)
                        .toList();

        List<String> overlaps = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Program a = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                Program b = sorted.get(j);
                if (!b.range().start().isBefore(a.range().end())) {
                    break;
                }
                if (a.range().start().isBefore(b.range().end())) {
                    overlaps.add(
                            String.format(
                                    "%s [%s] overlaps %s [%s]",
                                    a.name(), a.range(), b.name(), b.range()));
                }
            }
        }
        return overlaps;
    }

    /**
     * Detects discontinuities in a schedule that should tile the day.
     *
     * <p>After ordering by start time, each program must start where the previous one
     * ends, and the first program must start where the last one ends.
     *
     * @param programs programs in any order
     * @return descriptions of every discontinuity, in schedule order
     */
    public List<String> detectScheduleGaps(List<Program> programs) {
        List<Program> sorted = programs.stream().sorted(ProgramStore.BY_START).toList();
        if (sorted.isEmpty()) {
            return List.of();
        }

        List<String> gaps = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Program previous = sorted.get(i);
            Program next = sorted.get((i + 1) % sorted.size());
            if (!next.range().start().equals(previous.range().end())) {
                gaps.add(
                        String.format(
                                "%s ends %s, %s starts %s",
                                previous.name(),
                                previous.range().endText(),
                                next.name(),
                                next.range().startText()));
            }
        }
        return gaps;
    }

    /**
     * Reports blank names in either store, over-long names, duplicate program names and
     * zero-duration programs.
     */
    public List<FindingDTO> checkDataQuality(
            List<Program> programs, List<IntervalRecord> records) {
        List<FindingDTO> findings = new ArrayList<>();

        TreeSet<String> blank = new TreeSet<>();
        programs.stream()
                .filter(p -> p.name().isBlank())
                .forEach(p -> blank.add(String.format("program '%s' [%s]", p.name(), p.range())));
        records.stream()
                .filter(r -> r.programName().isBlank())
                .forEach(r -> blank.add(String.format("interval record '%s'", r.programName())));
        if (!blank.isEmpty()) {
            findings.add(
                    finding(
                            CheckCategory.DATA_QUALITY,
                            String.format("Found %d empty program names", blank.size()),
                            List.copyOf(blank)));
        }

        TreeSet<String> tooLong = new TreeSet<>();
        programs.stream()
                .map(Program::name)
                .filter(n -> n.length() > maxNameLength)
                .forEach(n -> tooLong.add(abbreviate(n)));
        records.stream()
                .map(IntervalRecord::programName)
                .filter(n -> n.length() > maxNameLength)
                .forEach(n -> tooLong.add(abbreviate(n)));
        if (!tooLong.isEmpty()) {
            findings.add(
                    finding(
                            CheckCategory.DATA_QUALITY,
                            String.format(
                                    "Found %d programs with names exceeding %d characters",
                                    tooLong.size(), maxNameLength),
                            List.copyOf(tooLong)));
        }

        Map<String, Long> occurrences =
                programs.stream()
                        .collect(
                                Collectors.groupingBy(
                                        Program::name, TreeMap::new, Collectors.counting()));
        List<String> duplicates =
                occurrences.entrySet().stream()
                        .filter(e -> e.getValue() > 1)
                        .map(e -> String.format("%s (%d occurrences)", e.getKey(), e.getValue()))
                        .toList();
        if (!duplicates.isEmpty()) {
            findings.add(
                    finding(
                            CheckCategory.DATA_QUALITY,
                            String.format("Found %d duplicate program names", duplicates.size()),
                            duplicates));
        }

        List<String> zeroDuration =
                programs.stream()
                        .filter(p -> p.range().start().equals(p.range().end()))
                        .sorted(ProgramStore.BY_START)
                        .map(p -> String.format("%s [%s]", p.name(), p.range()))
                        .toList();
        if (!zeroDuration.isEmpty()) {
            findings.add(
                    finding(
                            CheckCategory.DATA_QUALITY,
                            String.format(
                                    "Found %d zero-duration programs (may be valid)",
                                    zeroDuration.size()),
                            zeroDuration));
        }
        return findings;
    }

    /**
     * Evaluates advisory rules. Every finding returned here is a warning.
     */
    public List<FindingDTO> checkBusinessRules(List<Program> programs) {
        List<FindingDTO> warnings = new ArrayList<>();
        List<String> patterns =
                suspiciousPatterns.stream()
                        .filter(p -> !p.isEmpty())
                        .map(p -> p.toLowerCase(Locale.ROOT))
                        .toList();

        TreeSet<String> suspicious = new TreeSet<>();
        for (Program program : programs) {
            String lowered = program.name().toLowerCase(Locale.ROOT);
            if (patterns.stream().anyMatch(lowered::contains)) {
                suspicious.add(program.name());
            }
        }
        if (!suspicious.isEmpty()) {
            warnings.add(
                    finding(
                            CheckCategory.BUSINESS_RULES,
                            String.format(
                                    "Found %d programs with suspicious names", suspicious.size()),
                            List.copyOf(suspicious)));
        }

        List<String> implausible =
                programs.stream()
                        .filter(p -> isImplausibleWraparound(p.range()))
                        .sorted(ProgramStore.BY_START)
                        .map(
                                p ->
                                        String.format(
                                                "%s [%s] (%d minutes across midnight)",
                                                p.name(),
                                                p.range(),
                                                IntervalCalculator.durationMinutes(p.range())))
                        .toList();
        if (!implausible.isEmpty()) {
            warnings.add(
                    finding(
                            CheckCategory.BUSINESS_RULES,
                            String.format(
                                    "Found %d programs whose end precedes their start outside an"
                                            + " overnight slot",
                                    implausible.size()),
                            implausible));
        }

        List<String> nonStandard =
                programs.stream()
                        .filter(p -> !isStandardSlot(p.range()))
                        .sorted(ProgramStore.BY_START)
                        .map(p -> String.format("%s [%s]", p.name(), p.range()))
                        .toList();
        if (!nonStandard.isEmpty()) {
            warnings.add(
                    finding(
                            CheckCategory.BUSINESS_RULES,
                            String.format(
                                    "Found %d programs with non-standard time slots",
                                    nonStandard.size()),
                            nonStandard));
        }
        return warnings;
    }

    /**
     * A slot whose end precedes its start reads as a negative duration unless it has the
     * overnight shape: starting in the afternoon or evening and ending before noon.
     */
    static boolean isImplausibleWraparound(TimeRange range) {
        if (!range.wrapsMidnight()) {
            return false;
        }
        return !(range.start().isAfter(NOON) && range.end().isBefore(NOON));
    }

    static boolean isStandardSlot(TimeRange range) {
        return range.startMinute() % IntervalCalculator.INTERVAL_MINUTES == 0
                && range.endMinute() % IntervalCalculator.INTERVAL_MINUTES == 0;
    }

    private ScheduleSnapshot readSnapshot() {
        try {
            return storeLock.read(
                    () -> new ScheduleSnapshot(programStore.snapshot(), intervalStore.snapshot()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unable to read program and interval stores");
            throw new StorageFailureException(
                    "Unable to read program and interval stores; validation aborted", e);
        }
    }

    private static Map<String, IntervalRecord> indexByName(List<IntervalRecord> records) {
        return records.stream()
                .collect(
                        Collectors.toMap(
                                IntervalRecord::programName,
                                Function.identity(),
                                (first, second) -> first,
                                TreeMap::new));
    }

    private static String abbreviate(String name) {
        return String.format(
                "%s... (length=%d)",
                name.substring(0, Math.min(EVIDENCE_NAME_PREFIX, name.length())),
                name.length());
    }

    private static FindingDTO finding(CheckCategory category, String description, List<String> evidence) {
        return new FindingDTO(category, description, evidence);
    }

    private static void incrementCounter(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }

    private record ScheduleSnapshot(List<Program> programs, List<IntervalRecord> records) {}
}
