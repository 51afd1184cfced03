/* (C)2026 */
package com.ammann.intervals.dto;

import com.ammann.intervals.enumeration.CheckCategory;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Result of a full integrity audit of the program schedule and its interval records.
 *
 * <p>{@code overallValid} is {@code false} exactly when {@code errors} is non-empty;
 * warnings never fail a run. Built fresh for each run and never persisted; it carries no
 * timestamp, so two runs over unchanged stores produce equal reports.
 */
@Schema(description = "Integrity validation report")
public record ValidationReportDTO(
        @Schema(description = "True when no check produced an error") boolean overallValid,
        @Schema(description = "Errors in category order") List<FindingDTO> errors,
        @Schema(description = "Warnings in category order") List<FindingDTO> warnings,
        @Schema(description = "Run totals") ValidationSummaryDTO summary) {

    public ValidationReportDTO {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public List<FindingDTO> errorsFor(CheckCategory category) {
        return errors.stream().filter(f -> f.category() == category).toList();
    }

    public List<FindingDTO> warningsFor(CheckCategory category) {
        return warnings.stream().filter(f -> f.category() == category).toList();
    }

    /** {@code true} when {@code category} produced no errors. */
    public boolean passed(CheckCategory category) {
        return errorsFor(category).isEmpty();
    }

    /**
     * Returns the evidence of all errors in {@code category}, flattened.
     */
    public List<String> errorEvidence(CheckCategory category) {
        return errorsFor(category).stream().flatMap(f -> f.evidence().stream()).toList();
    }
}
