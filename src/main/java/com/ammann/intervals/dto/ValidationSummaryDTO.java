/* (C)2026 */
package com.ammann.intervals.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Totals of an integrity validation run.
 *
 * @param checksPerformed number of check categories executed
 * @param totalErrors number of error findings
 * @param totalWarnings number of warning findings
 * @param programCount programs present when the run started
 * @param intervalRecordCount interval records present when the run started
 */
@Schema(description = "Integrity validation totals")
public record ValidationSummaryDTO(
        @Schema(description = "Number of check categories executed") int checksPerformed,
        @Schema(description = "Number of errors") int totalErrors,
        @Schema(description = "Number of warnings") int totalWarnings,
        @Schema(description = "Programs in the schedule") int programCount,
        @Schema(description = "Interval records in the derived store") int intervalRecordCount) {}
