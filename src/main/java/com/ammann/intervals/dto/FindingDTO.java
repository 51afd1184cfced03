/* (C)2026 */
package com.ammann.intervals.dto;

import com.ammann.intervals.enumeration.CheckCategory;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One error or warning produced by an integrity check.
 *
 * @param category check category that produced the finding
 * @param description human-readable summary, e.g. "Found 2 orphaned interval records"
 * @param evidence sorted list of the offending program names or pairs
 */
@Schema(description = "Single integrity finding with supporting evidence")
public record FindingDTO(
        @Schema(description = "Check category") CheckCategory category,
        @Schema(description = "What was found") String description,
        @Schema(description = "Offending program names, pairs or values") List<String> evidence) {

    public FindingDTO {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
