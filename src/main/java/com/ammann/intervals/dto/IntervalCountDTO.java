/* (C)2026 */
package com.ammann.intervals.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Stored interval count of one program.
 *
 * @param programName program name
 * @param intervalCount number of complete 15-minute intervals
 */
@Schema(description = "Interval count of a program")
public record IntervalCountDTO(
        @Schema(description = "Program name") String programName,
        @Schema(description = "Number of complete 15-minute intervals") int intervalCount) {}
