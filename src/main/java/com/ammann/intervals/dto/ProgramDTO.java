/* (C)2026 */
package com.ammann.intervals.dto;

import com.ammann.intervals.model.Program;
import com.ammann.intervals.service.IntervalCalculator;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Program as returned by the API, with its stored interval count.
 *
 * @param name program name
 * @param start start time as {@code HH:MM}
 * @param end end time as {@code HH:MM}
 * @param startMinute start time in minutes since midnight
 * @param endMinute end time in minutes since midnight
 * @param durationMinutes wraparound-aware duration
 * @param intervalCount stored interval count, absent when the record is missing
 */
@Schema(description = "Scheduled program")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgramDTO(
        @Schema(description = "Program name") String name,
        @Schema(description = "Start time (HH:MM)") String start,
        @Schema(description = "End time (HH:MM)") String end,
        @Schema(description = "Start time in minutes since midnight") int startMinute,
        @Schema(description = "End time in minutes since midnight") int endMinute,
        @Schema(description = "Duration in minutes, crossing midnight when end < start") int durationMinutes,
        @Schema(description = "Stored number of 15-minute intervals") Integer intervalCount) {

    public static ProgramDTO from(Program program, Integer intervalCount) {
        return new ProgramDTO(
                program.name(),
                program.range().startText(),
                program.range().endText(),
                program.range().startMinute(),
                program.range().endMinute(),
                IntervalCalculator.durationMinutes(program.range()),
                intervalCount);
    }
}
