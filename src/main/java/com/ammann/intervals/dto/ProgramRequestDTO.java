/* (C)2026 */
package com.ammann.intervals.dto;

import com.ammann.intervals.exception.ValidationException;
import com.ammann.intervals.model.TimeRange;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request body for creating or updating a program.
 *
 * <p>Times are given either as {@code HH:MM} strings or as minutes since midnight. When
 * both are present the strings win. {@code newName} is only read by updates; when absent
 * the program keeps its name.
 *
 * @param name program name (insert only)
 * @param newName new program name (update only, optional)
 * @param start start time as {@code HH:MM}
 * @param end end time as {@code HH:MM}
 * @param startMinute start time as minutes since midnight
 * @param endMinute end time as minutes since midnight
 */
@Schema(description = "Program create/update request")
public record ProgramRequestDTO(
        @Schema(description = "Program name", example = "Morning News") String name,
        @Schema(description = "New program name for renames") String newName,
        @Schema(description = "Start time (HH:MM)", example = "09:00") String start,
        @Schema(description = "End time (HH:MM)", example = "10:30") String end,
        @Schema(description = "Start time in minutes since midnight") Integer startMinute,
        @Schema(description = "End time in minutes since midnight") Integer endMinute) {

    /**
     * Resolves the requested time slot.
     *
     * @throws ValidationException if a bound is missing or malformed
     */
    public TimeRange toTimeRange() {
        if (start != null || end != null) {
            return TimeRange.parse(start, end);
        }
        if (startMinute == null) {
            throw ValidationException.invalidParameter("start", null, "a time in HH:MM format");
        }
        if (endMinute == null) {
            throw ValidationException.invalidParameter("end", null, "a time in HH:MM format");
        }
        return TimeRange.ofMinutes(startMinute, endMinute);
    }
}
