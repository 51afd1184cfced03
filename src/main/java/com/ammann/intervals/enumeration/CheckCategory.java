package com.ammann.intervals.enumeration;

/**
 * Categories of the integrity audit, in report order.
 *
 * <p>Each category carries the section title used by the text report and a remediation
 * hint printed when the category produced errors.
 */
public enum CheckCategory
{
    REFERENTIAL_INTEGRITY(
            "Referential Integrity",
            "Re-apply the affected programs through the synchronizer, or delete orphaned interval records."),
    INTERVAL_CALCULATIONS(
            "Interval Calculations",
            "Recompute the stored counts by re-saving the affected programs with their current time slots."),
    TIME_CONSTRAINTS(
            "Time Constraints",
            "Adjust start and end times so that programs neither overlap nor leave gaps in the schedule."),
    DATA_QUALITY(
            "Data Quality",
            "Rename blank, over-long or duplicated programs and review zero-duration time slots."),
    BUSINESS_RULES(
            "Business Rules",
            "Review the flagged programs; these findings are advisory.");

    private final String title;
    private final String remediation;

    CheckCategory(String title, String remediation) {
        this.title = title;
        this.remediation = remediation;
    }

    public String getTitle() { return title; }

    public String getRemediation() { return remediation; }
}
