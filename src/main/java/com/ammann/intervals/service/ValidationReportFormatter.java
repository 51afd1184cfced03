/* (C)2026 */
package com.ammann.intervals.service;

import com.ammann.intervals.dto.FindingDTO;
import com.ammann.intervals.dto.ValidationReportDTO;
import com.ammann.intervals.dto.ValidationSummaryDTO;
import com.ammann.intervals.enumeration.CheckCategory;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link ValidationReportDTO} as plain text.
 *
 * <p>Layout: banner, overall status and totals, then one section per check category with
 * its status, errors and their evidence, a remediation hint when the category failed,
 * and its warnings. Output depends only on the report, so equal reports render to
 * identical text.
 */
@ApplicationScoped
public class ValidationReportFormatter {

    static final String RULE = "=".repeat(60);

    public String format(ValidationReportDTO report) {
        StringBuilder out = new StringBuilder();
        ValidationSummaryDTO summary = report.summary();

        line(out, RULE);
        line(out, "DATA INTEGRITY VALIDATION REPORT");
        line(out, RULE);
        line(out, "Overall Status: " + status(report.overallValid()));
        line(out, "Checks Performed: " + summary.checksPerformed());
        line(out, "Total Errors: " + summary.totalErrors());
        line(out, "Total Warnings: " + summary.totalWarnings());
        line(out, "Programs: " + summary.programCount());
        line(out, "Interval Records: " + summary.intervalRecordCount());
        line(out, "");

        for (CheckCategory category : CheckCategory.values()) {
            List<FindingDTO> errors = report.errorsFor(category);
            List<FindingDTO> warnings = report.warningsFor(category);

            line(out, category.getTitle().toUpperCase(Locale.ROOT) + ":");
            line(out, "  Status: " + status(errors.isEmpty()));
            if (!errors.isEmpty()) {
                line(out, "  Errors:");
                errors.forEach(f -> appendFinding(out, f));
                line(out, "  Remediation: " + category.getRemediation());
            }
            if (!warnings.isEmpty()) {
                line(out, "  Warnings:");
                warnings.forEach(f -> appendFinding(out, f));
            }
            line(out, "");
        }

        out.append(RULE);
        return out.toString();
    }

    private static void appendFinding(StringBuilder out, FindingDTO finding) {
        line(out, "    - " + finding.description());
        for (String evidence : finding.evidence()) {
            line(out, "        * " + evidence);
        }
    }

    private static String status(boolean passed) {
        return passed ? "PASS" : "FAIL";
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }
}
