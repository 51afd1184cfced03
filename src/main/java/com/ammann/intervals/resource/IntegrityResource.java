/* (C)2026 */
package com.ammann.intervals.resource;

import com.ammann.intervals.dto.ValidationReportDTO;
import com.ammann.intervals.properties.ApiProperties;
import com.ammann.intervals.service.IntegrityValidationService;
import com.ammann.intervals.service.ValidationReportFormatter;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource exposing the integrity audit of the program schedule.
 *
 * <p>Findings are returned as data with HTTP 200 whether or not the audit passed; only an
 * unreadable store fails the request.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Integrity.BASE)
@Tag(name = "Integrity API", description = "Consistency audit of programs and interval records")
public class IntegrityResource {

    @Inject IntegrityValidationService validationService;

    @Inject ValidationReportFormatter formatter;

    @GET
    @Path(ApiProperties.Integrity.REPORT)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Run Integrity Validation", description = "Audits all check categories")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Validation completed",
                content = @Content(schema = @Schema(implementation = ValidationReportDTO.class))),
        @APIResponse(responseCode = "503", description = "Stores could not be read")
    })
    public Response getReport() {
        return Response.ok(validationService.runValidation()).build();
    }

    @GET
    @Path(ApiProperties.Integrity.REPORT_TEXT)
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "Run Integrity Validation (text)", description = "Human-readable report")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Validation completed"),
        @APIResponse(responseCode = "503", description = "Stores could not be read")
    })
    public Response getTextReport() {
        return Response.ok(formatter.format(validationService.runValidation())).build();
    }
}
