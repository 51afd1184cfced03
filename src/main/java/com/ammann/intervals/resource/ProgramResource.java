/* (C)2026 */
package com.ammann.intervals.resource;

import com.ammann.intervals.dto.IntervalCountDTO;
import com.ammann.intervals.dto.ProgramDTO;
import com.ammann.intervals.dto.ProgramRequestDTO;
import com.ammann.intervals.exception.ValidationException;
import com.ammann.intervals.model.IntervalRecord;
import com.ammann.intervals.model.Program;
import com.ammann.intervals.model.TimeRange;
import com.ammann.intervals.properties.ApiProperties;
import com.ammann.intervals.store.ProgramSynchronizer;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for the program schedule.
 *
 * <p>All writes go through {@link ProgramSynchronizer}, so each response reflects a
 * schedule whose interval records are already up to date.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Programs.BASE)
@Tag(name = "Programs API", description = "Program schedule and interval counts")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ProgramResource {

    private static final Logger LOG = Logger.getLogger(ProgramResource.class);

    @Inject ProgramSynchronizer synchronizer;

    @GET
    @Operation(
            summary = "List Programs",
            description = "Returns all programs with their stored interval counts")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Programs retrieved successfully",
                content = @Content(schema = @Schema(implementation = ProgramDTO[].class))),
        @APIResponse(responseCode = "400", description = "Invalid sort parameter")
    })
    public Response listPrograms(
            @Parameter(description = "Set to 'start' to order by start time")
                    @QueryParam("sort")
                    String sort) {
        if (sort != null && !ApiProperties.Programs.SORT_BY_START.equals(sort)) {
            throw ValidationException.invalidParameter("sort", sort, "'start' or no value");
        }

        List<Program> programs = synchronizer.listPrograms(sort != null);
        Map<String, Integer> counts =
                synchronizer.listIntervalRecords().stream()
                        .collect(
                                Collectors.toMap(
                                        IntervalRecord::programName,
                                        IntervalRecord::intervalCount,
                                        (first, second) -> first));

        List<ProgramDTO> dtos =
                programs.stream().map(p -> ProgramDTO.from(p, counts.get(p.name()))).toList();

        LOG.debugf("Listed %d programs (sort=%s)", dtos.size(), sort);
        return Response.ok(dtos).build();
    }

    @POST
    @Operation(summary = "Create Program", description = "Adds a program and records its intervals")
    @APIResponses({
        @APIResponse(
                responseCode = "201",
                description = "Program created",
                content = @Content(schema = @Schema(implementation = ProgramDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid name or time"),
        @APIResponse(responseCode = "409", description = "Program already scheduled at this time"),
        @APIResponse(responseCode = "503", description = "Storage failure")
    })
    public Response createProgram(ProgramRequestDTO request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        TimeRange range = request.toTimeRange();
        synchronizer.insert(request.name(), range);

        Program program = new Program(request.name(), range);
        Integer count = synchronizer.getIntervalCount(request.name()).orElse(null);
        return Response.status(Response.Status.CREATED).entity(ProgramDTO.from(program, count)).build();
    }

    @PUT
    @Path(ApiProperties.Programs.BY_NAME)
    @Operation(
            summary = "Update Program",
            description = "Changes the time slot and optionally the name of a program")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Program updated",
                content = @Content(schema = @Schema(implementation = ProgramDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid name or time"),
        @APIResponse(responseCode = "404", description = "Program not found"),
        @APIResponse(responseCode = "409", description = "Conflicts with an existing program"),
        @APIResponse(responseCode = "503", description = "Storage failure")
    })
    public Response updateProgram(@PathParam("name") String name, ProgramRequestDTO request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        String newName = request.newName() != null ? request.newName() : name;
        TimeRange range = request.toTimeRange();
        synchronizer.update(name, newName, range);

        Integer count = synchronizer.getIntervalCount(newName).orElse(null);
        return Response.ok(ProgramDTO.from(new Program(newName, range), count)).build();
    }

    @DELETE
    @Path(ApiProperties.Programs.BY_NAME)
    @Operation(summary = "Delete Program", description = "Removes a program; unknown names are ignored")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Program removed or not present"),
        @APIResponse(responseCode = "503", description = "Storage failure")
    })
    public Response deleteProgram(@PathParam("name") String name) {
        synchronizer.delete(name);
        return Response.noContent().build();
    }

    @GET
    @Path(ApiProperties.Programs.INTERVALS)
    @Operation(summary = "Get Interval Count", description = "Returns the stored interval count")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Interval count found",
                content = @Content(schema = @Schema(implementation = IntervalCountDTO.class))),
        @APIResponse(responseCode = "404", description = "No interval record for this name")
    })
    public Response getIntervalCount(@PathParam("name") String name) {
        return synchronizer
                .getIntervalCount(name)
                .map(count -> Response.ok(new IntervalCountDTO(name, count)).build())
                .orElseThrow(
                        () -> new NotFoundException("No interval record for program '" + name + "'"));
    }
}
