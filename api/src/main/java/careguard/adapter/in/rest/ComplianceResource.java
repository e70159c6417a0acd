package careguard.adapter.in.rest;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import careguard.adapter.in.dto.ComplianceEventRequest;
import careguard.adapter.in.dto.ViolationDto;
import careguard.adapter.in.dto.ViolationStatusRequest;
import careguard.adapter.in.problem.AuthProblem;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.audit.AuditEventType;
import careguard.core.model.compliance.ViolationStatus;
import careguard.core.port.in.ComplianceEventRecording;
import careguard.core.port.in.ViolationManagement;

/**
 * Audit event intake and violation review.
 *
 * <p>Event intake requires {@code audit-events:write}; reading violations
 * requires {@code violations:read} and changing their status
 * {@code violations:write}.
 */
@Path("/compliance")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ComplianceResource {

    private static final Logger LOG = Logger.getLogger(ComplianceResource.class);

    private final ComplianceEventRecording recording;
    private final ViolationManagement violations;
    private final BearerSessions bearerSessions;

    public ComplianceResource(
            ComplianceEventRecording recording, ViolationManagement violations, BearerSessions bearerSessions) {
        this.recording = recording;
        this.violations = violations;
        this.bearerSessions = bearerSessions;
    }

    @POST
    @Path("/events")
    public Uni<Response> recordEvent(
            ComplianceEventRequest request,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @Context HttpServerRequest httpRequest) {
        final var event = toEvent(request);
        final var client = ClientInfoResolver.resolve(httpRequest);
        return bearerSessions
                .requirePermission(authorizationHeader, "audit-events", "write", client)
                .call(claims -> recording.recordComplianceEvent(event))
                .map(claims -> Response.accepted().build());
    }

    @GET
    @Path("/violations")
    public Uni<Response> listViolations(
            @QueryParam("status") String status,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @Context HttpServerRequest httpRequest) {
        final var filter = status != null ? parseStatus(status) : null;
        final var client = ClientInfoResolver.resolve(httpRequest);
        return bearerSessions
                .requirePermission(authorizationHeader, "violations", "read", client)
                .flatMap(claims -> violations
                        .listByStatus(filter)
                        .map(ViolationDto::from)
                        .collect()
                        .asList())
                .map(list -> Response.ok(list).build());
    }

    @PUT
    @Path("/violations/{id}/status")
    public Uni<Response> transition(
            @PathParam("id") String id,
            ViolationStatusRequest request,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @Context HttpServerRequest httpRequest) {
        if (request == null || request.status() == null) {
            throw AuthProblem.badRequest("status is required");
        }
        final var target = parseStatus(request.status());
        final var client = ClientInfoResolver.resolve(httpRequest);
        return bearerSessions
                .requirePermission(authorizationHeader, "violations", "write", client)
                .invoke(claims -> LOG.infof("Violation %s -> %s by %s", id, target, claims.identity()))
                .flatMap(claims -> violations.transition(id, target))
                .map(updated -> updated.map(v -> Response.ok(ViolationDto.from(v)).build())
                        .orElseThrow(() -> AuthProblem.notFound("Violation not found: " + id)));
    }

    static AuditEvent toEvent(ComplianceEventRequest request) {
        if (request == null || request.type() == null || request.action() == null) {
            throw AuthProblem.badRequest("type and action are required");
        }
        final AuditEventType type;
        try {
            type = AuditEventType.valueOf(request.type().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw AuthProblem.badRequest("Unknown event type: " + request.type());
        }
        return AuditEvent.builder(type, request.action())
                .identity(request.identity())
                .resource(request.resourceType(), request.resourceId())
                .originAddress(request.originAddress())
                .userAgent(request.userAgent())
                .timestamp(request.timestamp())
                .success(request.success() == null || request.success())
                .metadata(request.metadata())
                .build();
    }

    private static ViolationStatus parseStatus(String status) {
        try {
            return ViolationStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw AuthProblem.badRequest("Unknown violation status: " + status);
        }
    }
}
