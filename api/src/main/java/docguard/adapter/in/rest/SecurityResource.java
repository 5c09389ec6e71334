package docguard.adapter.in.rest;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import docguard.adapter.in.dto.AuditEntryDto;
import docguard.adapter.in.dto.ValidateRequestDto;
import docguard.adapter.in.dto.ValidateResponseDto;
import docguard.adapter.in.problem.DocumentProblem;
import docguard.core.model.audit.AuditLevel;
import docguard.core.model.audit.AuditQuery;
import docguard.core.model.memory.AllocationToken;
import docguard.core.model.security.SecurityStats;
import docguard.core.service.security.SecurityManager;

/**
 * REST resource for the document security pipeline.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Validating a document generation request</li>
 * <li>Releasing the memory allocation of an allowed request</li>
 * <li>Reading rate limiter and memory statistics</li>
 * <li>Querying the audit trail</li>
 * </ul>
 */
@Path("/security")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class SecurityResource {

    private static final Logger LOG = Logger.getLogger(SecurityResource.class);

    private final SecurityManager securityManager;

    public SecurityResource(SecurityManager securityManager) {
        this.securityManager = securityManager;
    }

    /**
     * Run a request through the security pipeline.
     *
     * @param request the request body
     * @return 200 with the sanitized data, or a problem response describing the rejection
     */
    @POST
    @Path("/validate")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> validate(ValidateRequestDto request) {
        if (request == null) {
            throw DocumentProblem.badRequest("Request body is required");
        }
        final var model = request.toModel();
        return securityManager.validateRequest(model).map(result -> {
            if (!result.allowed()) {
                throw DocumentProblem.rejected(result.reason(), result.error());
            }
            return Response.ok(ValidateResponseDto.fromModel(result)).build();
        });
    }

    /**
     * Release the memory allocation handed out with an allowed result.
     *
     * @param token the allocation token
     * @return 204 No Content; unknown tokens are ignored
     */
    @DELETE
    @Path("/allocations/{token}")
    public Response releaseAllocation(@PathParam("token") String token) {
        securityManager.releaseAllocation(new AllocationToken(token));
        LOG.debugv("Released allocation {0}", token);
        return Response.noContent().build();
    }

    @GET
    @Path("/stats")
    public SecurityStats stats() {
        return securityManager.getStats();
    }

    /**
     * Query the audit trail, including rotated archives.
     *
     * @param action exact action to match
     * @param level  level name to match
     * @param from   inclusive lower bound, ISO-8601 instant
     * @param to     inclusive upper bound, ISO-8601 instant
     * @return matching entries in file order
     */
    @GET
    @Path("/audit")
    public List<AuditEntryDto> queryAudit(
            @QueryParam("action") String action,
            @QueryParam("level") String level,
            @QueryParam("from") String from,
            @QueryParam("to") String to) {
        final var query = new AuditQuery(parseInstant("from", from), parseInstant("to", to), action, parseLevel(level));
        return securityManager.queryAuditLog(query).stream()
                .map(AuditEntryDto::fromModel)
                .toList();
    }

    private static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid '%s' timestamp: %s".formatted(name, value), e);
        }
    }

    private static AuditLevel parseLevel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return AuditLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown audit level: " + value, e);
        }
    }
}
