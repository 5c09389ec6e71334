package docguard.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.core.exc.StreamReadException;
import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import docguard.core.model.audit.AuditWriteException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Malformed requests surface as 400 instead of the default 500.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(DocumentProblem.badRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapStreamReadException(StreamReadException e) {
        LOG.debugv("Malformed request body: {0}", e.getOriginalMessage());
        return toResponse(DocumentProblem.badRequest("Malformed JSON: " + e.getOriginalMessage()));
    }

    @ServerExceptionMapper
    public Response mapAuditWriteException(AuditWriteException e) {
        LOG.errorv(e, "Audit trail write failed");
        return toResponse(DocumentProblem.internalError("Audit trail unavailable"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
