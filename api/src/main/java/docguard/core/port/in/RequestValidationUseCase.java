package docguard.core.port.in;

import io.smallrye.mutiny.Uni;

import docguard.core.model.memory.AllocationToken;
import docguard.core.model.security.SecurityRequest;
import docguard.core.model.security.SecurityResult;
import docguard.core.model.security.SecurityStats;

/**
 * Use case for admitting document generation requests.
 */
public interface RequestValidationUseCase {

    /**
     * Run a request through every security layer.
     *
     * <p>The item is emitted only after the audit entry for the decision is durable. The
     * returned {@code Uni} never fails: errors become a rejected result.
     *
     * @param request the request
     * @return the decision
     */
    Uni<SecurityResult> validateRequest(SecurityRequest request);

    /**
     * Release the memory allocation handed out with an allowed result.
     *
     * @param token the allocation token; unknown tokens are ignored
     */
    void releaseAllocation(AllocationToken token);

    SecurityStats getStats();
}
