package docguard.adapter.out.runtime;

import java.time.Clock;
import java.util.concurrent.Executor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import io.smallrye.mutiny.infrastructure.Infrastructure;

import docguard.core.service.security.SecurityManager;

/**
 * Produces the time source and the executor for blocking pipeline work.
 */
@ApplicationScoped
public class RuntimeProducer {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Worker pool for the validation pipeline, which performs file I/O for the audit trail.
     *
     * @return the Mutiny default worker pool
     */
    @Produces
    @Singleton
    @Named(SecurityManager.PIPELINE_EXECUTOR)
    public Executor pipelineExecutor() {
        return Infrastructure.getDefaultWorkerPool();
    }
}
