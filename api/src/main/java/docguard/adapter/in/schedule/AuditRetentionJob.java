package docguard.adapter.in.schedule;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import docguard.core.port.out.AuditLogger;

/**
 * Periodically deletes audit archives that have passed the retention window.
 */
@ApplicationScoped
public class AuditRetentionJob {

    private static final Logger LOG = Logger.getLogger(AuditRetentionJob.class);

    private final AuditLogger auditLogger;

    public AuditRetentionJob(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @Scheduled(
            every = "${docguard.audit.cleanup-interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void purgeExpiredArchives() {
        try {
            final var deleted = auditLogger.cleanup();
            if (deleted > 0) {
                LOG.infov("Audit retention removed {0} archive(s)", deleted);
            } else {
                LOG.debug("Audit retention found nothing to remove");
            }
        } catch (RuntimeException e) {
            LOG.error("Audit retention run failed", e);
        }
    }
}
