package docguard.adapter.out.audit;

import java.nio.file.Path;
import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import docguard.core.config.AuditConfig;
import docguard.core.port.out.AuditLogger;

/**
 * CDI producer for the audit logger.
 *
 * <p>Expired archives are removed once when the logger is created; the retention job
 * keeps removing them afterwards. Buffered entries are flushed on shutdown.
 */
@ApplicationScoped
public class AuditLoggerProducer {

    private static final Logger LOG = Logger.getLogger(AuditLoggerProducer.class);

    private final AuditConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;

    @Inject
    public AuditLoggerProducer(AuditConfig config, Clock clock, ObjectMapper mapper) {
        this.config = config;
        this.clock = clock;
        this.mapper = mapper;
    }

    @Produces
    @ApplicationScoped
    public AuditLogger produceAuditLogger() {
        final var logger = new JsonlAuditLogger(
                Path.of(config.logDir()),
                config.maxFileSize(),
                config.retentionDays(),
                config.bufferSize(),
                config.maxPendingEntries(),
                config.echoToLog(),
                clock,
                mapper);
        LOG.infov(
                "Audit logging to {0} (maxFileSize={1}, retentionDays={2}, bufferSize={3})",
                config.logDir(), config.maxFileSize(), config.retentionDays(), config.bufferSize());
        logger.cleanup();
        return logger;
    }

    void disposeAuditLogger(@Disposes AuditLogger auditLogger) {
        try {
            auditLogger.close();
        } catch (RuntimeException e) {
            LOG.errorv(e, "Failed to flush audit log on shutdown");
        }
    }
}
