package docguard.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for PII redaction.
 *
 * <p>Configuration prefix: {@code docguard.pii}
 */
@ConfigMapping(prefix = "docguard.pii")
public interface PiiConfig {

    /**
     * Replacement written in place of each detected value. {@code {type}} and {@code {hash}}
     * are substituted.
     *
     * @return template (default: [{type}:{hash}])
     */
    @WithDefault("[{type}:{hash}]")
    String replacement();

    /**
     * Number of hex characters of the value digest kept in the replacement.
     *
     * @return length (default: 16)
     */
    @WithDefault("16")
    int hashLength();
}
