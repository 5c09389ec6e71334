package docguard.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the validation pipeline itself.
 *
 * <p>Configuration prefix: {@code docguard.security}
 */
@ConfigMapping(prefix = "docguard.security")
public interface SecurityConfig {

    /**
     * Put a client into rate limiter cooldown after a path traversal, homograph or
     * template integrity rejection.
     *
     * @return true to apply cooldown (default: true)
     */
    @WithDefault("true")
    boolean cooldownOnViolation();
}
