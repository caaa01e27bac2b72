package warden.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for data protection of bearer and refresh tokens.
 *
 * <p>Configuration prefix: {@code warden.data-protection}
 *
 * <pre>
 * warden.data-protection.key=${DATA_PROTECTION_KEY}  # Base64-encoded 256-bit key
 * warden.data-protection.key-id=v1
 * </pre>
 */
@ConfigMapping(prefix = "warden.data-protection")
public interface DataProtectionConfig {

    /**
     * Base64-encoded 256-bit master key.
     *
     * <p>When unset, an ephemeral key is generated at startup and protected
     * tokens do not survive a restart.
     */
    Optional<String> key();

    /**
     * Identifier written into every protected payload.
     *
     * @return key identifier (default: v1)
     */
    @WithName("key-id")
    @WithDefault("v1")
    String keyId();
}
