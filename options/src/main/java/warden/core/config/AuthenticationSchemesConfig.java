package warden.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for authentication schemes.
 *
 * <p>Configuration prefix: {@code warden.authentication}
 *
 * <p>Scheme settings themselves are not mapped here; they are read as a raw
 * subtree below {@link #schemesPrefix()} so that any scheme name can be used.
 *
 * <pre>{@code
 * warden.authentication.schemes-prefix=warden.authentication.schemes
 * warden.authentication.options-cache.max-entries=256
 * warden.authentication.options-cache.expire-after-write=PT1H
 * }</pre>
 */
@ConfigMapping(prefix = "warden.authentication")
public interface AuthenticationSchemesConfig {

    /**
     * Property prefix below which each scheme has its own subtree.
     *
     * @return prefix (default: warden.authentication.schemes)
     */
    @WithName("schemes-prefix")
    @WithDefault("warden.authentication.schemes")
    String schemesPrefix();

    /**
     * Cache of configured options instances.
     */
    @WithName("options-cache")
    OptionsCacheConfig optionsCache();

    interface OptionsCacheConfig {

        /**
         * Maximum number of cached scheme options.
         *
         * @return maximum entries (default: 256)
         */
        @WithName("max-entries")
        @WithDefault("256")
        long maxEntries();

        /**
         * How long a configured options instance is kept before it is rebuilt.
         *
         * <p>When unset, instances are kept until explicitly invalidated.
         */
        @WithName("expire-after-write")
        Optional<Duration> expireAfterWrite();
    }
}
