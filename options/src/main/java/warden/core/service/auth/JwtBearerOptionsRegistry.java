package warden.core.service.auth;

import java.util.List;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.cache.CaffeineLocalCache;
import warden.core.cache.LocalCache;
import warden.core.config.AuthenticationSchemesConfig;
import warden.core.model.auth.JwtBearerOptions;
import warden.core.options.ConfigureNamedOptions;
import warden.core.options.NamedOptions;
import warden.core.options.PostConfigureOptions;

/**
 * Registry of configured {@link JwtBearerOptions}, one instance per scheme name.
 *
 * <p>An instance is built on first request: a fresh {@link JwtBearerOptions} is
 * passed through every {@link ConfigureNamedOptions}, then every
 * {@link PostConfigureOptions}, and the result is cached until invalidated.
 * Build failures propagate and leave nothing cached, so the next request
 * retries.
 *
 * <h2>Thread Safety</h2>
 * Concurrent requests for the same name share one build; different names
 * build independently.
 */
@ApplicationScoped
public class JwtBearerOptionsRegistry {

    private static final Logger LOG = Logger.getLogger(JwtBearerOptionsRegistry.class);

    private final List<ConfigureNamedOptions<JwtBearerOptions>> configurers;
    private final List<PostConfigureOptions<JwtBearerOptions>> postConfigurers;
    private final LocalCache<String, JwtBearerOptions> cache;

    @Inject
    public JwtBearerOptionsRegistry(
            Instance<ConfigureNamedOptions<JwtBearerOptions>> configurers,
            Instance<PostConfigureOptions<JwtBearerOptions>> postConfigurers,
            AuthenticationSchemesConfig config) {
        this(
                configurers.stream().toList(),
                postConfigurers.stream().toList(),
                new CaffeineLocalCache<>(
                        config.optionsCache().maxEntries(),
                        config.optionsCache().expireAfterWrite()));
    }

    public JwtBearerOptionsRegistry(
            List<ConfigureNamedOptions<JwtBearerOptions>> configurers,
            List<PostConfigureOptions<JwtBearerOptions>> postConfigurers,
            LocalCache<String, JwtBearerOptions> cache) {
        this.configurers = List.copyOf(configurers);
        this.postConfigurers = List.copyOf(postConfigurers);
        this.cache = cache;
    }

    /**
     * Get the options for a scheme, building them if needed.
     *
     * @param name the scheme name; null is treated as the default name
     * @return the configured options
     * @throws IllegalArgumentException if the scheme configuration is malformed
     * @throws IllegalStateException    if post-configuration rejects the options
     */
    public JwtBearerOptions get(String name) {
        return cache.get(Objects.requireNonNullElse(name, NamedOptions.DEFAULT_NAME), this::create);
    }

    /**
     * Get the options for the default scheme name.
     */
    public JwtBearerOptions getDefault() {
        return get(NamedOptions.DEFAULT_NAME);
    }

    /**
     * Register a pre-built options instance.
     *
     * @return false if options for the name were already cached
     */
    public boolean tryAdd(String name, JwtBearerOptions options) {
        return cache.putIfAbsent(Objects.requireNonNullElse(name, NamedOptions.DEFAULT_NAME), options);
    }

    /**
     * Drop the cached options for a scheme; the next {@link #get(String)} rebuilds them.
     */
    public void invalidate(String name) {
        cache.invalidate(Objects.requireNonNullElse(name, NamedOptions.DEFAULT_NAME));
        LOG.debugv("Invalidated options for scheme {0}", name);
    }

    /**
     * Drop all cached options.
     */
    public void clear() {
        cache.invalidateAll();
        LOG.debug("Invalidated options for all schemes");
    }

    /**
     * Build a fresh, uncached options instance.
     */
    public JwtBearerOptions create(String name) {
        final var options = new JwtBearerOptions();
        for (var configurer : configurers) {
            configurer.configure(name, options);
        }
        for (var postConfigurer : postConfigurers) {
            postConfigurer.postConfigure(name, options);
        }
        LOG.debugv("Built options for scheme {0}", name);
        return options;
    }
}
