package warden.adapter.out.config;

import java.util.HashMap;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

import warden.core.config.AuthenticationSchemesConfig;
import warden.core.port.out.ConfigurationSection;
import warden.core.port.out.SchemeConfigurationProvider;

/**
 * Reads scheme configuration from MicroProfile Config.
 *
 * <p>Each scheme lives below {@code <schemes-prefix>.<scheme>}, for example:
 * <pre>
 * warden.authentication.schemes.Bearer.Authority=https://login.example.com
 * warden.authentication.schemes.Bearer.ValidIssuers[0]=https://login.example.com
 * warden.authentication.schemes.Bearer.SigningKeys[0].Issuer=https://login.example.com
 * warden.authentication.schemes.Bearer.SigningKeys[0].Value=c2VjcmV0LWtleS1tYXRlcmlhbA==
 * </pre>
 *
 * <p>Each lookup takes a snapshot of the matching properties; later changes
 * to the underlying sources are not reflected in sections already returned.
 */
@ApplicationScoped
public class MicroProfileSchemeConfigurationProvider implements SchemeConfigurationProvider {

    private static final Logger LOG = Logger.getLogger(MicroProfileSchemeConfigurationProvider.class);

    private final Config config;
    private final String schemesPrefix;

    @Inject
    public MicroProfileSchemeConfigurationProvider(Config config, AuthenticationSchemesConfig schemesConfig) {
        this(config, schemesConfig.schemesPrefix());
    }

    public MicroProfileSchemeConfigurationProvider(Config config, String schemesPrefix) {
        this.config = config;
        this.schemesPrefix = schemesPrefix.endsWith(".") ? schemesPrefix : schemesPrefix + ".";
    }

    @Override
    public Optional<ConfigurationSection> getSchemeConfiguration(String scheme) {
        final var schemePrefix = (schemesPrefix + scheme + ".").toLowerCase(Locale.ROOT);
        final var values = new HashMap<String, String>();

        for (var propertyName : config.getPropertyNames()) {
            if (!propertyName.toLowerCase(Locale.ROOT).startsWith(schemePrefix)) {
                continue;
            }
            config.getOptionalValue(propertyName, String.class)
                    .ifPresent(value -> values.put(propertyName.substring(schemePrefix.length()), value));
        }

        if (values.isEmpty()) {
            LOG.debugv("No configuration found below {0}{1}", schemesPrefix, scheme);
            return Optional.empty();
        }
        return Optional.of(InMemoryConfigurationSection.of(values));
    }
}
