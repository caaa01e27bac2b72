package warden.core.port.out;

import java.util.Optional;

/**
 * Port for locating the configuration subtree of an authentication scheme.
 */
public interface SchemeConfigurationProvider {

    /**
     * Get the configuration section for a scheme.
     *
     * @param scheme the scheme name
     * @return the section, or empty if the scheme has no configuration
     */
    Optional<ConfigurationSection> getSchemeConfiguration(String scheme);
}
