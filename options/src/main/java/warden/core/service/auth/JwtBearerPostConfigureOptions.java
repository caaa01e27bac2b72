package warden.core.service.auth;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.model.auth.JwtBearerOptions;
import warden.core.options.PostConfigureOptions;

/**
 * Derives the metadata address from the authority and enforces HTTPS
 * metadata retrieval.
 */
@ApplicationScoped
public class JwtBearerPostConfigureOptions implements PostConfigureOptions<JwtBearerOptions> {

    private static final Logger LOG = Logger.getLogger(JwtBearerPostConfigureOptions.class);

    static final String DISCOVERY_PATH = ".well-known/openid-configuration";

    @Override
    public void postConfigure(String name, JwtBearerOptions options) {
        if (isEmpty(options.getMetadataAddress()) && !isEmpty(options.getAuthority())) {
            final var authority = options.getAuthority();
            final var metadataAddress = authority.endsWith("/")
                    ? authority + DISCOVERY_PATH
                    : authority + "/" + DISCOVERY_PATH;
            options.setMetadataAddress(metadataAddress);
            LOG.debugv("Scheme {0}: metadata address derived from authority: {1}", name, metadataAddress);
        }

        final var metadataAddress = options.getMetadataAddress();
        if (options.isRequireHttpsMetadata()
                && !isEmpty(metadataAddress)
                && !metadataAddress.toLowerCase(Locale.ROOT).startsWith("https://")) {
            throw new IllegalStateException("The MetadataAddress or Authority must use HTTPS unless disabled for "
                    + "development by setting RequireHttpsMetadata=false.");
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
