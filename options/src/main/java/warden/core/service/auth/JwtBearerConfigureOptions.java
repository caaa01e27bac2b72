package warden.core.service.auth;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import warden.core.model.auth.JwtBearerOptions;
import warden.core.model.auth.TokenValidationParameters;
import warden.core.options.ConfigureNamedOptions;
import warden.core.port.out.ConfigurationSection;
import warden.core.port.out.DataProtectionProvider;
import warden.core.port.out.SchemeConfigurationProvider;
import warden.core.util.ConfigurationValues;
import warden.core.util.TimeSpanFormat;

/**
 * Configures {@link JwtBearerOptions} for a named scheme from its
 * configuration subtree.
 *
 * <p>Both token protectors are always assigned for a non-empty scheme name,
 * even when the scheme has no configuration. Every other field is only
 * overwritten when its key holds a non-empty value; otherwise the value the
 * options instance already carries is kept.
 *
 * <h2>Configuration keys</h2>
 * <pre>
 * Authority, Challenge, MetadataAddress, Forward*     string
 * IncludeErrorDetails, MapInboundClaims, SaveToken,
 * RefreshOnIssuerKeyNotFound, RequireHttpsMetadata    boolean
 * BackchannelTimeout, RefreshInterval                 duration (invariant)
 * BearerTokenExpiration, RefreshTokenExpiration       duration (default locale)
 * ValidIssuer, ValidAudience                          string
 * ValidIssuers[n], ValidAudiences[n]                  string list
 * SigningKeys[n].Issuer, SigningKeys[n].Value         issuer + base64 key
 * </pre>
 *
 * <p>Malformed values are not recovered from: the parse failure propagates
 * and the scheme cannot be activated.
 */
@ApplicationScoped
public class JwtBearerConfigureOptions implements ConfigureNamedOptions<JwtBearerOptions> {

    private static final Logger LOG = Logger.getLogger(JwtBearerConfigureOptions.class);

    static final String PRIMARY_PURPOSE = "JWTBearerToken";
    static final String BEARER_TOKEN_PURPOSE = "BearerToken";
    static final String REFRESH_TOKEN_PURPOSE = "RefreshToken";

    private static final Function<String, Duration> INVARIANT_DURATION = TimeSpanFormat::parseInvariant;
    private static final Function<String, Duration> DEFAULT_LOCALE_DURATION = TimeSpanFormat::parse;
    private static final Function<String, Boolean> BOOLEAN = ConfigurationValues::parseBoolean;

    private final SchemeConfigurationProvider configurationProvider;
    private final DataProtectionProvider dataProtectionProvider;
    private final ObjectMapper objectMapper;

    @Inject
    public JwtBearerConfigureOptions(
            SchemeConfigurationProvider configurationProvider,
            DataProtectionProvider dataProtectionProvider,
            ObjectMapper objectMapper) {
        this.configurationProvider = configurationProvider;
        this.dataProtectionProvider = dataProtectionProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public void configure(String name, JwtBearerOptions options) {
        if (name == null || name.isEmpty()) {
            return;
        }

        options.setBearerTokenProtector(new TicketDataFormat(
                dataProtectionProvider.createProtector(PRIMARY_PURPOSE, name, BEARER_TOKEN_PURPOSE), objectMapper));
        options.setRefreshTokenProtector(new TicketDataFormat(
                dataProtectionProvider.createProtector(PRIMARY_PURPOSE, name, REFRESH_TOKEN_PURPOSE), objectMapper));

        final var section = configurationProvider
                .getSchemeConfiguration(name)
                .filter(s -> !s.getChildren().isEmpty());
        if (section.isEmpty()) {
            LOG.debugv("No configuration for scheme {0}, keeping defaults", name);
            return;
        }
        final var config = section.get();

        final var issuer = config.get("ValidIssuer");
        final var issuers = values(config.getSection("ValidIssuers"));
        final var audience = config.get("ValidAudience");
        final var audiences = values(config.getSection("ValidAudiences"));

        options.setAuthority(string(config, "Authority", options.getAuthority()));
        options.setBackchannelTimeout(ConfigurationValues.parseValueOrDefault(
                config.get("BackchannelTimeout"), INVARIANT_DURATION, options.getBackchannelTimeout()));
        options.setChallenge(string(config, "Challenge", options.getChallenge()));
        options.setForwardAuthenticate(string(config, "ForwardAuthenticate", options.getForwardAuthenticate()));
        options.setForwardChallenge(string(config, "ForwardChallenge", options.getForwardChallenge()));
        options.setForwardDefault(string(config, "ForwardDefault", options.getForwardDefault()));
        options.setForwardForbid(string(config, "ForwardForbid", options.getForwardForbid()));
        options.setForwardSignIn(string(config, "ForwardSignIn", options.getForwardSignIn()));
        options.setForwardSignOut(string(config, "ForwardSignOut", options.getForwardSignOut()));
        options.setIncludeErrorDetails(ConfigurationValues.parseValueOrDefault(
                config.get("IncludeErrorDetails"), BOOLEAN, options.isIncludeErrorDetails()));
        options.setMapInboundClaims(ConfigurationValues.parseValueOrDefault(
                config.get("MapInboundClaims"), BOOLEAN, options.isMapInboundClaims()));
        options.setMetadataAddress(string(config, "MetadataAddress", options.getMetadataAddress()));
        options.setRefreshInterval(ConfigurationValues.parseValueOrDefault(
                config.get("RefreshInterval"), INVARIANT_DURATION, options.getRefreshInterval()));
        options.setRefreshOnIssuerKeyNotFound(ConfigurationValues.parseValueOrDefault(
                config.get("RefreshOnIssuerKeyNotFound"), BOOLEAN, options.isRefreshOnIssuerKeyNotFound()));
        options.setRequireHttpsMetadata(ConfigurationValues.parseValueOrDefault(
                config.get("RequireHttpsMetadata"), BOOLEAN, options.isRequireHttpsMetadata()));
        options.setSaveToken(
                ConfigurationValues.parseValueOrDefault(config.get("SaveToken"), BOOLEAN, options.isSaveToken()));

        final var signingKeys = SigningKeyResolver.resolve(
                issuers, SigningKeyResolver.entriesOf(config.getSection("SigningKeys")));
        options.setTokenValidationParameters(TokenValidationParameters.builder()
                .validateIssuer(!issuers.isEmpty())
                .validIssuers(issuers)
                .validIssuer(issuer)
                .validateAudience(!audiences.isEmpty())
                .validAudiences(audiences)
                .validAudience(audience)
                .validateIssuerSigningKey(true)
                .issuerSigningKeys(signingKeys)
                .build());

        // TODO: switch to INVARIANT_DURATION once no deployment relies on a locale decimal separator here
        options.setBearerTokenExpiration(ConfigurationValues.parseValueOrDefault(
                config.get("BearerTokenExpiration"), DEFAULT_LOCALE_DURATION, options.getBearerTokenExpiration()));
        options.setRefreshTokenExpiration(ConfigurationValues.parseValueOrDefault(
                config.get("RefreshTokenExpiration"), DEFAULT_LOCALE_DURATION, options.getRefreshTokenExpiration()));

        LOG.debugv(
                "Configured scheme {0}: {1} issuer(s), {2} audience(s), {3} signing key(s)",
                name,
                issuers.size(),
                audiences.size(),
                signingKeys.size());
    }

    private static String string(ConfigurationSection config, String key, String current) {
        return ConfigurationValues.parseValueOrDefault(config.get(key), Function.identity(), current);
    }

    /**
     * Values of the section's children, in order. Children without a value of
     * their own (nested subsections) contribute no entry, so they neither
     * lengthen the list nor switch validation on.
     */
    private static List<String> values(ConfigurationSection section) {
        return section.getChildren().stream()
                .map(ConfigurationSection::value)
                .filter(Objects::nonNull)
                .toList();
    }
}
