package warden.core.model.auth;

import java.time.Duration;

/**
 * Options for one JWT bearer authentication scheme.
 *
 * <p>Instances are created with framework defaults by the options registry and
 * configured in place. A configured instance is a snapshot; it is never
 * reloaded.
 */
public class JwtBearerOptions {

    public static final String DEFAULT_CHALLENGE = "Bearer";
    public static final Duration DEFAULT_BACKCHANNEL_TIMEOUT = Duration.ofMinutes(1);
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_BEARER_TOKEN_EXPIRATION = Duration.ofHours(1);
    public static final Duration DEFAULT_REFRESH_TOKEN_EXPIRATION = Duration.ofDays(14);

    private String authority;
    private Duration backchannelTimeout = DEFAULT_BACKCHANNEL_TIMEOUT;
    private String challenge = DEFAULT_CHALLENGE;
    private String forwardAuthenticate;
    private String forwardChallenge;
    private String forwardDefault;
    private String forwardForbid;
    private String forwardSignIn;
    private String forwardSignOut;
    private boolean includeErrorDetails = true;
    private boolean mapInboundClaims = true;
    private String metadataAddress;
    private Duration refreshInterval = DEFAULT_REFRESH_INTERVAL;
    private boolean refreshOnIssuerKeyNotFound = true;
    private boolean requireHttpsMetadata = true;
    private boolean saveToken = true;
    private Duration bearerTokenExpiration = DEFAULT_BEARER_TOKEN_EXPIRATION;
    private Duration refreshTokenExpiration = DEFAULT_REFRESH_TOKEN_EXPIRATION;
    private TokenValidationParameters tokenValidationParameters = TokenValidationParameters.defaults();
    private SecureDataFormat<AuthenticationTicket> bearerTokenProtector;
    private SecureDataFormat<AuthenticationTicket> refreshTokenProtector;

    /**
     * Base address of the token issuer, used to derive the metadata address.
     */
    public String getAuthority() {
        return authority;
    }

    public void setAuthority(String authority) {
        this.authority = authority;
    }

    /**
     * Timeout for back-channel calls to the metadata endpoint.
     */
    public Duration getBackchannelTimeout() {
        return backchannelTimeout;
    }

    public void setBackchannelTimeout(Duration backchannelTimeout) {
        this.backchannelTimeout = backchannelTimeout;
    }

    /**
     * Challenge written to the WWW-Authenticate header.
     */
    public String getChallenge() {
        return challenge;
    }

    public void setChallenge(String challenge) {
        this.challenge = challenge;
    }

    public String getForwardAuthenticate() {
        return forwardAuthenticate;
    }

    public void setForwardAuthenticate(String forwardAuthenticate) {
        this.forwardAuthenticate = forwardAuthenticate;
    }

    public String getForwardChallenge() {
        return forwardChallenge;
    }

    public void setForwardChallenge(String forwardChallenge) {
        this.forwardChallenge = forwardChallenge;
    }

    public String getForwardDefault() {
        return forwardDefault;
    }

    public void setForwardDefault(String forwardDefault) {
        this.forwardDefault = forwardDefault;
    }

    public String getForwardForbid() {
        return forwardForbid;
    }

    public void setForwardForbid(String forwardForbid) {
        this.forwardForbid = forwardForbid;
    }

    public String getForwardSignIn() {
        return forwardSignIn;
    }

    public void setForwardSignIn(String forwardSignIn) {
        this.forwardSignIn = forwardSignIn;
    }

    public String getForwardSignOut() {
        return forwardSignOut;
    }

    public void setForwardSignOut(String forwardSignOut) {
        this.forwardSignOut = forwardSignOut;
    }

    public boolean isIncludeErrorDetails() {
        return includeErrorDetails;
    }

    public void setIncludeErrorDetails(boolean includeErrorDetails) {
        this.includeErrorDetails = includeErrorDetails;
    }

    public boolean isMapInboundClaims() {
        return mapInboundClaims;
    }

    public void setMapInboundClaims(boolean mapInboundClaims) {
        this.mapInboundClaims = mapInboundClaims;
    }

    /**
     * Discovery document address. Derived from {@link #getAuthority()} when unset.
     */
    public String getMetadataAddress() {
        return metadataAddress;
    }

    public void setMetadataAddress(String metadataAddress) {
        this.metadataAddress = metadataAddress;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public void setRefreshInterval(Duration refreshInterval) {
        this.refreshInterval = refreshInterval;
    }

    public boolean isRefreshOnIssuerKeyNotFound() {
        return refreshOnIssuerKeyNotFound;
    }

    public void setRefreshOnIssuerKeyNotFound(boolean refreshOnIssuerKeyNotFound) {
        this.refreshOnIssuerKeyNotFound = refreshOnIssuerKeyNotFound;
    }

    public boolean isRequireHttpsMetadata() {
        return requireHttpsMetadata;
    }

    public void setRequireHttpsMetadata(boolean requireHttpsMetadata) {
        this.requireHttpsMetadata = requireHttpsMetadata;
    }

    public boolean isSaveToken() {
        return saveToken;
    }

    public void setSaveToken(boolean saveToken) {
        this.saveToken = saveToken;
    }

    /**
     * Lifetime of bearer tokens protected by {@link #getBearerTokenProtector()}.
     */
    public Duration getBearerTokenExpiration() {
        return bearerTokenExpiration;
    }

    public void setBearerTokenExpiration(Duration bearerTokenExpiration) {
        this.bearerTokenExpiration = bearerTokenExpiration;
    }

    /**
     * Lifetime of refresh tokens protected by {@link #getRefreshTokenProtector()}.
     */
    public Duration getRefreshTokenExpiration() {
        return refreshTokenExpiration;
    }

    public void setRefreshTokenExpiration(Duration refreshTokenExpiration) {
        this.refreshTokenExpiration = refreshTokenExpiration;
    }

    public TokenValidationParameters getTokenValidationParameters() {
        return tokenValidationParameters;
    }

    public void setTokenValidationParameters(TokenValidationParameters tokenValidationParameters) {
        this.tokenValidationParameters = tokenValidationParameters;
    }

    public SecureDataFormat<AuthenticationTicket> getBearerTokenProtector() {
        return bearerTokenProtector;
    }

    public void setBearerTokenProtector(SecureDataFormat<AuthenticationTicket> bearerTokenProtector) {
        this.bearerTokenProtector = bearerTokenProtector;
    }

    public SecureDataFormat<AuthenticationTicket> getRefreshTokenProtector() {
        return refreshTokenProtector;
    }

    public void setRefreshTokenProtector(SecureDataFormat<AuthenticationTicket> refreshTokenProtector) {
        this.refreshTokenProtector = refreshTokenProtector;
    }
}
