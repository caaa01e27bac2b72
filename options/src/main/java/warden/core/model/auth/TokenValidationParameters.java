package warden.core.model.auth;

import java.util.List;

/**
 * Parameters used to validate incoming bearer tokens.
 *
 * <p>{@code validIssuer} and {@code validAudience} are single legacy values
 * sourced independently of the corresponding lists.
 *
 * @param validateIssuer           whether the iss claim is checked
 * @param validIssuers             accepted issuers, in configuration order (duplicates kept)
 * @param validIssuer              single legacy issuer (nullable)
 * @param validateAudience         whether the aud claim is checked
 * @param validAudiences           accepted audiences, in configuration order
 * @param validAudience            single legacy audience (nullable)
 * @param validateIssuerSigningKey whether the signing key is checked
 * @param issuerSigningKeys        keys that may have signed the token
 */
public record TokenValidationParameters(
        boolean validateIssuer,
        List<String> validIssuers,
        String validIssuer,
        boolean validateAudience,
        List<String> validAudiences,
        String validAudience,
        boolean validateIssuerSigningKey,
        List<SymmetricSigningKey> issuerSigningKeys) {

    public TokenValidationParameters {
        validIssuers = validIssuers != null ? List.copyOf(validIssuers) : List.of();
        validAudiences = validAudiences != null ? List.copyOf(validAudiences) : List.of();
        issuerSigningKeys = issuerSigningKeys != null ? List.copyOf(issuerSigningKeys) : List.of();
    }

    /**
     * Parameters a fresh options instance starts with: issuer and audience
     * checks on, no allow-lists, no keys, signing key check off.
     */
    public static TokenValidationParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean validateIssuer = true;
        private List<String> validIssuers = List.of();
        private String validIssuer;
        private boolean validateAudience = true;
        private List<String> validAudiences = List.of();
        private String validAudience;
        private boolean validateIssuerSigningKey;
        private List<SymmetricSigningKey> issuerSigningKeys = List.of();

        private Builder() {}

        public Builder validateIssuer(boolean validateIssuer) {
            this.validateIssuer = validateIssuer;
            return this;
        }

        public Builder validIssuers(List<String> validIssuers) {
            this.validIssuers = validIssuers;
            return this;
        }

        public Builder validIssuer(String validIssuer) {
            this.validIssuer = validIssuer;
            return this;
        }

        public Builder validateAudience(boolean validateAudience) {
            this.validateAudience = validateAudience;
            return this;
        }

        public Builder validAudiences(List<String> validAudiences) {
            this.validAudiences = validAudiences;
            return this;
        }

        public Builder validAudience(String validAudience) {
            this.validAudience = validAudience;
            return this;
        }

        public Builder validateIssuerSigningKey(boolean validateIssuerSigningKey) {
            this.validateIssuerSigningKey = validateIssuerSigningKey;
            return this;
        }

        public Builder issuerSigningKeys(List<SymmetricSigningKey> issuerSigningKeys) {
            this.issuerSigningKeys = issuerSigningKeys;
            return this;
        }

        public TokenValidationParameters build() {
            return new TokenValidationParameters(
                    validateIssuer,
                    validIssuers,
                    validIssuer,
                    validateAudience,
                    validAudiences,
                    validAudience,
                    validateIssuerSigningKey,
                    issuerSigningKeys);
        }
    }
}
