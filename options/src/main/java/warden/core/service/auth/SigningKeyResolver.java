package warden.core.service.auth;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import warden.core.model.auth.SigningKeyDecodeException;
import warden.core.model.auth.SigningKeyEntry;
import warden.core.model.auth.SymmetricSigningKey;
import warden.core.port.out.ConfigurationSection;

/**
 * Resolves at most one symmetric signing key per issuer.
 *
 * <p>Issuers are visited in order. The first candidate whose issuer matches
 * wins; later candidates for the same issuer are ignored. Issuers without a
 * candidate, or whose candidate has no value, contribute no key. A candidate
 * whose value is present but is not valid base64 fails the whole resolution.
 */
public final class SigningKeyResolver {

    private static final Logger LOG = Logger.getLogger(SigningKeyResolver.class);

    static final String ISSUER_KEY = "Issuer";
    static final String VALUE_KEY = "Value";

    private SigningKeyResolver() {}

    /**
     * Resolve signing keys for the given issuers.
     *
     * @param issuers    issuers in configuration order
     * @param candidates configured key entries
     * @return resolved keys, in issuer order
     * @throws SigningKeyDecodeException if a matched value cannot be decoded
     */
    public static List<SymmetricSigningKey> resolve(List<String> issuers, List<SigningKeyEntry> candidates) {
        final var byIssuer = index(candidates);
        final var keys = new ArrayList<SymmetricSigningKey>(issuers.size());
        for (var issuer : issuers) {
            final var entry = byIssuer.get(issuer);
            if (entry == null || !entry.hasValue()) {
                LOG.debugv("No signing key configured for issuer {0}", issuer);
                continue;
            }
            keys.add(decode(issuer, entry.value()));
        }
        return keys;
    }

    /**
     * Read key entries from a {@code SigningKeys} section.
     *
     * <p>Each child contributes its {@code Issuer} and {@code Value} keys.
     *
     * @param section the section, possibly non-existent
     * @return entries in configuration order
     */
    public static List<SigningKeyEntry> entriesOf(ConfigurationSection section) {
        return section.getChildren().stream()
                .map(child -> new SigningKeyEntry(child.get(ISSUER_KEY), child.get(VALUE_KEY)))
                .toList();
    }

    /**
     * Index entries by issuer, keeping the first entry per issuer.
     */
    static Map<String, SigningKeyEntry> index(List<SigningKeyEntry> candidates) {
        final var byIssuer = new HashMap<String, SigningKeyEntry>();
        candidates.stream()
                .filter(candidate -> candidate.issuer() != null)
                .forEach(candidate -> byIssuer.putIfAbsent(candidate.issuer(), candidate));
        return byIssuer;
    }

    private static SymmetricSigningKey decode(String issuer, String value) {
        final byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(stripWhitespace(value));
        } catch (IllegalArgumentException e) {
            throw new SigningKeyDecodeException(
                    issuer, "Signing key for issuer '" + issuer + "' is not valid base64", e);
        }
        if (keyBytes.length == 0) {
            throw new SigningKeyDecodeException(issuer, "Signing key for issuer '" + issuer + "' is empty", null);
        }
        return new SymmetricSigningKey(issuer, keyBytes);
    }

    private static String stripWhitespace(String value) {
        final var builder = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            final var c = value.charAt(i);
            if (!Character.isWhitespace(c)) {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
