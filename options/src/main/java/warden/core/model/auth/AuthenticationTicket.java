package warden.core.model.auth;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ticket-shaped payload carried inside protected bearer and refresh tokens.
 *
 * @param scheme     authentication scheme that issued the ticket
 * @param claims     principal claims, each claim type mapped to its values
 * @param issuedAt   when the ticket was issued (nullable)
 * @param expiresAt  when the ticket expires (nullable)
 * @param properties free-form authentication properties
 */
public record AuthenticationTicket(
        String scheme,
        Map<String, List<String>> claims,
        Instant issuedAt,
        Instant expiresAt,
        Map<String, String> properties) {

    public AuthenticationTicket {
        Objects.requireNonNull(scheme, "scheme is required");
        claims = claims != null ? Map.copyOf(claims) : Map.of();
        properties = properties != null ? Map.copyOf(properties) : Map.of();
    }

    /**
     * Check whether the ticket has expired at the given instant.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * First value of a claim, or null when the claim is absent.
     */
    public String claim(String type) {
        final var values = claims.get(type);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
