package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.protection.AesGcmDataProtectionProvider;
import warden.core.model.auth.AuthenticationTicket;

@DisplayName("TicketDataFormat")
class TicketDataFormatTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private AesGcmDataProtectionProvider provider;
    private TicketDataFormat format;
    private AuthenticationTicket ticket;

    private static String generateTestKey() {
        final byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return Base64.getEncoder().encodeToString(key);
    }

    @BeforeEach
    void setUp() {
        provider = new AesGcmDataProtectionProvider(Optional.of(generateTestKey()), "v1");
        format = new TicketDataFormat(provider.createProtector("JWTBearerToken", "Bearer", "BearerToken"), objectMapper);
        ticket = new AuthenticationTicket(
                "Bearer",
                Map.of("sub", List.of("user-1"), "role", List.of("admin", "reader")),
                Instant.parse("2024-05-01T10:00:00Z"),
                Instant.parse("2024-05-01T11:00:00Z"),
                Map.of("client_id", "web"));
    }

    @Nested
    @DisplayName("protect()")
    class Protect {

        @Test
        @DisplayName("should produce URL-safe text")
        void shouldProduceUrlSafeText() {
            final var protectedText = format.protect(ticket);

            assertTrue(protectedText.matches("^[A-Za-z0-9_-]+$"));
        }

        @Test
        @DisplayName("should produce different text for the same ticket")
        void shouldUseFreshIv() {
            assertNotEquals(format.protect(ticket), format.protect(ticket));
        }

        @Test
        @DisplayName("should not expose claims in clear text")
        void shouldNotExposeClaims() {
            final var decoded = new String(Base64.getUrlDecoder().decode(format.protect(ticket)));

            assertFalse(decoded.contains("user-1"));
        }
    }

    @Nested
    @DisplayName("unprotect()")
    class Unprotect {

        @Test
        @DisplayName("should round-trip a ticket")
        void shouldRoundTrip() {
            final var result = format.unprotect(format.protect(ticket));

            assertEquals(Optional.of(ticket), result);
            assertEquals("user-1", result.get().claim("sub"));
        }

        @Test
        @DisplayName("should return empty for null or blank input")
        void shouldReturnEmptyForBlank() {
            assertTrue(format.unprotect(null).isEmpty());
            assertTrue(format.unprotect("  ").isEmpty());
        }

        @Test
        @DisplayName("should return empty for malformed encoding")
        void shouldReturnEmptyForMalformedEncoding() {
            assertTrue(format.unprotect("not base64 !").isEmpty());
        }

        @Test
        @DisplayName("should return empty for tampered text")
        void shouldReturnEmptyForTamperedText() {
            final var bytes = Base64.getUrlDecoder().decode(format.protect(ticket));
            bytes[bytes.length - 1] ^= 0x01;

            assertTrue(format.unprotect(Base64.getUrlEncoder().withoutPadding().encodeToString(bytes))
                    .isEmpty());
        }

        @Test
        @DisplayName("should return empty for truncated text")
        void shouldReturnEmptyForTruncatedText() {
            assertTrue(format.unprotect("AQ").isEmpty());
        }

        @Test
        @DisplayName("should return empty for text protected under another purpose")
        void shouldReturnEmptyForOtherPurpose() {
            final var refresh = new TicketDataFormat(
                    provider.createProtector("JWTBearerToken", "Bearer", "RefreshToken"), objectMapper);

            assertTrue(refresh.unprotect(format.protect(ticket)).isEmpty());
        }

        @Test
        @DisplayName("should return empty for text protected for another scheme")
        void shouldReturnEmptyForOtherScheme() {
            final var other = new TicketDataFormat(
                    provider.createProtector("JWTBearerToken", "Other", "BearerToken"), objectMapper);

            assertTrue(other.unprotect(format.protect(ticket)).isEmpty());
        }
    }

    @Test
    @DisplayName("should report expiry relative to a given instant")
    void shouldReportExpiry() {
        assertFalse(ticket.isExpired(Instant.parse("2024-05-01T10:30:00Z")));
        assertTrue(ticket.isExpired(Instant.parse("2024-05-01T11:00:00Z")));
    }
}
