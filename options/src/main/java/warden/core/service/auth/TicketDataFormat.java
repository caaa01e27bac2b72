package warden.core.service.auth;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthenticationTicket;
import warden.core.model.auth.SecureDataFormat;
import warden.core.port.out.DataProtector;

/**
 * Protects {@link AuthenticationTicket}s as URL-safe text.
 *
 * <p>Tickets are written as JSON, protected by a purpose-bound
 * {@link DataProtector}, and encoded as unpadded base64url.
 */
public class TicketDataFormat implements SecureDataFormat<AuthenticationTicket> {

    private static final Logger LOG = Logger.getLogger(TicketDataFormat.class);

    private final DataProtector protector;
    private final ObjectMapper objectMapper;

    public TicketDataFormat(DataProtector protector, ObjectMapper objectMapper) {
        this.protector = protector;
        this.objectMapper = objectMapper;
    }

    @Override
    public String protect(AuthenticationTicket ticket) {
        try {
            final var payload = objectMapper.writeValueAsBytes(ticket);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(protector.protect(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize authentication ticket", e);
        }
    }

    @Override
    public Optional<AuthenticationTicket> unprotect(String protectedText) {
        if (protectedText == null || protectedText.isBlank()) {
            return Optional.empty();
        }

        try {
            final var protectedData = Base64.getUrlDecoder().decode(protectedText);
            final var payload = protector.unprotect(protectedData);
            return Optional.of(objectMapper.readValue(payload, AuthenticationTicket.class));
        } catch (IllegalArgumentException e) {
            LOG.debugv("Rejected ticket for {0}: malformed encoding", protector.purposes());
        } catch (GeneralSecurityException e) {
            LOG.debugv("Rejected ticket for {0}: {1}", protector.purposes(), e.getClass().getSimpleName());
        } catch (IOException e) {
            LOG.debugv("Rejected ticket for {0}: unreadable payload", protector.purposes());
        }
        return Optional.empty();
    }

    /**
     * The protector backing this format.
     */
    public DataProtector getProtector() {
        return protector;
    }
}
