package warden.core.model.auth;

import java.util.Optional;

/**
 * Serializes and protects opaque payloads so they can travel as text.
 *
 * @param <T> the payload type
 */
public interface SecureDataFormat<T> {

    /**
     * Serialize and protect a payload.
     *
     * @param data the payload
     * @return protected, URL-safe text
     */
    String protect(T data);

    /**
     * Unprotect and deserialize text produced by {@link #protect(Object)}.
     *
     * @param protectedText the protected text
     * @return the payload, or empty when the text is missing, tampered with or
     *         was protected for a different purpose
     */
    Optional<T> unprotect(String protectedText);
}
