package warden.core.model.auth;

/**
 * Thrown when a configured signing key is present but cannot be decoded.
 *
 * <p>The message names the issuer, never the key value.
 */
public class SigningKeyDecodeException extends IllegalArgumentException {

    private final String issuer;

    public SigningKeyDecodeException(String issuer, String message, Throwable cause) {
        super(message, cause);
        this.issuer = issuer;
    }

    public String getIssuer() {
        return issuer;
    }
}
