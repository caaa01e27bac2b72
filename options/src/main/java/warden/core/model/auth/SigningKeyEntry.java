package warden.core.model.auth;

/**
 * A configured signing key candidate.
 *
 * @param issuer issuer the key belongs to, may be null when the entry omits it
 * @param value  base64-encoded key material, null when the entry omits it
 */
public record SigningKeyEntry(String issuer, String value) {

    /**
     * Whether this entry carries key material.
     */
    public boolean hasValue() {
        return value != null;
    }

    @Override
    public String toString() {
        return "SigningKeyEntry[issuer=" + issuer + ", value=" + (value == null ? "null" : "***") + "]";
    }
}
