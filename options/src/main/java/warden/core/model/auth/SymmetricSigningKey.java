package warden.core.model.auth;

import java.util.Arrays;
import java.util.Objects;

/**
 * Symmetric key material used to verify token signatures from one issuer.
 *
 * <p>Equality is based on the key bytes only. The key bytes are copied on the
 * way in and on the way out, and are never included in {@link #toString()}.
 *
 * @param issuer   issuer the key was resolved for
 * @param keyBytes raw key material
 */
public record SymmetricSigningKey(String issuer, byte[] keyBytes) {

    public SymmetricSigningKey {
        Objects.requireNonNull(keyBytes, "keyBytes is required");
        if (keyBytes.length == 0) {
            throw new IllegalArgumentException("Signing key length cannot be zero");
        }
        keyBytes = keyBytes.clone();
    }

    @Override
    public byte[] keyBytes() {
        return keyBytes.clone();
    }

    /**
     * Key size in bits.
     */
    public int keySize() {
        return keyBytes.length * 8;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymmetricSigningKey other)) {
            return false;
        }
        return Arrays.equals(keyBytes, other.keyBytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(keyBytes);
    }

    @Override
    public String toString() {
        return "SymmetricSigningKey[issuer=" + issuer + ", keySize=" + keySize() + "]";
    }
}
