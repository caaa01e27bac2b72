package warden.adapter.out.protection;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.DataProtectionConfig;
import warden.core.port.out.DataProtectionProvider;
import warden.core.port.out.DataProtector;

/**
 * AES-256-GCM data protection with purpose-derived keys.
 *
 * <p>Every purpose path gets its own AES key, derived from the master key
 * with HMAC-SHA256 over the length-prefixed path segments. A payload protected
 * for one path therefore fails authentication under any other path.
 *
 * <h2>Configuration</h2>
 * <pre>
 * warden.data-protection.key=${DATA_PROTECTION_KEY}  # Base64-encoded 256-bit key
 * warden.data-protection.key-id=v1
 * </pre>
 */
@ApplicationScoped
public class AesGcmDataProtectionProvider implements DataProtectionProvider {

    private static final Logger LOG = Logger.getLogger(AesGcmDataProtectionProvider.class);

    static final int KEY_LENGTH = 32;
    static final int MAX_KEY_ID_LENGTH = 255;
    private static final String DERIVATION_ALGORITHM = "HmacSHA256";

    private final SecretKey masterKey;
    private final String keyId;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public AesGcmDataProtectionProvider(DataProtectionConfig config) {
        this(config.key(), config.keyId());
    }

    /**
     * Constructor for manual instantiation.
     *
     * @param masterKey optional base64-encoded 256-bit master key; an ephemeral
     *                  key is generated when empty or blank
     * @param keyId     key identifier written into protected payloads, at most
     *                  255 bytes in UTF-8
     */
    public AesGcmDataProtectionProvider(Optional<String> masterKey, String keyId) {
        Objects.requireNonNull(keyId, "keyId is required");
        final var keyIdLength = keyId.getBytes(StandardCharsets.UTF_8).length;
        if (keyIdLength > MAX_KEY_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "Data protection key ID must be at most " + MAX_KEY_ID_LENGTH + " bytes. Got: " + keyIdLength
                            + " bytes");
        }
        this.keyId = keyId;

        if (masterKey.isPresent() && !masterKey.get().isBlank()) {
            final byte[] keyBytes = Base64.getDecoder().decode(masterKey.get().strip());
            if (keyBytes.length != KEY_LENGTH) {
                throw new IllegalArgumentException(
                        "Data protection key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
            }
            this.masterKey = new SecretKeySpec(keyBytes, DERIVATION_ALGORITHM);
            LOG.infov("Data protection enabled with key ID: {0}", keyId);
        } else {
            final byte[] keyBytes = new byte[KEY_LENGTH];
            secureRandom.nextBytes(keyBytes);
            this.masterKey = new SecretKeySpec(keyBytes, DERIVATION_ALGORITHM);
            LOG.warn("No data protection key configured, using an ephemeral key. Protected tokens will not "
                    + "survive a restart. Set warden.data-protection.key to a stable key.");
        }
    }

    @Override
    public DataProtector createProtector(String purpose, String... subPurposes) {
        final var purposes = new ArrayList<String>(subPurposes.length + 1);
        purposes.add(purpose);
        purposes.addAll(Arrays.asList(subPurposes));

        final var encodedPurposes = encodePurposes(purposes);
        return new AesGcmDataProtector(purposes, deriveKey(encodedPurposes), keyId, encodedPurposes, secureRandom);
    }

    private SecretKey deriveKey(byte[] encodedPurposes) {
        try {
            final var mac = Mac.getInstance(DERIVATION_ALGORITHM);
            mac.init(masterKey);
            return new SecretKeySpec(mac.doFinal(encodedPurposes), "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to derive data protection key", e);
        }
    }

    /**
     * Encode the purpose path so that no two different paths share an encoding.
     */
    static byte[] encodePurposes(List<String> purposes) {
        final var out = new ByteArrayOutputStream();
        for (var purpose : purposes) {
            if (purpose == null) {
                throw new IllegalArgumentException("Purpose segments cannot be null");
            }
            final var bytes = purpose.getBytes(StandardCharsets.UTF_8);
            out.writeBytes(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
            out.writeBytes(bytes);
        }
        return out.toByteArray();
    }
}
