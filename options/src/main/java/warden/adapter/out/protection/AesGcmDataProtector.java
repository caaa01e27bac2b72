package warden.adapter.out.protection;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.List;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

import org.jboss.logging.Logger;

import warden.core.port.out.DataProtector;

/**
 * Protector for a single purpose path.
 *
 * <p>Payload layout: {@code keyIdLength(1) | keyId | iv(12) | ciphertext+tag}.
 * The encoded purpose path is bound as additional authenticated data.
 */
class AesGcmDataProtector implements DataProtector {

    private static final Logger LOG = Logger.getLogger(AesGcmDataProtector.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final List<String> purposes;
    private final SecretKey key;
    private final String keyId;
    private final byte[] associatedData;
    private final SecureRandom secureRandom;

    AesGcmDataProtector(
            List<String> purposes, SecretKey key, String keyId, byte[] associatedData, SecureRandom secureRandom) {
        this.purposes = List.copyOf(purposes);
        this.key = key;
        this.keyId = keyId;
        this.associatedData = associatedData.clone();
        this.secureRandom = secureRandom;
    }

    @Override
    public List<String> purposes() {
        return purposes;
    }

    @Override
    public byte[] protect(byte[] plaintext) {
        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            cipher.updateAAD(associatedData);

            final byte[] ciphertext = cipher.doFinal(plaintext);
            final byte[] keyIdBytes = keyId.getBytes(StandardCharsets.UTF_8);

            final ByteBuffer buffer = ByteBuffer.allocate(1 + keyIdBytes.length + IV_LENGTH + ciphertext.length);
            buffer.put((byte) keyIdBytes.length);
            buffer.put(keyIdBytes);
            buffer.put(iv);
            buffer.put(ciphertext);
            return buffer.array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to protect payload for " + purposes, e);
        }
    }

    @Override
    public byte[] unprotect(byte[] protectedData) throws GeneralSecurityException {
        final ByteBuffer buffer = ByteBuffer.wrap(protectedData);
        if (!buffer.hasRemaining()) {
            throw new GeneralSecurityException("Protected payload is empty");
        }

        final int keyIdLength = buffer.get() & 0xFF;
        if (buffer.remaining() < keyIdLength + IV_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new GeneralSecurityException("Protected payload is truncated");
        }
        final byte[] keyIdBytes = new byte[keyIdLength];
        buffer.get(keyIdBytes);
        final String dataKeyId = new String(keyIdBytes, StandardCharsets.UTF_8);
        if (!keyId.equals(dataKeyId)) {
            LOG.warnv("Key ID mismatch: expected {0}, got {1}. Key rotation may be needed.", keyId, dataKeyId);
        }

        final byte[] iv = new byte[IV_LENGTH];
        buffer.get(iv);
        final byte[] ciphertext = new byte[buffer.remaining()];
        buffer.get(ciphertext);

        final Cipher cipher = Cipher.getInstance(ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
        cipher.updateAAD(associatedData);
        return cipher.doFinal(ciphertext);
    }
}
