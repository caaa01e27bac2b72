package warden.mock;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import warden.core.port.out.DataProtectionProvider;
import warden.core.port.out.DataProtector;

/**
 * Data protection provider for tests.
 *
 * <p>Protectors prefix payloads with their purpose path instead of encrypting,
 * so unprotecting under a different purpose fails like the real thing.
 */
public class FakeDataProtectionProvider implements DataProtectionProvider {

    private final List<List<String>> requestedPurposes = new CopyOnWriteArrayList<>();

    @Override
    public DataProtector createProtector(String purpose, String... subPurposes) {
        final var purposes = new ArrayList<String>();
        purposes.add(purpose);
        purposes.addAll(List.of(subPurposes));
        requestedPurposes.add(List.copyOf(purposes));
        return new FakeDataProtector(List.copyOf(purposes));
    }

    public List<List<String>> requestedPurposes() {
        return requestedPurposes;
    }

    record FakeDataProtector(List<String> purposes) implements DataProtector {

        @Override
        public byte[] protect(byte[] plaintext) {
            final var header = header();
            final var result = new byte[header.length + plaintext.length];
            System.arraycopy(header, 0, result, 0, header.length);
            System.arraycopy(plaintext, 0, result, header.length, plaintext.length);
            return result;
        }

        @Override
        public byte[] unprotect(byte[] protectedData) throws GeneralSecurityException {
            final var header = header();
            if (protectedData.length < header.length) {
                throw new GeneralSecurityException("payload too short");
            }
            for (int i = 0; i < header.length; i++) {
                if (protectedData[i] != header[i]) {
                    throw new GeneralSecurityException("purpose mismatch");
                }
            }
            final var result = new byte[protectedData.length - header.length];
            System.arraycopy(protectedData, header.length, result, 0, result.length);
            return result;
        }

        private byte[] header() {
            return (String.join("/", purposes) + "|").getBytes(StandardCharsets.UTF_8);
        }
    }
}
