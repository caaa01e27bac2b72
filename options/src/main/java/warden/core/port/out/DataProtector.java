package warden.core.port.out;

import java.security.GeneralSecurityException;
import java.util.List;

/**
 * Encrypts and authenticates payloads for one purpose path.
 */
public interface DataProtector {

    /**
     * The purpose path this protector is bound to.
     */
    List<String> purposes();

    /**
     * Protect a plaintext payload.
     */
    byte[] protect(byte[] plaintext);

    /**
     * Unprotect a payload produced by {@link #protect(byte[])}.
     *
     * @throws GeneralSecurityException if the payload was tampered
     *         with or protected for another purpose
     */
    byte[] unprotect(byte[] protectedData) throws GeneralSecurityException;
}
