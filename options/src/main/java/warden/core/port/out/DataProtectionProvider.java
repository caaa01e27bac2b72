package warden.core.port.out;

/**
 * Port for creating purpose-bound data protectors.
 *
 * <p>Protectors created for different purpose paths must not be able to
 * unprotect each other's payloads. Implementations must be thread-safe.
 */
public interface DataProtectionProvider {

    /**
     * Create a protector for a purpose path.
     *
     * @param purpose     root purpose
     * @param subPurposes additional purpose segments, appended in order
     * @return a protector bound to the full purpose path
     */
    DataProtector createProtector(String purpose, String... subPurposes);
}
