package tech.gmsaprovisioner.security.secrets;

/**
 * Read-only access to one kind of secret store.
 *
 * <p>A provider owns a reference scheme (for example {@code akv://})
 * and turns references of that scheme into plaintext. Secrets are written to
 * the store by whoever operates the domain, never by this service.
 */
public interface SecretProvider {

    /**
     * @throws SecretResolutionException if the store cannot be reached, the
     *         secret does not exist, or the host identity may not read it
     */
    String resolve(String reference) throws SecretResolutionException;

    boolean canHandle(String reference);

    /**
     * Short scheme name used in logs, e.g. "akv".
     */
    String getType();
}
