package tech.gmsaprovisioner.directory;

import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.credential.DirectoryCredential;

import java.time.Duration;
import java.util.Optional;

/**
 * Typed operations against the remote directory server.
 *
 * <p>Every operation takes the credential fetched for the current invocation;
 * implementations must not keep it beyond the call. Failures are reported as
 * {@link ProvisioningException} carrying the classified {@link ErrorKind}.
 */
public interface DirectoryClient {

    /**
     * Look up an account by name (with or without the trailing {@code $}).
     *
     * @throws ProvisioningException {@link ErrorKind#DIRECTORY_UNREACHABLE}
     */
    Optional<DirectoryObjectRef> findAccount(DirectoryCredential credential, String accountName);

    /**
     * Make sure a KDS root key exists, creating one when none does.
     *
     * @param policy         effective-time policy for a key created by this call
     * @param propagation    propagation window used to back-date or post-date the key
     * @param requestedKeyId specific key to require, or null for any key
     * @throws ProvisioningException {@link ErrorKind#INVALID_PARAMETER} if the requested
     *         key does not exist, {@link ErrorKind#PERMISSION_DENIED},
     *         {@link ErrorKind#DIRECTORY_UNREACHABLE}
     */
    RootKeyState ensureRootKey(DirectoryCredential credential, RootKeyPolicy policy,
                               Duration propagation, String requestedKeyId);

    /**
     * Create the account.
     *
     * @throws ProvisioningException {@link ErrorKind#ALREADY_EXISTS},
     *         {@link ErrorKind#DIRECTORY_UNREACHABLE}, {@link ErrorKind#PERMISSION_DENIED},
     *         {@link ErrorKind#INVALID_PARAMETER}
     */
    DirectoryObjectRef createAccount(DirectoryCredential credential, CreationParameters parameters);

    /**
     * Re-read a just-created account.
     *
     * @throws ProvisioningException {@link ErrorKind#VERIFICATION_FAILED} if the
     *         object cannot be read back
     */
    default DirectoryObjectRef verifyAccount(DirectoryCredential credential, String accountName) {
        Optional<DirectoryObjectRef> found;
        try {
            found = findAccount(credential, accountName);
        } catch (ProvisioningException e) {
            throw new ProvisioningException(ErrorKind.VERIFICATION_FAILED,
                "Read-back of " + accountName + " failed: " + e.getMessage(), e);
        }
        return found.orElseThrow(() -> new ProvisioningException(ErrorKind.VERIFICATION_FAILED,
            "Account " + accountName + " was not found after creation"));
    }
}
