package tech.gmsaprovisioner.provisioning;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.credential.DirectoryCredential;
import tech.gmsaprovisioner.directory.DirectoryClient;
import tech.gmsaprovisioner.directory.DirectoryObjectRef;

import java.util.Optional;

/**
 * Decides whether the requested account already exists.
 *
 * <p>The check and the later creation are not atomic. Two invocations for the
 * same name can both pass the check; the loser's creation then fails with an
 * "already exists" error from the directory, which
 * {@link #resolveConflict(String, DirectoryCredential)} turns back into an
 * {@code AlreadyExists} outcome.
 */
@ApplicationScoped
public class IdempotencyGuard {

    private static final Logger LOG = Logger.getLogger(IdempotencyGuard.class);

    @Inject
    DirectoryClient directoryClient;

    /**
     * @throws ProvisioningException {@link ErrorKind#DIRECTORY_UNREACHABLE} if the lookup fails
     */
    public Optional<DirectoryObjectRef> findExisting(String accountName, DirectoryCredential credential) {
        Optional<DirectoryObjectRef> existing = directoryClient.findAccount(credential, accountName);
        existing.ifPresent(ref -> LOG.infof("Account %s already exists at %s", accountName, ref.distinguishedName()));
        return existing;
    }

    public boolean isConflict(ProvisioningException e) {
        return e.kind() == ErrorKind.ALREADY_EXISTS;
    }

    /**
     * DN of the account that won a creation race, or null if it cannot be read.
     */
    public String resolveConflict(String accountName, DirectoryCredential credential) {
        try {
            return directoryClient.findAccount(credential, accountName)
                .map(DirectoryObjectRef::distinguishedName)
                .orElse(null);
        } catch (ProvisioningException e) {
            LOG.debugf("Could not read back conflicting account %s: %s", accountName, e.getMessage());
            return null;
        }
    }
}
