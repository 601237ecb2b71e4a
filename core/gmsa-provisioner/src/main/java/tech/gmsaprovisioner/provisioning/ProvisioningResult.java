package tech.gmsaprovisioner.provisioning;

import tech.gmsaprovisioner.common.errors.ErrorKind;

import java.time.Instant;

/**
 * Outcome of one provisioning invocation.
 *
 * <p>Exactly one variant is produced per invocation, once all steps have
 * finished, and it is never modified afterwards.
 */
public sealed interface ProvisioningResult
    permits ProvisioningResult.Success, ProvisioningResult.AlreadyExists, ProvisioningResult.Failed {

    String accountName();

    Instant timestamp();

    /**
     * Wire value of the {@code Status} field.
     */
    String status();

    /**
     * The account was created and read back.
     */
    record Success(
        String accountName,
        String dnsHostName,
        String distinguishedName,
        String samAccountName,
        String objectId,
        Instant createdAt,
        Instant timestamp
    ) implements ProvisioningResult {
        @Override
        public String status() {
            return "Success";
        }
    }

    /**
     * An account with the requested name was already present. Not an error.
     *
     * @param distinguishedName DN of the existing object, null if it could not be determined
     */
    record AlreadyExists(
        String accountName,
        String distinguishedName,
        Instant timestamp
    ) implements ProvisioningResult {
        @Override
        public String status() {
            return "AlreadyExists";
        }
    }

    /**
     * The invocation stopped at a failing step.
     */
    record Failed(
        String accountName,
        ErrorKind errorKind,
        String errorMessage,
        Instant timestamp
    ) implements ProvisioningResult {
        @Override
        public String status() {
            return "Failed";
        }
    }

    static Failed failed(String accountName, ErrorKind kind, String message) {
        return new Failed(accountName, kind, message, Instant.now());
    }
}
