package tech.gmsaprovisioner.provisioning;

import tech.gmsaprovisioner.common.errors.ErrorKind;

/**
 * Steps of the provisioning workflow, in execution order.
 *
 * <p>Each step names the error kind reported when it fails with an exception
 * that carries no kind of its own.
 */
public enum ProvisioningStep {
    VALIDATE(ErrorKind.VALIDATION_ERROR),
    CREDENTIAL_FETCH(ErrorKind.CREDENTIAL_UNAVAILABLE),
    EXISTENCE_CHECK(ErrorKind.DIRECTORY_UNREACHABLE),
    ROOT_KEY_ENSURE(ErrorKind.DIRECTORY_UNREACHABLE),
    CREATE(ErrorKind.DIRECTORY_UNREACHABLE),
    VERIFY(ErrorKind.VERIFICATION_FAILED);

    private final ErrorKind defaultKind;

    ProvisioningStep(ErrorKind defaultKind) {
        this.defaultKind = defaultKind;
    }

    public ErrorKind defaultKind() {
        return defaultKind;
    }
}
