package tech.gmsaprovisioner.common.errors;

import java.util.Objects;

/**
 * Exception thrown by the credential broker and directory client when a
 * remote step fails. The workflow converts it into a Failed result, so it
 * never reaches the webhook caller as a raw exception.
 */
public class ProvisioningException extends RuntimeException {

    private final ErrorKind kind;

    public ProvisioningException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ProvisioningException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
