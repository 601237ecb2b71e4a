package tech.gmsaprovisioner.common.errors;

/**
 * Classification of provisioning failures.
 *
 * Each kind carries the name it is reported under in the webhook response
 * ({@code "Error"} field) and the HTTP status the gateway answers with.
 */
public enum ErrorKind {

    /**
     * Missing or blank required field. Never contacts remote services.
     * Maps to HTTP 400 Bad Request.
     */
    VALIDATION_ERROR("ValidationError", 400),

    /**
     * Request body is not parseable JSON.
     * Maps to HTTP 400 Bad Request.
     */
    MALFORMED_PAYLOAD("MalformedPayload", 400),

    /**
     * Shared webhook token missing or mismatched.
     * Maps to HTTP 401 Unauthorized.
     */
    UNAUTHORIZED("Unauthorized", 401),

    /**
     * Secret store unreachable, access denied, or secrets missing.
     * Maps to HTTP 503 Service Unavailable.
     */
    CREDENTIAL_UNAVAILABLE("CredentialUnavailable", 503),

    /**
     * Network or bind failure talking to the directory.
     * Maps to HTTP 503 Service Unavailable.
     */
    DIRECTORY_UNREACHABLE("DirectoryUnreachable", 503),

    /**
     * Directory-native duplicate. Reclassified by the workflow into an
     * AlreadyExists result, so it never surfaces as a failure.
     */
    ALREADY_EXISTS("AlreadyExists", 200),

    /**
     * Directory rejected the operation due to insufficient rights.
     * Maps to HTTP 403 Forbidden.
     */
    PERMISSION_DENIED("PermissionDenied", 403),

    /**
     * Directory rejected the creation parameters.
     * Maps to HTTP 400 Bad Request.
     */
    INVALID_PARAMETER("InvalidParameter", 400),

    /**
     * Post-create read-back did not find the object.
     * Maps to HTTP 500 Internal Server Error.
     */
    VERIFICATION_FAILED("VerificationFailed", 500),

    /**
     * KDS root key exists but is not yet effective under the deferred policy.
     * Maps to HTTP 503 Service Unavailable with Retry-After.
     */
    ROOT_KEY_PENDING("RootKeyPending", 503),

    /**
     * Caller withdrew before the mutating step.
     * Maps to HTTP 499 (client closed request).
     */
    CANCELLED("Cancelled", 499);

    private final String wireName;
    private final int httpStatus;

    ErrorKind(String wireName, int httpStatus) {
        this.wireName = wireName;
        this.httpStatus = httpStatus;
    }

    public String wireName() {
        return wireName;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
