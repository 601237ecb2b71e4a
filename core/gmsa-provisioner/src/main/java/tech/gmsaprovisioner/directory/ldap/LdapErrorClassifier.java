package tech.gmsaprovisioner.directory.ldap;

import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;

import java.util.Set;

/**
 * Maps LDAP result codes onto provisioning error kinds.
 *
 * <p>Anything not recognised as a duplicate, an access problem or a bad
 * attribute value is treated as the directory being unreachable, including
 * bind failures: the workflow cannot tell a rejected admin credential from an
 * unavailable domain controller, and both are retryable by the operator.
 */
final class LdapErrorClassifier {

    private static final Set<ResultCode> INVALID_PARAMETER_CODES = Set.of(
        ResultCode.UNDEFINED_ATTRIBUTE_TYPE,
        ResultCode.CONSTRAINT_VIOLATION,
        ResultCode.INVALID_ATTRIBUTE_SYNTAX,
        ResultCode.NO_SUCH_OBJECT,
        ResultCode.INVALID_DN_SYNTAX,
        ResultCode.UNWILLING_TO_PERFORM,
        ResultCode.NAMING_VIOLATION,
        ResultCode.OBJECT_CLASS_VIOLATION,
        ResultCode.ATTRIBUTE_OR_VALUE_EXISTS
    );

    private LdapErrorClassifier() {
    }

    static ErrorKind kindOf(ResultCode resultCode) {
        if (ResultCode.ENTRY_ALREADY_EXISTS.equals(resultCode)) {
            return ErrorKind.ALREADY_EXISTS;
        }
        if (ResultCode.INSUFFICIENT_ACCESS_RIGHTS.equals(resultCode)) {
            return ErrorKind.PERMISSION_DENIED;
        }
        if (INVALID_PARAMETER_CODES.contains(resultCode)) {
            return ErrorKind.INVALID_PARAMETER;
        }
        return ErrorKind.DIRECTORY_UNREACHABLE;
    }

    static ProvisioningException classify(String operation, LDAPException e) {
        ErrorKind kind = kindOf(e.getResultCode());
        String detail = e.getDiagnosticMessage() != null ? e.getDiagnosticMessage() : e.getMessage();
        return new ProvisioningException(kind,
            operation + " failed (" + e.getResultCode().getName() + "): " + detail, e);
    }
}
