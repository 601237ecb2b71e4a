package tech.gmsaprovisioner.directory.ldap;

import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;

import static org.assertj.core.api.Assertions.*;

class LdapErrorClassifierTest {

    @Test
    @DisplayName("kindOf should map duplicate and access codes to their own kinds")
    void kindOf_shouldMapDuplicateAndAccess() {
        assertThat(LdapErrorClassifier.kindOf(ResultCode.ENTRY_ALREADY_EXISTS)).isEqualTo(ErrorKind.ALREADY_EXISTS);
        assertThat(LdapErrorClassifier.kindOf(ResultCode.INSUFFICIENT_ACCESS_RIGHTS)).isEqualTo(ErrorKind.PERMISSION_DENIED);
    }

    @Test
    @DisplayName("kindOf should map attribute and naming problems to InvalidParameter")
    void kindOf_shouldMapBadValuesToInvalidParameter() {
        assertThat(LdapErrorClassifier.kindOf(ResultCode.CONSTRAINT_VIOLATION)).isEqualTo(ErrorKind.INVALID_PARAMETER);
        assertThat(LdapErrorClassifier.kindOf(ResultCode.NO_SUCH_OBJECT)).isEqualTo(ErrorKind.INVALID_PARAMETER);
        assertThat(LdapErrorClassifier.kindOf(ResultCode.INVALID_DN_SYNTAX)).isEqualTo(ErrorKind.INVALID_PARAMETER);
        assertThat(LdapErrorClassifier.kindOf(ResultCode.UNWILLING_TO_PERFORM)).isEqualTo(ErrorKind.INVALID_PARAMETER);
        assertThat(LdapErrorClassifier.kindOf(ResultCode.OBJECT_CLASS_VIOLATION)).isEqualTo(ErrorKind.INVALID_PARAMETER);
    }

    @Test
    @DisplayName("kindOf should treat bind, connection and timeout failures as DirectoryUnreachable")
    void kindOf_shouldMapTransportFailuresToUnreachable() {
        assertThat(LdapErrorClassifier.kindOf(ResultCode.INVALID_CREDENTIALS)).isEqualTo(ErrorKind.DIRECTORY_UNREACHABLE);
        assertThat(LdapErrorClassifier.kindOf(ResultCode.SERVER_DOWN)).isEqualTo(ErrorKind.DIRECTORY_UNREACHABLE);
        assertThat(LdapErrorClassifier.kindOf(ResultCode.CONNECT_ERROR)).isEqualTo(ErrorKind.DIRECTORY_UNREACHABLE);
        assertThat(LdapErrorClassifier.kindOf(ResultCode.TIMEOUT)).isEqualTo(ErrorKind.DIRECTORY_UNREACHABLE);
        assertThat(LdapErrorClassifier.kindOf(ResultCode.BUSY)).isEqualTo(ErrorKind.DIRECTORY_UNREACHABLE);
    }

    @Test
    void classify_shouldKeepCauseAndName() {
        LDAPException cause = new LDAPException(ResultCode.ENTRY_ALREADY_EXISTS, "entry exists");

        ProvisioningException e = LdapErrorClassifier.classify("Account creation", cause);

        assertThat(e.kind()).isEqualTo(ErrorKind.ALREADY_EXISTS);
        assertThat(e.getMessage()).startsWith("Account creation failed (entry already exists)");
        assertThat(e.getCause()).isSameAs(cause);
    }
}
