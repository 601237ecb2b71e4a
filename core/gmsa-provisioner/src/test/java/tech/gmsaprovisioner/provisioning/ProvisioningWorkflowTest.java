package tech.gmsaprovisioner.provisioning;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.gmsaprovisioner.common.CancellationSignal;
import tech.gmsaprovisioner.common.ExecutionContext;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.credential.CredentialBroker;
import tech.gmsaprovisioner.credential.DirectoryCredential;
import tech.gmsaprovisioner.directory.CreationParameters;
import tech.gmsaprovisioner.directory.DirectoryClient;
import tech.gmsaprovisioner.directory.DirectoryObjectRef;
import tech.gmsaprovisioner.directory.RootKeyPolicy;
import tech.gmsaprovisioner.directory.RootKeyState;
import tech.gmsaprovisioner.testing.TestProvisioningConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProvisioningWorkflow with mocked collaborators.
 */
@ExtendWith(MockitoExtension.class)
class ProvisioningWorkflowTest {

    private static final String ACCOUNT = "gmsa-app-service";
    private static final String HOST = "appserver.contoso.com";
    private static final String DN = "CN=gmsa-app-service,CN=Managed Service Accounts,DC=contoso,DC=com";

    @Mock
    private CredentialBroker credentialBroker;

    @Mock
    private DirectoryClient directoryClient;

    private ProvisioningWorkflow workflow;
    private DirectoryCredential credential;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        IdempotencyGuard guard = new IdempotencyGuard();
        guard.directoryClient = directoryClient;

        workflow = new ProvisioningWorkflow();
        workflow.credentialBroker = credentialBroker;
        workflow.directoryClient = directoryClient;
        workflow.idempotencyGuard = guard;
        workflow.config = TestProvisioningConfig.deferred();

        credential = DirectoryCredential.builder().username("CONTOSO\\svc-provisioner").password("secret").build();
        context = ExecutionContext.create();
    }

    // ========================================
    // VALIDATION
    // ========================================

    @Test
    @DisplayName("execute should fail with ValidationError and make no remote calls when AccountName is missing")
    void execute_shouldFailValidation_whenAccountNameMissing() {
        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(null, HOST), context);

        assertThat(result).isInstanceOf(ProvisioningResult.Failed.class);
        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(((ProvisioningResult.Failed) result).errorMessage()).contains("AccountName");
        verifyNoInteractions(credentialBroker, directoryClient);
    }

    @Test
    @DisplayName("execute should fail with ValidationError and make no remote calls when DnsHostName is blank")
    void execute_shouldFailValidation_whenDnsHostNameBlank() {
        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, "   "), context);

        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(result.accountName()).isEqualTo(ACCOUNT);
        verifyNoInteractions(credentialBroker, directoryClient);
    }

    @Test
    @DisplayName("execute should reject account names with directory-reserved characters")
    void execute_shouldFailValidation_whenAccountNameHasReservedCharacters() {
        ProvisioningResult result = workflow.execute(ProvisioningRequest.of("gmsa,app", HOST), context);

        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        verifyNoInteractions(credentialBroker, directoryClient);
    }

    @Test
    @DisplayName("execute should reject an account name with more than one trailing $ before any remote call")
    void execute_shouldFailValidation_whenAccountNameHasDoubleDollar() {
        ProvisioningResult result = workflow.execute(ProvisioningRequest.of("svc$$", HOST), context);

        assertThat(((ProvisioningResult.Failed) result).errorKind())
            .isEqualTo(ProvisioningStep.VALIDATE.defaultKind())
            .isEqualTo(ErrorKind.VALIDATION_ERROR);
        verifyNoInteractions(credentialBroker, directoryClient);
    }

    // ========================================
    // HAPPY PATH
    // ========================================

    @Test
    @DisplayName("execute should check existence, ensure root key, create and verify in that order")
    void execute_shouldRunStepsInOrder_whenAccountAbsent() {
        Instant created = Instant.parse("2026-10-18T09:15:00Z");
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT)).thenReturn(Optional.empty());
        when(directoryClient.ensureRootKey(eq(credential), eq(RootKeyPolicy.DEFERRED), any(Duration.class), isNull()))
            .thenReturn(RootKeyState.existing("key-1", Instant.now().minusSeconds(3600)));
        when(directoryClient.createAccount(eq(credential), any(CreationParameters.class)))
            .thenReturn(new DirectoryObjectRef(DN, ACCOUNT + "$", "", HOST, null));
        when(directoryClient.verifyAccount(credential, ACCOUNT))
            .thenReturn(new DirectoryObjectRef(DN, ACCOUNT + "$", "5f1c2e4a-0d7b-4c11-9a43-2b6f8e9d0c11", HOST, created));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(result).isInstanceOf(ProvisioningResult.Success.class);
        ProvisioningResult.Success success = (ProvisioningResult.Success) result;
        assertThat(success.distinguishedName()).isEqualTo(DN);
        assertThat(success.samAccountName()).isEqualTo("gmsa-app-service$");
        assertThat(success.objectId()).isEqualTo("5f1c2e4a-0d7b-4c11-9a43-2b6f8e9d0c11");
        assertThat(success.createdAt()).isEqualTo(created);
        assertThat(success.dnsHostName()).isEqualTo(HOST);

        InOrder inOrder = inOrder(credentialBroker, directoryClient);
        inOrder.verify(credentialBroker).fetchDirectoryCredential();
        inOrder.verify(directoryClient).findAccount(credential, ACCOUNT);
        inOrder.verify(directoryClient).ensureRootKey(eq(credential), any(), any(), isNull());
        inOrder.verify(directoryClient).createAccount(eq(credential), any());
        inOrder.verify(directoryClient).verifyAccount(credential, ACCOUNT);
    }

    @Test
    @DisplayName("execute should fall back to the result timestamp when the directory returns no creation time")
    void execute_shouldUseTimestamp_whenCreatedMissing() {
        stubUpToCreate();
        when(directoryClient.verifyAccount(credential, ACCOUNT))
            .thenReturn(new DirectoryObjectRef(DN, ACCOUNT + "$", "", HOST, null));

        ProvisioningResult.Success success =
            (ProvisioningResult.Success) workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(success.createdAt()).isEqualTo(success.timestamp());
    }

    @Test
    @DisplayName("execute should pass only supplied optional parameters to the directory")
    void execute_shouldOmitAbsentOptionalParameters() {
        stubUpToCreate();
        when(directoryClient.verifyAccount(credential, ACCOUNT))
            .thenReturn(new DirectoryObjectRef(DN, ACCOUNT + "$", "", HOST, null));
        ProvisioningRequest request = new ProvisioningRequest(ACCOUNT, HOST, List.of("APPSERVERS", " "),
            "", List.of("HTTP/appserver.contoso.com"), null, null);

        workflow.execute(request, context);

        ArgumentCaptor<CreationParameters> captor = ArgumentCaptor.forClass(CreationParameters.class);
        verify(directoryClient).createAccount(eq(credential), captor.capture());
        CreationParameters parameters = captor.getValue();
        assertThat(parameters.description()).isEmpty();
        assertThat(parameters.principalsAllowedToRetrieve()).containsExactly("APPSERVERS");
        assertThat(parameters.names())
            .contains(CreationParameters.SERVICE_PRINCIPAL_NAMES, CreationParameters.PRINCIPALS_ALLOWED)
            .doesNotContain(CreationParameters.DESCRIPTION, CreationParameters.PATH);
    }

    // ========================================
    // IDEMPOTENCY
    // ========================================

    @Test
    @DisplayName("execute should return AlreadyExists without touching the root key when the account exists")
    void execute_shouldReturnAlreadyExists_whenAccountExists() {
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT))
            .thenReturn(Optional.of(new DirectoryObjectRef(DN, ACCOUNT + "$", "guid", HOST, Instant.now())));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(result).isInstanceOf(ProvisioningResult.AlreadyExists.class);
        assertThat(((ProvisioningResult.AlreadyExists) result).distinguishedName()).isEqualTo(DN);
        verify(directoryClient, never()).ensureRootKey(any(), any(), any(), any());
        verify(directoryClient, never()).createAccount(any(), any());
    }

    @Test
    @DisplayName("execute should reclassify a creation conflict as AlreadyExists")
    void execute_shouldReturnAlreadyExists_whenCreationRaces() {
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(new DirectoryObjectRef(DN, ACCOUNT + "$", "guid", HOST, Instant.now())));
        when(directoryClient.ensureRootKey(any(), any(), any(), any()))
            .thenReturn(RootKeyState.existing("key-1", Instant.now().minusSeconds(60)));
        when(directoryClient.createAccount(eq(credential), any()))
            .thenThrow(new ProvisioningException(ErrorKind.ALREADY_EXISTS, "entry already exists"));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(result).isInstanceOf(ProvisioningResult.AlreadyExists.class);
        assertThat(((ProvisioningResult.AlreadyExists) result).distinguishedName()).isEqualTo(DN);
        verify(directoryClient, never()).verifyAccount(any(), any());
    }

    @Test
    @DisplayName("execute should still report AlreadyExists when the conflicting account cannot be read")
    void execute_shouldReturnAlreadyExistsWithoutDn_whenConflictLookupFails() {
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT))
            .thenReturn(Optional.empty())
            .thenThrow(new ProvisioningException(ErrorKind.DIRECTORY_UNREACHABLE, "connection reset"));
        when(directoryClient.ensureRootKey(any(), any(), any(), any()))
            .thenReturn(RootKeyState.existing("key-1", Instant.now().minusSeconds(60)));
        when(directoryClient.createAccount(eq(credential), any()))
            .thenThrow(new ProvisioningException(ErrorKind.ALREADY_EXISTS, "entry already exists"));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(result).isInstanceOf(ProvisioningResult.AlreadyExists.class);
        assertThat(((ProvisioningResult.AlreadyExists) result).distinguishedName()).isNull();
    }

    // ========================================
    // ROOT KEY
    // ========================================

    @Test
    @DisplayName("execute should fail with RootKeyPending and not create when the key is not yet effective")
    void execute_shouldFailRootKeyPending_whenDeferredKeyNotEffective() {
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT)).thenReturn(Optional.empty());
        when(directoryClient.ensureRootKey(any(), eq(RootKeyPolicy.DEFERRED), any(), any()))
            .thenReturn(RootKeyState.created("key-2", Instant.now().plus(Duration.ofHours(10))));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.ROOT_KEY_PENDING);
        assertThat(((ProvisioningResult.Failed) result).errorMessage()).contains("key-2");
        verify(directoryClient, never()).createAccount(any(), any());
    }

    @Test
    @DisplayName("execute should proceed under IMMEDIATE even if an existing key is not yet effective")
    void execute_shouldProceed_whenImmediatePolicyAndPendingKey() {
        workflow.config = TestProvisioningConfig.immediate();
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT)).thenReturn(Optional.empty());
        when(directoryClient.ensureRootKey(any(), eq(RootKeyPolicy.IMMEDIATE), any(), any()))
            .thenReturn(RootKeyState.existing("key-3", Instant.now().plus(Duration.ofHours(2))));
        when(directoryClient.createAccount(eq(credential), any()))
            .thenReturn(new DirectoryObjectRef(DN, ACCOUNT + "$", "", HOST, null));
        when(directoryClient.verifyAccount(credential, ACCOUNT))
            .thenReturn(new DirectoryObjectRef(DN, ACCOUNT + "$", "", HOST, null));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(result).isInstanceOf(ProvisioningResult.Success.class);
    }

    @Test
    @DisplayName("execute should pass the requested root key id through without braces")
    void execute_shouldPassRequestedRootKeyId() {
        stubUpToCreate();
        when(directoryClient.verifyAccount(credential, ACCOUNT))
            .thenReturn(new DirectoryObjectRef(DN, ACCOUNT + "$", "", HOST, null));
        ProvisioningRequest request = new ProvisioningRequest(ACCOUNT, HOST, null, null, null, null,
            "{a1b2c3d4-0000-4000-8000-123456789abc}");

        workflow.execute(request, context);

        verify(directoryClient).ensureRootKey(eq(credential), any(), any(), eq("a1b2c3d4-0000-4000-8000-123456789abc"));
    }

    // ========================================
    // FAILURES
    // ========================================

    @Test
    @DisplayName("execute should fail with CredentialUnavailable and not contact the directory")
    void execute_shouldFail_whenCredentialUnavailable() {
        when(credentialBroker.fetchDirectoryCredential())
            .thenThrow(new ProvisioningException(ErrorKind.CREDENTIAL_UNAVAILABLE, "Secret DomainAdminPassword unavailable"));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.CREDENTIAL_UNAVAILABLE);
        verifyNoInteractions(directoryClient);
    }

    @Test
    @DisplayName("execute should report VerificationFailed when the created account cannot be read back")
    void execute_shouldFailVerification_whenReadBackMisses() {
        stubUpToCreate();
        when(directoryClient.verifyAccount(credential, ACCOUNT))
            .thenThrow(new ProvisioningException(ErrorKind.VERIFICATION_FAILED, "Account not found after creation"));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.VERIFICATION_FAILED);
    }

    @Test
    @DisplayName("execute should report PermissionDenied from account creation")
    void execute_shouldFailPermissionDenied_whenDirectoryRefusesCreate() {
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT)).thenReturn(Optional.empty());
        when(directoryClient.ensureRootKey(any(), any(), any(), any()))
            .thenReturn(RootKeyState.existing("key-1", Instant.now().minusSeconds(60)));
        when(directoryClient.createAccount(eq(credential), any()))
            .thenThrow(new ProvisioningException(ErrorKind.PERMISSION_DENIED, "insufficient access rights"));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.PERMISSION_DENIED);
        assertThat(((ProvisioningResult.Failed) result).errorMessage()).isEqualTo("insufficient access rights");
        verify(directoryClient, never()).verifyAccount(any(), any());
    }

    @Test
    @DisplayName("execute should map an unexpected runtime error to the failing step's kind")
    void execute_shouldUseStepDefaultKind_whenUnexpectedException() {
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT)).thenThrow(new IllegalStateException("socket closed"));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), context);

        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.DIRECTORY_UNREACHABLE);
        assertThat(((ProvisioningResult.Failed) result).errorMessage()).isEqualTo("socket closed");
    }

    // ========================================
    // CANCELLATION
    // ========================================

    @Test
    @DisplayName("execute should stop with Cancelled before any remote call when already cancelled")
    void execute_shouldCancel_whenCancelledBeforeStart() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();
        ExecutionContext cancelled = new ExecutionContext("inv-1", "corr-1", Instant.now(), signal);

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), cancelled);

        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.CANCELLED);
        verifyNoInteractions(credentialBroker, directoryClient);
    }

    @Test
    @DisplayName("execute should not create when cancelled during the root key check")
    void execute_shouldNotCreate_whenCancelledBeforeCreate() {
        CancellationSignal signal = CancellationSignal.create();
        ExecutionContext ctx = new ExecutionContext("inv-2", "corr-2", Instant.now(), signal);
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT)).thenReturn(Optional.empty());
        when(directoryClient.ensureRootKey(any(), any(), any(), any())).thenAnswer(invocation -> {
            signal.cancel();
            return RootKeyState.existing("key-1", Instant.now().minusSeconds(60));
        });

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), ctx);

        assertThat(((ProvisioningResult.Failed) result).errorKind()).isEqualTo(ErrorKind.CANCELLED);
        verify(directoryClient, never()).createAccount(any(), any());
    }

    @Test
    @DisplayName("execute should still verify when cancelled after the create was issued")
    void execute_shouldVerify_whenCancelledAfterCreate() {
        CancellationSignal signal = CancellationSignal.create();
        ExecutionContext ctx = new ExecutionContext("inv-3", "corr-3", Instant.now(), signal);
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT)).thenReturn(Optional.empty());
        when(directoryClient.ensureRootKey(any(), any(), any(), any()))
            .thenReturn(RootKeyState.existing("key-1", Instant.now().minusSeconds(60)));
        when(directoryClient.createAccount(eq(credential), any())).thenAnswer(invocation -> {
            signal.cancel();
            return new DirectoryObjectRef(DN, ACCOUNT + "$", "", HOST, null);
        });
        when(directoryClient.verifyAccount(credential, ACCOUNT))
            .thenReturn(new DirectoryObjectRef(DN, ACCOUNT + "$", "guid", HOST, Instant.now()));

        ProvisioningResult result = workflow.execute(ProvisioningRequest.of(ACCOUNT, HOST), ctx);

        assertThat(result).isInstanceOf(ProvisioningResult.Success.class);
        verify(directoryClient).verifyAccount(credential, ACCOUNT);
    }

    private void stubUpToCreate() {
        when(credentialBroker.fetchDirectoryCredential()).thenReturn(credential);
        when(directoryClient.findAccount(credential, ACCOUNT)).thenReturn(Optional.empty());
        when(directoryClient.ensureRootKey(any(), any(), any(), any()))
            .thenReturn(RootKeyState.existing("key-1", Instant.now().minusSeconds(60)));
        when(directoryClient.createAccount(eq(credential), any()))
            .thenReturn(new DirectoryObjectRef(DN, ACCOUNT + "$", "", HOST, null));
    }
}
