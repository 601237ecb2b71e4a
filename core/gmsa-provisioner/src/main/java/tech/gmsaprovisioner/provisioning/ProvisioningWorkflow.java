package tech.gmsaprovisioner.provisioning;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import tech.gmsaprovisioner.common.ExecutionContext;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.config.ProvisioningConfig;
import tech.gmsaprovisioner.credential.CredentialBroker;
import tech.gmsaprovisioner.credential.DirectoryCredential;
import tech.gmsaprovisioner.directory.CreationParameters;
import tech.gmsaprovisioner.directory.DirectoryClient;
import tech.gmsaprovisioner.directory.DirectoryObjectRef;
import tech.gmsaprovisioner.directory.RootKeyPolicy;
import tech.gmsaprovisioner.directory.RootKeyState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Create-if-absent provisioning of one gMSA.
 *
 * <p>Steps: validate, fetch credential, check existence, ensure the KDS root
 * key, create, verify. The first failing step ends the invocation with a
 * {@link ProvisioningResult.Failed} carrying that step's error kind. Nothing
 * is retried and nothing is rolled back.
 *
 * <p>Cancellation is checked before every step up to and including the
 * creation. Once the creation has been issued, verification always runs so
 * the caller learns what happened to the mutation.
 */
@ApplicationScoped
public class ProvisioningWorkflow {

    private static final Logger LOG = Logger.getLogger(ProvisioningWorkflow.class);

    static final String MDC_CORRELATION_ID = "correlationId";
    static final String MDC_INVOCATION_ID = "invocationId";
    static final String MDC_ACCOUNT_NAME = "accountName";

    @Inject
    CredentialBroker credentialBroker;

    @Inject
    IdempotencyGuard idempotencyGuard;

    @Inject
    DirectoryClient directoryClient;

    @Inject
    ProvisioningConfig config;

    public ProvisioningResult execute(ProvisioningRequest request, ExecutionContext context) {
        MDC.put(MDC_CORRELATION_ID, context.correlationId());
        MDC.put(MDC_INVOCATION_ID, context.invocationId());
        if (request != null && request.accountName() != null) {
            MDC.put(MDC_ACCOUNT_NAME, request.accountName().trim());
        }
        try {
            return run(request, context);
        } finally {
            MDC.remove(MDC_ACCOUNT_NAME);
            MDC.remove(MDC_INVOCATION_ID);
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private ProvisioningResult run(ProvisioningRequest request, ExecutionContext context) {
        List<String> violations = ProvisioningRequestValidator.validate(request);
        if (!violations.isEmpty()) {
            String accountName = request != null ? request.accountName() : null;
            LOG.warnf("Request rejected at %s: %s", ProvisioningStep.VALIDATE, violations);
            return ProvisioningResult.failed(accountName, ProvisioningStep.VALIDATE.defaultKind(),
                String.join("; ", violations));
        }

        CreationParameters parameters = request.toCreationParameters();
        String accountName = parameters.accountName();

        try {
            checkNotCancelled(context, ProvisioningStep.CREDENTIAL_FETCH);
            DirectoryCredential credential = step(ProvisioningStep.CREDENTIAL_FETCH,
                credentialBroker::fetchDirectoryCredential);

            checkNotCancelled(context, ProvisioningStep.EXISTENCE_CHECK);
            Optional<DirectoryObjectRef> existing = step(ProvisioningStep.EXISTENCE_CHECK,
                () -> idempotencyGuard.findExisting(accountName, credential));
            if (existing.isPresent()) {
                return new ProvisioningResult.AlreadyExists(accountName,
                    existing.get().distinguishedName(), Instant.now());
            }

            checkNotCancelled(context, ProvisioningStep.ROOT_KEY_ENSURE);
            RootKeyState rootKey = step(ProvisioningStep.ROOT_KEY_ENSURE,
                () -> directoryClient.ensureRootKey(credential, config.rootKeyPolicy(),
                    config.rootKeyPropagation(), request.requestedRootKeyId()));
            Optional<ProvisioningResult> pending = checkRootKeyEffective(accountName, rootKey);
            if (pending.isPresent()) {
                return pending.get();
            }

            checkNotCancelled(context, ProvisioningStep.CREATE);
            LOG.infof("Creating gMSA %s with parameters %s", accountName, parameters.names());
            try {
                step(ProvisioningStep.CREATE, () -> directoryClient.createAccount(credential, parameters));
            } catch (ProvisioningException e) {
                if (!idempotencyGuard.isConflict(e)) {
                    throw e;
                }
                LOG.infof("Account %s was created concurrently: %s", accountName, e.getMessage());
                return new ProvisioningResult.AlreadyExists(accountName,
                    idempotencyGuard.resolveConflict(accountName, credential), Instant.now());
            }

            awaitSettle();

            DirectoryObjectRef verified = verify(credential, accountName);
            Instant timestamp = Instant.now();
            return new ProvisioningResult.Success(
                accountName,
                verified.dnsHostName() != null ? verified.dnsHostName() : parameters.dnsHostName(),
                verified.distinguishedName(),
                verified.samAccountName() != null ? verified.samAccountName() : parameters.samAccountName(),
                verified.objectGuid(),
                verified.created() != null ? verified.created() : timestamp,
                timestamp
            );
        } catch (ProvisioningException e) {
            LOG.warnf("Provisioning of %s failed: %s %s", accountName, e.kind().wireName(), e.getMessage());
            return ProvisioningResult.failed(accountName, e.kind(), e.getMessage());
        }
    }

    private Optional<ProvisioningResult> checkRootKeyEffective(String accountName, RootKeyState rootKey) {
        Instant now = Instant.now();
        if (rootKey.isEffectiveAt(now)) {
            return Optional.empty();
        }
        String message = "KDS root key " + rootKey.keyId() + " becomes effective at " + rootKey.effectiveTime();
        if (config.rootKeyPolicy() == RootKeyPolicy.DEFERRED) {
            LOG.infof("Deferring %s: %s", accountName, message);
            return Optional.of(ProvisioningResult.failed(accountName, ErrorKind.ROOT_KEY_PENDING, message));
        }
        LOG.warnf("Proceeding with %s although %s", accountName, message);
        return Optional.empty();
    }

    private DirectoryObjectRef verify(DirectoryCredential credential, String accountName) {
        try {
            return step(ProvisioningStep.VERIFY, () -> directoryClient.verifyAccount(credential, accountName));
        } catch (ProvisioningException e) {
            if (e.kind() == ErrorKind.VERIFICATION_FAILED) {
                throw e;
            }
            throw new ProvisioningException(ErrorKind.VERIFICATION_FAILED, e.getMessage(), e);
        }
    }

    private void awaitSettle() {
        Duration delay = config.verifySettleDelay();
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Settle delay interrupted, verifying immediately");
        }
    }

    private void checkNotCancelled(ExecutionContext context, ProvisioningStep next) {
        if (context.isCancelled()) {
            throw new ProvisioningException(ErrorKind.CANCELLED,
                "Invocation cancelled before " + next.name().toLowerCase().replace('_', ' '));
        }
    }

    private static <T> T step(ProvisioningStep step, Supplier<T> action) {
        try {
            return action.get();
        } catch (ProvisioningException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure in step %s", step);
            throw new ProvisioningException(step.defaultKind(),
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
    }
}
