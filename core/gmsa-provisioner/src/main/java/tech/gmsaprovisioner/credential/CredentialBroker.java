package tech.gmsaprovisioner.credential;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.config.SecretsConfig;
import tech.gmsaprovisioner.config.WebhookConfig;
import tech.gmsaprovisioner.security.secrets.SecretResolutionException;
import tech.gmsaprovisioner.security.secrets.SecretService;

import java.util.Optional;

/**
 * Obtains the directory admin credential from the secret store.
 *
 * <p>The secret store is reached with the host's own identity, so no secret
 * material is embedded in configuration or supplied by the webhook caller.
 * Each call re-fetches both secrets; nothing is cached across invocations.
 * A failure is terminal for the invocation.
 */
@ApplicationScoped
public class CredentialBroker {

    private static final Logger LOG = Logger.getLogger(CredentialBroker.class);

    @Inject
    SecretService secretService;

    @Inject
    SecretsConfig secretsConfig;

    @Inject
    WebhookConfig webhookConfig;

    /**
     * Fetch the username and password secrets and combine them into one credential.
     *
     * @throws ProvisioningException with {@link ErrorKind#CREDENTIAL_UNAVAILABLE}
     *         if either secret is missing, the store is unreachable, or access is denied
     */
    public DirectoryCredential fetchDirectoryCredential() {
        String username = fetch(secretsConfig.usernameReference(), "DomainAdminUsername");
        String password = fetch(secretsConfig.passwordReference(), "DomainAdminPassword");

        LOG.debugf("Directory credential fetched for %s", username);
        return DirectoryCredential.builder()
            .username(username)
            .password(password)
            .build();
    }

    /**
     * Fetch the shared webhook validation token, if token checking is configured.
     *
     * @return the expected token, or empty when no token secret is configured
     * @throws ProvisioningException with {@link ErrorKind#CREDENTIAL_UNAVAILABLE}
     *         if the token secret is configured but cannot be read
     */
    public Optional<String> fetchWebhookToken() {
        if (!webhookConfig.isTokenRequired()) {
            return Optional.empty();
        }
        return Optional.of(fetch(webhookConfig.tokenSecret().get(), "WebhookToken"));
    }

    private String fetch(String reference, String secretName) {
        try {
            String value = secretService.resolve(reference);
            if (value == null || value.isBlank()) {
                throw new ProvisioningException(ErrorKind.CREDENTIAL_UNAVAILABLE,
                    "Secret " + secretName + " is empty");
            }
            return value;
        } catch (SecretResolutionException e) {
            LOG.warnf("Secret %s could not be resolved: %s", secretName, e.getMessage());
            throw new ProvisioningException(ErrorKind.CREDENTIAL_UNAVAILABLE,
                "Secret " + secretName + " unavailable: " + e.getMessage(), e);
        }
    }
}
