package tech.gmsaprovisioner.security.secrets.providers;

import com.azure.core.credential.TokenCredential;
import com.azure.core.exception.ClientAuthenticationException;
import com.azure.core.exception.HttpResponseException;
import com.azure.core.exception.ResourceNotFoundException;
import com.azure.core.http.HttpClient;
import com.azure.core.http.policy.FixedDelayOptions;
import com.azure.core.http.policy.RetryOptions;
import com.azure.core.util.HttpClientOptions;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.security.keyvault.secrets.SecretAsyncClient;
import com.azure.security.keyvault.secrets.SecretClientBuilder;
import com.azure.security.keyvault.secrets.models.KeyVaultSecret;
import io.quarkus.arc.lookup.LookupIfProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import reactor.core.publisher.Mono;
import tech.gmsaprovisioner.config.SecretsConfig;
import tech.gmsaprovisioner.security.secrets.SecretProvider;
import tech.gmsaprovisioner.security.secrets.SecretResolutionException;
import tech.gmsaprovisioner.shared.Instrumented;

import java.time.Duration;

/**
 * Secret provider that uses Azure Key Vault.
 *
 * Reference format: akv://secret-name or akv://secret-name/version
 *
 * Configuration:
 * - Authenticates with the host's own identity via DefaultAzureCredential
 *   (system- or user-assigned managed identity, workload identity, env vars).
 *   No client secret is ever configured for the service itself.
 * - gmsa.secrets.key-vault.enabled: Must be true to enable this provider
 * - gmsa.secrets.key-vault.vault-url: Vault URI
 * - gmsa.secrets.timeout: Bound on one whole read, token acquisition included
 */
@ApplicationScoped
@LookupIfProperty(name = "gmsa.secrets.key-vault.enabled", stringValue = "true", lookupIfMissing = false)
@Instrumented(target = "key-vault")
public class AzureKeyVaultSecretProvider implements SecretProvider {

    private static final Logger LOG = Logger.getLogger(AzureKeyVaultSecretProvider.class);

    private static final String PREFIX = "akv://";

    @Inject
    SecretsConfig config;

    private volatile SecretAsyncClient client;

    @Override
    public String resolve(String reference) throws SecretResolutionException {
        if (!canHandle(reference)) {
            throw new SecretResolutionException("Invalid reference format for Azure Key Vault provider");
        }

        NameAndVersion parsed = parseReference(reference);

        Duration timeout = config.timeout();
        try {
            KeyVaultSecret secret = client().getSecret(parsed.name(), parsed.version())
                .timeout(timeout, Mono.error(() -> new SecretResolutionException(
                    "Timed out after " + timeout + " reading secret: " + parsed.name())))
                .block();
            if (secret == null || secret.getValue() == null || secret.getValue().isEmpty()) {
                throw new SecretResolutionException("Secret has no value: " + parsed.name());
            }
            return secret.getValue();
        } catch (SecretResolutionException e) {
            throw e;
        } catch (ResourceNotFoundException e) {
            throw new SecretResolutionException("Secret not found: " + parsed.name(), e);
        } catch (ClientAuthenticationException e) {
            throw new SecretResolutionException(
                "Managed identity could not authenticate to Key Vault: " + e.getMessage(), e);
        } catch (HttpResponseException e) {
            int status = e.getResponse() != null ? e.getResponse().getStatusCode() : -1;
            if (status == 401 || status == 403) {
                throw new SecretResolutionException("Access denied to secret: " + parsed.name(), e);
            }
            throw new SecretResolutionException(
                "Key Vault returned HTTP " + status + " for secret: " + parsed.name(), e);
        } catch (Exception e) {
            throw new SecretResolutionException("Failed to retrieve secret from Azure Key Vault: " + parsed.name(), e);
        }
    }

    @Override
    public boolean canHandle(String reference) {
        return reference != null && reference.startsWith(PREFIX);
    }

    @Override
    public String getType() {
        return "akv";
    }

    private SecretAsyncClient client() {
        SecretAsyncClient current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = buildClient();
                    client = current;
                }
            }
        }
        return current;
    }

    private SecretAsyncClient buildClient() {
        String vaultUrl = config.keyVault().vaultUrl()
            .filter(url -> !url.isBlank())
            .orElseThrow(() -> new SecretResolutionException(
                "gmsa.secrets.key-vault.vault-url is not configured"));

        Duration timeout = config.timeout();
        HttpClientOptions httpOptions = new HttpClientOptions()
            .setConnectTimeout(timeout)
            .setResponseTimeout(timeout)
            .setReadTimeout(timeout);

        LOG.infof("Azure Key Vault secret provider initialized for %s", vaultUrl);

        // No retries: a failed read ends the invocation
        return new SecretClientBuilder()
            .vaultUrl(vaultUrl)
            .credential(credential())
            .httpClient(httpClient())
            .clientOptions(httpOptions)
            .retryOptions(new RetryOptions(new FixedDelayOptions(0, Duration.ofMillis(100))))
            .buildAsyncClient();
    }

    TokenCredential credential() {
        DefaultAzureCredentialBuilder credentialBuilder = new DefaultAzureCredentialBuilder();
        config.keyVault().managedIdentityClientId()
            .filter(id -> !id.isBlank())
            .ifPresent(credentialBuilder::managedIdentityClientId);
        return credentialBuilder.build();
    }

    /** Null selects the SDK's default transport. */
    HttpClient httpClient() {
        return null;
    }

    static NameAndVersion parseReference(String reference) {
        String nameAndVersion = reference.substring(PREFIX.length());

        int slashIndex = nameAndVersion.indexOf('/');
        if (slashIndex > 0) {
            return new NameAndVersion(
                nameAndVersion.substring(0, slashIndex),
                nameAndVersion.substring(slashIndex + 1)
            );
        }
        return new NameAndVersion(nameAndVersion, null);
    }

    record NameAndVersion(String name, String version) {}
}
