package tech.gmsaprovisioner.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Secret references for the directory credential and the secret store connection.
 *
 * Reference formats:
 * - akv://secret-name[/version] - Azure Key Vault
 */
@ConfigMapping(prefix = "gmsa.secrets")
public interface SecretsConfig {

    @WithDefault("akv://DomainAdminUsername")
    String usernameReference();

    @WithDefault("akv://DomainAdminPassword")
    String passwordReference();

    /**
     * Upper bound for a single secret read.
     */
    @WithDefault("PT30S")
    Duration timeout();

    KeyVault keyVault();

    interface KeyVault {

        @WithDefault("false")
        boolean enabled();

        /**
         * Vault URI, e.g. https://my-vault.vault.azure.net
         */
        Optional<String> vaultUrl();

        /**
         * Client ID of a user-assigned managed identity. The system-assigned
         * identity (or AZURE_CLIENT_ID) is used when unset.
         */
        Optional<String> managedIdentityClientId();
    }
}
