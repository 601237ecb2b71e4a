package tech.gmsaprovisioner.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Connection and object defaults for the target directory.
 */
@ConfigMapping(prefix = "gmsa.directory")
public interface DirectoryConfig {

    /**
     * Host name of the domain controller.
     */
    String server();

    @WithDefault("636")
    int port();

    /**
     * Transport security: NONE, LDAPS or STARTTLS.
     */
    @WithDefault("LDAPS")
    Security security();

    /**
     * Default naming context (e.g. DC=contoso,DC=com).
     * Read from the RootDSE when not set.
     */
    Optional<String> baseDn();

    /**
     * Configuration naming context (e.g. CN=Configuration,DC=contoso,DC=com).
     * Read from the RootDSE when not set.
     */
    Optional<String> configurationDn();

    /**
     * Container for accounts whose request carries no organizational unit,
     * relative to the base DN.
     */
    @WithDefault("CN=Managed Service Accounts")
    String defaultContainer();

    /**
     * Value for msKds-DomainID on root keys this service creates. Defaults to the
     * computer object of the domain controller that serves the connection.
     */
    Optional<String> kdsDomainId();

    @WithDefault("PT30S")
    Duration connectTimeout();

    @WithDefault("PT30S")
    Duration responseTimeout();

    /**
     * Days between automatic password rotations (msDS-ManagedPasswordInterval).
     */
    @WithDefault("30")
    int managedPasswordIntervalDays();

    /**
     * Value for msDS-SupportedEncryptionTypes. Left to the directory default when unset.
     */
    Optional<Integer> kerberosEncryptionTypes();

    enum Security {
        NONE, LDAPS, STARTTLS
    }
}
