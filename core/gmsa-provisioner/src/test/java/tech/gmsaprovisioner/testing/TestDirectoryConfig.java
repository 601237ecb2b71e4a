package tech.gmsaprovisioner.testing;

import tech.gmsaprovisioner.config.DirectoryConfig;

import java.time.Duration;
import java.util.Optional;

/**
 * Plain {@link DirectoryConfig} for tests that wire beans by hand.
 */
public record TestDirectoryConfig(
    String server,
    int port,
    Security security,
    Optional<String> baseDn,
    Optional<String> configurationDn,
    String defaultContainer,
    Optional<String> kdsDomainId,
    Duration connectTimeout,
    Duration responseTimeout,
    int managedPasswordIntervalDays,
    Optional<Integer> kerberosEncryptionTypes
) implements DirectoryConfig {

    public static TestDirectoryConfig inMemory(int port) {
        return new TestDirectoryConfig(
            "localhost",
            port,
            Security.NONE,
            Optional.of(InMemoryActiveDirectory.BASE_DN),
            Optional.of(InMemoryActiveDirectory.CONFIGURATION_DN),
            "CN=Managed Service Accounts",
            Optional.empty(),
            Duration.ofSeconds(2),
            Duration.ofSeconds(5),
            30,
            Optional.empty()
        );
    }

    public TestDirectoryConfig withEncryptionTypes(int types) {
        return new TestDirectoryConfig(server, port, security, baseDn, configurationDn, defaultContainer,
            kdsDomainId, connectTimeout, responseTimeout, managedPasswordIntervalDays, Optional.of(types));
    }
}
