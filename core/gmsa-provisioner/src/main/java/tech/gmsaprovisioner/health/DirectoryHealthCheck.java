package tech.gmsaprovisioner.health;

import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.RootDSE;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import tech.gmsaprovisioner.config.DirectoryConfig;
import tech.gmsaprovisioner.directory.ldap.LdapConnectionFactory;

/**
 * Readiness check for the domain controller.
 * Reads the RootDSE over an unauthenticated connection, so the check never
 * touches the admin credential.
 */
@ApplicationScoped
@Readiness
public class DirectoryHealthCheck implements HealthCheck {

    @Inject
    LdapConnectionFactory connectionFactory;

    @Inject
    DirectoryConfig config;

    @Override
    public HealthCheckResponse call() {
        String target = config.server() + ":" + config.port();
        try (LDAPConnection connection = connectionFactory.openAnonymous()) {
            RootDSE rootDse = connection.getRootDSE();
            return HealthCheckResponse.builder()
                .name("Directory")
                .up()
                .withData("server", target)
                .withData("security", config.security().name())
                .withData("vendor", rootDse != null && rootDse.getVendorName() != null ? rootDse.getVendorName() : "unknown")
                .build();
        } catch (LDAPException e) {
            return HealthCheckResponse.builder()
                .name("Directory")
                .down()
                .withData("server", target)
                .withData("reason", e.getResultCode().getName())
                .withData("message", e.getMessage())
                .build();
        }
    }
}
