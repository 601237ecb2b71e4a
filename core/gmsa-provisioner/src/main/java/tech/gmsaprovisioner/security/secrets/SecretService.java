package tech.gmsaprovisioner.security.secrets;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gmsaprovisioner.config.SecretsConfig;
import tech.gmsaprovisioner.config.WebhookConfig;

import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Routes a secret reference to the provider that owns its scheme.
 *
 * <p>Nothing is cached here. Every resolve reaches the backing store, so a
 * rotated password is picked up by the next invocation.
 */
@ApplicationScoped
public class SecretService {

    private static final Logger LOG = Logger.getLogger(SecretService.class);

    @Inject
    Instance<SecretProvider> providers;

    @Inject
    SecretsConfig secretsConfig;

    @Inject
    WebhookConfig webhookConfig;

    void checkReferences(@Observes StartupEvent event) {
        report("username", secretsConfig.usernameReference());
        report("password", secretsConfig.passwordReference());
        webhookConfig.tokenSecret().ifPresent(ref -> report("webhook token", ref));
    }

    /**
     * @throws SecretResolutionException if no enabled provider owns the
     *         reference, or the owning provider fails
     */
    public String resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new SecretResolutionException("Secret reference is blank");
        }
        SecretProvider provider = providerFor(reference).orElseThrow(() -> new SecretResolutionException(
            "No enabled secret provider for " + maskReference(reference)));
        LOG.debugf("Resolving %s via %s", maskReference(reference), provider.getType());
        return provider.resolve(reference);
    }

    Optional<SecretProvider> providerFor(String reference) {
        return StreamSupport.stream(providers.spliterator(), false)
            .filter(p -> p.canHandle(reference))
            .findFirst();
    }

    private void report(String label, String reference) {
        Optional<SecretProvider> provider = providerFor(reference);
        if (provider.isPresent()) {
            LOG.infof("Secret %s is read from %s (%s)", label, provider.get().getType(), maskReference(reference));
        } else {
            LOG.warnf("Secret %s reference %s has no enabled provider; provisioning will fail with CredentialUnavailable",
                label, maskReference(reference));
        }
    }

    /**
     * Scheme plus a hint of the name, enough to tell references apart in a log.
     */
    static String maskReference(String reference) {
        if (reference == null || reference.isEmpty()) {
            return "<none>";
        }
        int schemeEnd = reference.indexOf("://");
        if (schemeEnd > 0) {
            String name = reference.substring(schemeEnd + 3);
            return reference.substring(0, schemeEnd + 3) + (name.length() > 4 ? name.substring(0, 4) + "***" : "***");
        }
        int colon = reference.indexOf(':');
        return colon > 0 ? reference.substring(0, colon + 1) + "***" : "***";
    }
}
