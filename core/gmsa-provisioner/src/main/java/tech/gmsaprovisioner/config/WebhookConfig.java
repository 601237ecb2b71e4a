package tech.gmsaprovisioner.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Inbound webhook settings.
 */
@ConfigMapping(prefix = "gmsa.webhook")
public interface WebhookConfig {

    /**
     * Reference of the shared validation token secret (e.g. akv://WebhookToken).
     * Token checking is off when unset.
     */
    Optional<String> tokenSecret();

    @WithDefault("X-Webhook-Token")
    String tokenHeader();

    default boolean isTokenRequired() {
        return tokenSecret().filter(s -> !s.isBlank()).isPresent();
    }
}
