package tech.gmsaprovisioner.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import tech.gmsaprovisioner.directory.RootKeyPolicy;

import java.time.Duration;

/**
 * Workflow policy settings.
 */
@ConfigMapping(prefix = "gmsa.provisioning")
public interface ProvisioningConfig {

    /**
     * How a missing KDS root key is bootstrapped. IMMEDIATE back-dates the key
     * and is meant for lab domains only.
     */
    @WithDefault("DEFERRED")
    RootKeyPolicy rootKeyPolicy();

    /**
     * Replication window a new root key needs before it can derive passwords.
     */
    @WithDefault("PT10H")
    Duration rootKeyPropagation();

    /**
     * Wait between account creation and the verifying read-back.
     */
    @WithDefault("PT5S")
    Duration verifySettleDelay();
}
