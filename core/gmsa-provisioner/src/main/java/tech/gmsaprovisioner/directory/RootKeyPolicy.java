package tech.gmsaprovisioner.directory;

/**
 * Policy for bootstrapping a missing KDS root key.
 */
public enum RootKeyPolicy {

    /**
     * Create the key with an effective time in the past so accounts can be
     * created right away. Lab and demo domains only.
     */
    IMMEDIATE,

    /**
     * Create the key with a future effective time and refuse to provision
     * until that time has passed.
     */
    DEFERRED
}
