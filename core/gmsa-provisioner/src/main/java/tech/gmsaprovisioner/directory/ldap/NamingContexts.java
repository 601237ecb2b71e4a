package tech.gmsaprovisioner.directory.ldap;

/**
 * Naming contexts of the connected domain.
 *
 * @param baseDn          default naming context
 * @param configurationDn configuration naming context
 */
record NamingContexts(String baseDn, String configurationDn) {}
