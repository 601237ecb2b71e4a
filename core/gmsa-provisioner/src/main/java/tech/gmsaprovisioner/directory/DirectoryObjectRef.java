package tech.gmsaprovisioner.directory;

import java.time.Instant;

/**
 * Directory-native identifiers of an account object, as read back from the directory.
 *
 * @param distinguishedName Full DN of the object
 * @param samAccountName    sAMAccountName (with trailing $ for gMSAs)
 * @param objectGuid        objectGUID in registry format, empty if the directory returned none
 * @param dnsHostName       dNSHostName attribute, may be null
 * @param created           whenCreated, may be null if the directory returned none
 */
public record DirectoryObjectRef(
    String distinguishedName,
    String samAccountName,
    String objectGuid,
    String dnsHostName,
    Instant created
) {}
