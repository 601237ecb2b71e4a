package tech.gmsaprovisioner.directory.ldap;

import com.unboundid.ldap.sdk.Attribute;
import com.unboundid.ldap.sdk.DN;
import com.unboundid.ldap.sdk.Entry;
import com.unboundid.ldap.sdk.Filter;
import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.RDN;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchResult;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.config.DirectoryConfig;
import tech.gmsaprovisioner.credential.DirectoryCredential;
import tech.gmsaprovisioner.directory.CreationParameters;
import tech.gmsaprovisioner.directory.DirectoryClient;
import tech.gmsaprovisioner.directory.DirectoryObjectRef;
import tech.gmsaprovisioner.directory.RootKeyPolicy;
import tech.gmsaprovisioner.directory.RootKeyState;
import tech.gmsaprovisioner.shared.Instrumented;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * {@link DirectoryClient} for Active Directory over LDAP.
 */
@ApplicationScoped
@Instrumented(target = "directory")
public class LdapDirectoryClient implements DirectoryClient {

    private static final Logger LOG = Logger.getLogger(LdapDirectoryClient.class);

    static final String GMSA_OBJECT_CLASS = "msDS-GroupManagedServiceAccount";
    static final String ATTR_SAM_ACCOUNT_NAME = "sAMAccountName";
    static final String ATTR_OBJECT_GUID = "objectGUID";
    static final String ATTR_OBJECT_SID = "objectSid";
    static final String ATTR_DNS_HOST_NAME = "dNSHostName";
    static final String ATTR_WHEN_CREATED = "whenCreated";
    static final String ATTR_USER_ACCOUNT_CONTROL = "userAccountControl";
    static final String ATTR_PASSWORD_INTERVAL = "msDS-ManagedPasswordInterval";
    static final String ATTR_ENCRYPTION_TYPES = "msDS-SupportedEncryptionTypes";
    static final String ATTR_PASSWORD_READERS = "msDS-GroupMSAMembership";
    static final String ATTR_SERVICE_PRINCIPAL_NAME = "servicePrincipalName";
    static final String ATTR_DESCRIPTION = "description";

    /** WORKSTATION_TRUST_ACCOUNT */
    static final int GMSA_ACCOUNT_CONTROL = 0x1000;

    private static final String[] ACCOUNT_ATTRIBUTES = {
        ATTR_SAM_ACCOUNT_NAME, ATTR_OBJECT_GUID, ATTR_DNS_HOST_NAME, ATTR_WHEN_CREATED
    };

    @Inject
    LdapConnectionFactory connectionFactory;

    @Inject
    DirectoryConfig config;

    @Override
    public Optional<DirectoryObjectRef> findAccount(DirectoryCredential credential, String accountName) {
        try (LDAPConnection connection = connectionFactory.open(credential)) {
            NamingContexts contexts = connectionFactory.namingContexts(connection);
            return searchAccount(connection, contexts.baseDn(), samAccountName(accountName));
        } catch (LDAPException e) {
            throw LdapErrorClassifier.classify("Account lookup", e);
        }
    }

    @Override
    public RootKeyState ensureRootKey(DirectoryCredential credential, RootKeyPolicy policy,
                                      Duration propagation, String requestedKeyId) {
        try (LDAPConnection connection = connectionFactory.open(credential)) {
            NamingContexts contexts = connectionFactory.namingContexts(connection);
            DN container = KdsRootKeyTemplate.containerDn(contexts.configurationDn());
            Instant now = Instant.now();

            List<RootKeyState> keys = listRootKeys(connection, container);

            if (requestedKeyId != null) {
                return keys.stream()
                    .filter(key -> key.keyId().equalsIgnoreCase(requestedKeyId))
                    .findFirst()
                    .orElseThrow(() -> new ProvisioningException(ErrorKind.INVALID_PARAMETER,
                        "KDS root key " + requestedKeyId + " does not exist"));
            }

            Optional<RootKeyState> selected = selectRootKey(keys, now);
            if (selected.isPresent()) {
                LOG.debugf("Using KDS root key %s (effective %s)", selected.get().keyId(), selected.get().effectiveTime());
                return selected.get();
            }

            Instant effective = policy == RootKeyPolicy.IMMEDIATE ? now.minus(propagation) : now.plus(propagation);
            String keyId = KdsRootKeyTemplate.bootstrapKeyId(container);
            String domainId = config.kdsDomainId().orElseGet(() -> {
                String dc = connectionFactory.domainControllerDn(connection);
                return dc != null ? dc : contexts.baseDn();
            });

            try {
                connection.add(KdsRootKeyTemplate.newRootKey(container, keyId, domainId, now, effective));
            } catch (LDAPException e) {
                if (!ResultCode.ENTRY_ALREADY_EXISTS.equals(e.getResultCode())) {
                    throw e;
                }
                LOG.infof("KDS root key %s was created concurrently, re-reading", keyId);
                return selectRootKey(listRootKeys(connection, container), now)
                    .orElseThrow(() -> new ProvisioningException(ErrorKind.DIRECTORY_UNREACHABLE,
                        "KDS root key reported as existing but could not be read"));
            }

            LOG.infof("Created KDS root key %s with policy %s, effective %s", keyId, policy, effective);
            return RootKeyState.created(keyId, effective);
        } catch (LDAPException e) {
            throw LdapErrorClassifier.classify("KDS root key check", e);
        }
    }

    @Override
    public DirectoryObjectRef createAccount(DirectoryCredential credential, CreationParameters parameters) {
        try (LDAPConnection connection = connectionFactory.open(credential)) {
            NamingContexts contexts = connectionFactory.namingContexts(connection);

            DN parent = parameters.organizationalUnit().isPresent()
                ? new DN(parameters.organizationalUnit().get())
                : new DN(config.defaultContainer() + "," + contexts.baseDn());
            DN dn = new DN(new RDN("CN", parameters.accountName()), parent);

            List<Sid> readers = new ArrayList<>();
            for (String principal : parameters.principalsAllowedToRetrieve()) {
                readers.add(resolvePrincipal(connection, contexts.baseDn(), principal));
            }

            connection.add(accountEntry(dn, parameters, readers));
            LOG.infof("Created gMSA %s at %s", parameters.samAccountName(), dn);

            return new DirectoryObjectRef(dn.toString(), parameters.samAccountName(), "",
                parameters.dnsHostName(), null);
        } catch (LDAPException e) {
            throw LdapErrorClassifier.classify("Account creation", e);
        }
    }

    Entry accountEntry(DN dn, CreationParameters parameters, List<Sid> readers) {
        Entry entry = new Entry(dn);
        entry.addAttribute("objectClass", GMSA_OBJECT_CLASS);
        entry.addAttribute("cn", parameters.accountName());
        entry.addAttribute(ATTR_SAM_ACCOUNT_NAME, parameters.samAccountName());
        entry.addAttribute(ATTR_DNS_HOST_NAME, parameters.dnsHostName());
        entry.addAttribute(ATTR_USER_ACCOUNT_CONTROL, Integer.toString(GMSA_ACCOUNT_CONTROL));
        entry.addAttribute(ATTR_PASSWORD_INTERVAL, Integer.toString(config.managedPasswordIntervalDays()));
        config.kerberosEncryptionTypes()
            .ifPresent(types -> entry.addAttribute(ATTR_ENCRYPTION_TYPES, Integer.toString(types)));
        if (!readers.isEmpty()) {
            entry.addAttribute(new Attribute(ATTR_PASSWORD_READERS, SecurityDescriptorEncoder.encode(readers)));
        }
        if (!parameters.servicePrincipalNames().isEmpty()) {
            entry.addAttribute(ATTR_SERVICE_PRINCIPAL_NAME, parameters.servicePrincipalNames());
        }
        parameters.description().ifPresent(description -> entry.addAttribute(ATTR_DESCRIPTION, description));
        return entry;
    }

    /**
     * Resolve a principal given as a SID, a distinguished name, or a sAMAccountName
     * (computer accounts may be named with or without the trailing {@code $}).
     */
    Sid resolvePrincipal(LDAPConnection connection, String baseDn, String principal) throws LDAPException {
        if (Sid.looksLikeSid(principal)) {
            try {
                return Sid.parse(principal);
            } catch (IllegalArgumentException e) {
                throw new ProvisioningException(ErrorKind.INVALID_PARAMETER,
                    "Principal " + principal + " is not a valid SID", e);
            }
        }

        Entry entry;
        if (principal.contains("=") && DN.isValidDN(principal)) {
            entry = connection.getEntry(principal, ATTR_OBJECT_SID);
        } else {
            Filter filter = principal.endsWith("$")
                ? Filter.createEqualityFilter(ATTR_SAM_ACCOUNT_NAME, principal)
                : Filter.createORFilter(
                    Filter.createEqualityFilter(ATTR_SAM_ACCOUNT_NAME, principal),
                    Filter.createEqualityFilter(ATTR_SAM_ACCOUNT_NAME, principal + "$"));
            SearchResult result = connection.search(baseDn, SearchScope.SUB, filter, ATTR_OBJECT_SID);
            entry = result.getSearchEntries().isEmpty() ? null : result.getSearchEntries().get(0);
        }

        if (entry == null) {
            throw new ProvisioningException(ErrorKind.INVALID_PARAMETER,
                "Principal " + principal + " was not found in the directory");
        }
        byte[] sid = entry.getAttributeValueBytes(ATTR_OBJECT_SID);
        if (sid == null) {
            throw new ProvisioningException(ErrorKind.INVALID_PARAMETER,
                "Principal " + principal + " has no objectSid");
        }
        try {
            return Sid.fromBytes(sid);
        } catch (IllegalArgumentException e) {
            throw new ProvisioningException(ErrorKind.INVALID_PARAMETER,
                "Principal " + principal + " has a malformed objectSid", e);
        }
    }

    private Optional<DirectoryObjectRef> searchAccount(LDAPConnection connection, String baseDn,
                                                       String samAccountName) throws LDAPException {
        SearchRequest request = new SearchRequest(baseDn, SearchScope.SUB,
            Filter.createEqualityFilter(ATTR_SAM_ACCOUNT_NAME, samAccountName), ACCOUNT_ATTRIBUTES);
        SearchResult result = connection.search(request);
        return result.getSearchEntries().stream()
            .findFirst()
            .map(LdapDirectoryClient::toRef);
    }

    private static DirectoryObjectRef toRef(SearchResultEntry entry) {
        Date created = entry.getAttributeValueAsDate(ATTR_WHEN_CREATED);
        return new DirectoryObjectRef(
            entry.getDN(),
            entry.getAttributeValue(ATTR_SAM_ACCOUNT_NAME),
            AdValues.formatGuid(entry.getAttributeValueBytes(ATTR_OBJECT_GUID)),
            entry.getAttributeValue(ATTR_DNS_HOST_NAME),
            created != null ? created.toInstant() : null
        );
    }

    private List<RootKeyState> listRootKeys(LDAPConnection connection, DN container) throws LDAPException {
        SearchResult result = connection.search(container.toString(), SearchScope.ONE,
            Filter.createEqualityFilter("objectClass", KdsRootKeyTemplate.OBJECT_CLASS),
            "cn", KdsRootKeyTemplate.ATTR_USE_START_TIME);
        List<RootKeyState> keys = new ArrayList<>();
        for (SearchResultEntry entry : result.getSearchEntries()) {
            Long useStart = entry.getAttributeValueAsLong(KdsRootKeyTemplate.ATTR_USE_START_TIME);
            keys.add(RootKeyState.existing(entry.getAttributeValue("cn"),
                useStart != null ? AdValues.fromFileTime(useStart) : null));
        }
        return keys;
    }

    /**
     * The most recent key already in effect, otherwise the pending key that takes
     * effect soonest.
     */
    static Optional<RootKeyState> selectRootKey(List<RootKeyState> keys, Instant now) {
        Comparator<RootKeyState> byEffective = Comparator.comparing(
            RootKeyState::effectiveTime, Comparator.nullsFirst(Comparator.naturalOrder()));

        Optional<RootKeyState> effective = keys.stream()
            .filter(key -> key.isEffectiveAt(now))
            .max(byEffective);
        if (effective.isPresent()) {
            return effective;
        }
        return keys.stream().min(byEffective);
    }

    private static String samAccountName(String accountName) {
        return accountName.endsWith("$") ? accountName : accountName + "$";
    }
}
