package tech.gmsaprovisioner.directory.ldap;

import com.unboundid.ldap.sdk.DN;
import com.unboundid.ldap.sdk.ExtendedResult;
import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPConnectionOptions;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SimpleBindRequest;
import com.unboundid.ldap.sdk.extensions.StartTLSExtendedRequest;
import com.unboundid.util.ssl.JVMDefaultTrustManager;
import com.unboundid.util.ssl.SSLUtil;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gmsaprovisioner.common.errors.ErrorKind;
import tech.gmsaprovisioner.common.errors.ProvisioningException;
import tech.gmsaprovisioner.config.DirectoryConfig;
import tech.gmsaprovisioner.credential.DirectoryCredential;

import java.security.GeneralSecurityException;

/**
 * Opens connections to the configured domain controller.
 *
 * <p>Connections are not pooled: each directory operation binds with the
 * credential of the current invocation and closes the connection when done.
 */
@ApplicationScoped
public class LdapConnectionFactory {

    private static final Logger LOG = Logger.getLogger(LdapConnectionFactory.class);

    private static final String DEFAULT_NAMING_CONTEXT = "defaultNamingContext";
    private static final String CONFIGURATION_NAMING_CONTEXT = "configurationNamingContext";
    private static final String DS_SERVICE_NAME = "dsServiceName";
    private static final String SERVER_REFERENCE = "serverReference";

    @Inject
    DirectoryConfig config;

    /**
     * Connect and bind with the given credential.
     */
    public LDAPConnection open(DirectoryCredential credential) throws LDAPException {
        LDAPConnection connection = connect();
        try {
            connection.bind(new SimpleBindRequest(credential.username(), credential.password()));
            return connection;
        } catch (LDAPException e) {
            connection.close();
            throw e;
        }
    }

    /**
     * Connect without binding. Only the RootDSE is readable on such a connection.
     */
    public LDAPConnection openAnonymous() throws LDAPException {
        return connect();
    }

    /**
     * Naming contexts from configuration, falling back to the RootDSE.
     */
    NamingContexts namingContexts(LDAPConnection connection) throws LDAPException {
        String baseDn = config.baseDn().orElse(null);
        String configurationDn = config.configurationDn().orElse(null);
        if (baseDn != null && configurationDn != null) {
            return new NamingContexts(baseDn, configurationDn);
        }

        SearchResultEntry rootDse = connection.getEntry("", DEFAULT_NAMING_CONTEXT, CONFIGURATION_NAMING_CONTEXT);
        if (rootDse != null) {
            if (baseDn == null) {
                baseDn = rootDse.getAttributeValue(DEFAULT_NAMING_CONTEXT);
            }
            if (configurationDn == null) {
                configurationDn = rootDse.getAttributeValue(CONFIGURATION_NAMING_CONTEXT);
            }
        }
        if (baseDn == null || configurationDn == null) {
            throw new ProvisioningException(ErrorKind.DIRECTORY_UNREACHABLE,
                "Directory did not publish its naming contexts; set gmsa.directory.base-dn and gmsa.directory.configuration-dn");
        }
        return new NamingContexts(baseDn, configurationDn);
    }

    /**
     * Computer object of the domain controller serving this connection, or null
     * if the directory does not expose it.
     */
    String domainControllerDn(LDAPConnection connection) {
        try {
            SearchResultEntry rootDse = connection.getEntry("", DS_SERVICE_NAME);
            if (rootDse == null || rootDse.getAttributeValue(DS_SERVICE_NAME) == null) {
                return null;
            }
            DN server = new DN(rootDse.getAttributeValue(DS_SERVICE_NAME)).getParent();
            if (server == null) {
                return null;
            }
            SearchResultEntry serverEntry = connection.getEntry(server.toString(), SERVER_REFERENCE);
            return serverEntry != null ? serverEntry.getAttributeValue(SERVER_REFERENCE) : null;
        } catch (LDAPException e) {
            LOG.debugf("Could not resolve domain controller object: %s", e.getMessage());
            return null;
        }
    }

    private LDAPConnection connect() throws LDAPException {
        LDAPConnectionOptions options = new LDAPConnectionOptions();
        options.setConnectTimeoutMillis((int) config.connectTimeout().toMillis());
        options.setResponseTimeoutMillis(config.responseTimeout().toMillis());

        String server = config.server();
        int port = config.port();

        switch (config.security()) {
            case LDAPS:
                try {
                    return new LDAPConnection(sslUtil().createSSLSocketFactory(), options, server, port);
                } catch (GeneralSecurityException e) {
                    throw new LDAPException(ResultCode.CONNECT_ERROR, "TLS setup failed: " + e.getMessage(), e);
                }
            case STARTTLS:
                LDAPConnection connection = new LDAPConnection(options, server, port);
                try {
                    ExtendedResult result = connection.processExtendedOperation(
                        new StartTLSExtendedRequest(sslUtil().createSSLContext()));
                    if (!ResultCode.SUCCESS.equals(result.getResultCode())) {
                        throw new LDAPException(result);
                    }
                    return connection;
                } catch (GeneralSecurityException e) {
                    connection.close();
                    throw new LDAPException(ResultCode.CONNECT_ERROR, "StartTLS setup failed: " + e.getMessage(), e);
                } catch (LDAPException e) {
                    connection.close();
                    throw e;
                }
            default:
                return new LDAPConnection(options, server, port);
        }
    }

    private static SSLUtil sslUtil() {
        return new SSLUtil(JVMDefaultTrustManager.getInstance());
    }
}
