package edu.uwed.ldapAuth.ldap;

import com.unboundid.ldap.sdk.*;
import com.unboundid.ldap.sdk.extensions.StartTLSExtendedRequest;
import com.unboundid.util.ssl.HostNameSSLSocketVerifier;
import com.unboundid.util.ssl.JVMDefaultTrustManager;
import com.unboundid.util.ssl.SSLUtil;
import com.unboundid.util.ssl.TrustAllTrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import java.security.GeneralSecurityException;

/**
 * Opens directory connections. Nothing is pooled: every call gets a fresh transport which the
 * caller owns and must close.
 */
@Component
public class DirectoryConnectionFactory {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryConnectionFactory.class);

    /**
     * Connects to the configured server and binds with the given credential. On any failure the
     * connection is closed before the exception leaves this method.
     */
    public LDAPConnection open(DirectoryConfiguration configuration, ReferralCredential credential) throws LDAPException {
        LDAPConnection connection = null;
        try {
            connection = connect(configuration);
            logger.debug("Trying bind as user {}", credential.getDn());
            bind(connection, credential.getDn(), credential.getPassword());
            return connection;
        } catch (LDAPException e) {
            if (connection != null) {
                connection.close();
            }
            logger.error("Failed to Connect or Bind to server {}:{} as user {}: {}",
                    configuration.getHost(), configuration.getPort(), credential.getDn(), e.getResultCode(), e);
            throw e;
        }
    }

    public LDAPConnection connect(DirectoryConfiguration configuration) throws LDAPException {
        return connect(configuration.getHost(), configuration.getPort(), configuration);
    }

    /**
     * Connects to an arbitrary server (a referral target, for instance) applying the configured
     * TLS mode and certificate policy.
     */
    public LDAPConnection connect(String host, int port, DirectoryConfiguration configuration) throws LDAPException {
        LDAPConnection connection = connectTransport(host, port, configuration);
        if (configuration.getProtocol() == LdapConstants.LDAP_PROTOCOL.LDAP_TLS) {
            try {
                startTls(connection, configuration);
            } catch (LDAPException e) {
                connection.close();
                throw e;
            }
        }
        return connection;
    }

    // plain or implicit TLS socket, no StartTLS yet
    public LDAPConnection connectTransport(String host, int port, DirectoryConfiguration configuration) throws LDAPException {
        LDAPConnectionOptions options = getConnectionOptions(configuration);
        LDAPConnection connection;
        switch (configuration.getProtocol()) {
            case LDAP:
            case LDAP_TLS:
                connection = new LDAPConnection(options, host, port);
                logger.debug("Created LDAP connection for {}:{}", host, port);
                return connection;
            case LDAPS:
                SSLSocketFactory socketFactory;
                try {
                    socketFactory = createSslUtil(configuration).createSSLSocketFactory();
                } catch (GeneralSecurityException e) {
                    throw new LDAPException(ResultCode.LOCAL_ERROR, "Unable to create TLS socket factory: " + e.getMessage(), e);
                }
                connection = new LDAPConnection(socketFactory, options, host, port);
                logger.debug("Created LDAPS connection for {}:{}", host, port);
                return connection;
            default:
                throw new IllegalArgumentException("Unsupported protocol: " + configuration.getProtocol());
        }
    }

    public void startTls(LDAPConnection connection, DirectoryConfiguration configuration) throws LDAPException {
        SSLContext sslContext;
        try {
            sslContext = createSslUtil(configuration).createSSLContext();
        } catch (GeneralSecurityException e) {
            throw new LDAPException(ResultCode.LOCAL_ERROR, "Unable to create TLS context: " + e.getMessage(), e);
        }
        ExtendedResult startTLSResult = connection.processExtendedOperation(new StartTLSExtendedRequest(sslContext));
        if (!ResultCode.SUCCESS.equals(startTLSResult.getResultCode())) {
            logger.warn("StartTLS operation failed for server {}:{}: {}",
                    connection.getConnectedAddress(), connection.getConnectedPort(), startTLSResult.getResultCode());
            throw new LDAPException(ResultCode.CONNECT_ERROR,
                    "StartTLS failed: " + startTLSResult.getResultCode()
                            + (startTLSResult.getDiagnosticMessage() == null ? "" : " " + startTLSResult.getDiagnosticMessage()));
        }
        logger.debug("Upgraded connection to {}:{} with StartTLS",
                connection.getConnectedAddress(), connection.getConnectedPort());
    }

    /**
     * Simple bind. An empty DN binds anonymously.
     */
    public BindResult bind(LDAPConnection connection, String dn, String password) throws LDAPException {
        SimpleBindRequest bindRequest = (dn == null || dn.isEmpty())
                ? new SimpleBindRequest()
                : new SimpleBindRequest(dn, password == null ? "" : password);
        return connection.bind(bindRequest);
    }

    public boolean isBound(LDAPConnection connection) {
        BindRequest lastBind = connection.getLastBindRequest();
        if (lastBind instanceof SimpleBindRequest simpleBind) {
            String bindDn = simpleBind.getBindDN();
            return bindDn != null && !bindDn.isEmpty();
        }
        return lastBind != null;
    }

    private LDAPConnectionOptions getConnectionOptions(DirectoryConfiguration configuration) {
        LDAPConnectionOptions options = new LDAPConnectionOptions();
        options.setConnectTimeoutMillis(configuration.getConnectTimeoutMs());
        options.setResponseTimeoutMillis(configuration.getOperationTimeoutMs());
        options.setReferralHopLimit(configuration.getReferralHopLimit());
        if (!configuration.isSkipCertificateVerification()) {
            options.setSSLSocketVerifier(new HostNameSSLSocketVerifier(true));
        }
        return options;
    }

    private SSLUtil createSslUtil(DirectoryConfiguration configuration) {
        if (configuration.isSkipCertificateVerification()) {
            logger.warn("TLS certificate verification is disabled for {}:{}",
                    configuration.getHost(), configuration.getPort());
            return new SSLUtil(new TrustAllTrustManager());
        }
        return new SSLUtil(JVMDefaultTrustManager.getInstance());
    }
}
