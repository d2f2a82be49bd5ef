package edu.uwed.ldapAuth.services;

import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchScope;
import edu.uwed.ldapAuth.configuration.ConfigProperties;
import edu.uwed.ldapAuth.ldap.DirectoryConfiguration;
import edu.uwed.ldapAuth.ldap.DirectoryConnectionFactory;
import edu.uwed.ldapAuth.ldap.EntryCountingSearchResultListener;
import edu.uwed.ldapAuth.ldap.LdapConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class DirectoryDiagnosticsService {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryDiagnosticsService.class);

    private final ConfigProperties.DirectoryConfig directoryConfig;
    private final DirectoryConnectionFactory connectionFactory;

    @Autowired
    public DirectoryDiagnosticsService(
            ConfigProperties.DirectoryConfig directoryConfig,
            DirectoryConnectionFactory connectionFactory
    ) {
        this.directoryConfig = directoryConfig;
        this.connectionFactory = connectionFactory;
    }

    /**
     * Walks connect, StartTLS, bind and a base search with the current settings and reports each
     * step, e.g. {@code Connect (Success); Bind (Success); Base Search (Found 12 Entities)}.
     * Stops at the first failing step with its error message. Never throws.
     */
    public String testConnection() {
        DirectoryConfiguration configuration = directoryConfig.snapshot();
        StringBuilder response = new StringBuilder();
        LDAPConnection connection = null;

        try {
            response.append("Connect (");
            connection = connectionFactory.connectTransport(configuration.getHost(), configuration.getPort(), configuration);
            response.append("Success)");

            if (configuration.getProtocol() == LdapConstants.LDAP_PROTOCOL.LDAP_TLS) {
                response.append("; Set StartTLS (");
                connectionFactory.startTls(connection, configuration);
                response.append("Success)");
            }

            response.append("; Bind (");
            connectionFactory.bind(connection, configuration.getBindDn(), configuration.getBindPassword());
            response.append(connectionFactory.isBound(connection) ? "Success)" : "Anonymous)");

            response.append("; Base Search (");
            EntryCountingSearchResultListener listener = new EntryCountingSearchResultListener();
            connection.search(new SearchRequest(
                    listener,
                    configuration.getBaseDn(),
                    SearchScope.SUB,
                    LdapConstants.SEARCH_ALL_FILTER,
                    SearchRequest.NO_ATTRIBUTES
            ));
            response.append("Found ").append(listener.getEntryCount()).append(" Entities)");
        } catch (LDAPException | RuntimeException e) {
            logger.warn("Ldap Test Failed to Connect or Bind to server {}:{}", configuration.getHost(), configuration.getPort(), e);
            response.append("Error: ").append(e.getMessage()).append(')');
        } finally {
            if (connection != null) {
                connection.close();
            }
        }

        return response.toString();
    }
}
