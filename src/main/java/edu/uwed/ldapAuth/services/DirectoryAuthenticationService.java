package edu.uwed.ldapAuth.services;

import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.SearchResultEntry;
import edu.uwed.ldapAuth.configuration.ConfigProperties;
import edu.uwed.ldapAuth.ldap.*;
import edu.uwed.ldapAuth.ldap.DirectoryAuthenticationException.FailureKind;
import edu.uwed.ldapAuth.ldap.DirectoryAuthenticationException.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Authenticates a username/password pair against the directory and reconciles the result with
 * the local identity store.
 * <p>
 * An attempt locates the user with the service account, binds a second connection as the located
 * entry with the caller's password, optionally checks the admin filter on that same connection and
 * finally creates or updates the local identity. Any failure ends the attempt.
 */
@Service
public class DirectoryAuthenticationService {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryAuthenticationService.class);

    private final ConfigProperties.DirectoryConfig directoryConfig;
    private final DirectoryConnectionFactory connectionFactory;
    private final DirectoryUserLocator userLocator;
    private final DirectoryAdminResolver adminResolver;
    private final IdentityStore identityStore;

    @Autowired
    public DirectoryAuthenticationService(
            ConfigProperties.DirectoryConfig directoryConfig,
            DirectoryConnectionFactory connectionFactory,
            DirectoryUserLocator userLocator,
            DirectoryAdminResolver adminResolver,
            IdentityStore identityStore
    ) {
        this.directoryConfig = directoryConfig;
        this.connectionFactory = connectionFactory;
        this.userLocator = userLocator;
        this.adminResolver = adminResolver;
        this.identityStore = identityStore;
    }

    /**
     * @throws DirectoryAuthenticationException when the attempt fails, classified by {@link FailureKind}
     */
    public AuthenticationOutcome authenticate(String username, String password) {
        DirectoryConfiguration configuration = directoryConfig.snapshot();

        SearchResultEntry ldapUser = locateUser(configuration, username).orElseThrow(() -> {
            logger.error("Found no users matching {} in LDAP search", username);
            return new DirectoryAuthenticationException(
                    FailureKind.USER_NOT_FOUND, Phase.LOCATE, DirectoryAuthenticationException.INVALID_LOGIN_MESSAGE);
        });

        String ldapUsername = resolveUsername(ldapUser, configuration, username);
        logger.debug("Setting username: {}", ldapUsername);

        ReferralCredential userCredential = new ReferralCredential(ldapUser.getDN(), password);
        boolean ldapIsAdmin = false;
        try (LDAPConnection userConnection = openAsUser(configuration, userCredential)) {
            if (configuration.isAdminCheckEnabled()) {
                ldapIsAdmin = checkAdmin(userConnection, configuration, userCredential);
            }
        }

        Identity identity = reconcile(configuration, ldapUsername, ldapIsAdmin);
        return AuthenticationOutcome.of(ldapUsername, identity);
    }

    /**
     * Always true: the directory owns the password, nothing is stored locally.
     */
    public boolean hasStoredPassword(Identity identity) {
        return true;
    }

    public void changePassword(Identity identity, String newPassword) {
        throw new UnsupportedOperationException("Password changes are handled by the directory");
    }

    /**
     * DNs of the entries under the base DN matching {@code filter}, searched as the service account.
     */
    public List<String> getFilteredUsers(String filter) {
        DirectoryConfiguration configuration = directoryConfig.snapshot();
        ReferralCredential serviceCredential = configuration.getServiceCredential();
        LDAPConnection connection = openAsService(configuration, serviceCredential);
        try (connection) {
            return userLocator.findUserDns(connection, configuration, filter,
                    new ReferralCredentialHandler(connectionFactory, configuration, serviceCredential));
        } catch (LDAPException e) {
            logger.error("Filtered search {} failed on {}: {}", filter, configuration.getHost(), e.getResultCode(), e);
            throw DirectoryAuthenticationException.fromSearch(e, Phase.LOCATE, DirectoryAuthenticationException.SERVER_FAILURE_MESSAGE);
        }
    }

    private Optional<SearchResultEntry> locateUser(DirectoryConfiguration configuration, String username) {
        ReferralCredential serviceCredential = configuration.getServiceCredential();
        LDAPConnection connection = openAsService(configuration, serviceCredential);
        try (connection) {
            return userLocator.locate(connection, configuration, username,
                    new ReferralCredentialHandler(connectionFactory, configuration, serviceCredential));
        } catch (LDAPException e) {
            logger.error("Failed to locate user {} on {} as {}: {}",
                    username, configuration.getHost(), serviceCredential.getDn(), e.getResultCode(), e);
            throw DirectoryAuthenticationException.fromSearch(e, Phase.LOCATE, DirectoryAuthenticationException.SERVER_FAILURE_MESSAGE);
        }
    }

    private LDAPConnection openAsService(DirectoryConfiguration configuration, ReferralCredential serviceCredential) {
        try {
            return connectionFactory.open(configuration, serviceCredential);
        } catch (LDAPException e) {
            throw DirectoryAuthenticationException.from(e, Phase.LOCATE, DirectoryAuthenticationException.SERVER_FAILURE_MESSAGE);
        }
    }

    private String resolveUsername(SearchResultEntry ldapUser, DirectoryConfiguration configuration, String requested) {
        String value = ldapUser.getAttributeValue(configuration.getUsernameAttribute());
        if (value == null) {
            logger.warn("LDAP attribute {} not found for user {}, keeping requested username",
                    configuration.getUsernameAttribute(), ldapUser.getDN());
            return requested;
        }
        return value;
    }

    private LDAPConnection openAsUser(DirectoryConfiguration configuration, ReferralCredential userCredential) {
        try {
            return connectionFactory.open(configuration, userCredential);
        } catch (LDAPException e) {
            if (DirectoryAuthenticationException.isCredentialFailure(e.getResultCode())) {
                logger.error("Error logging in, invalid LDAP username or password for {}", userCredential.getDn());
                throw new DirectoryAuthenticationException(FailureKind.INVALID_CREDENTIALS, Phase.VERIFY,
                        DirectoryAuthenticationException.INVALID_LOGIN_MESSAGE, e);
            }
            throw new DirectoryAuthenticationException(FailureKind.CONNECTION_FAILURE, Phase.VERIFY,
                    DirectoryAuthenticationException.INVALID_LOGIN_MESSAGE, e);
        }
    }

    private boolean checkAdmin(LDAPConnection userConnection, DirectoryConfiguration configuration,
                               ReferralCredential userCredential) {
        try {
            return adminResolver.isAdmin(userConnection, userCredential.getDn(), configuration.getAdminFilter(),
                    new ReferralCredentialHandler(connectionFactory, configuration, userCredential));
        } catch (LDAPException e) {
            logger.error("Admin filter search failed for {} on {}: {}",
                    userCredential.getDn(), configuration.getHost(), e.getResultCode(), e);
            throw DirectoryAuthenticationException.fromSearch(e, Phase.ADMIN_CHECK, "Error completing LDAP login.");
        }
    }

    private Identity reconcile(DirectoryConfiguration configuration, String ldapUsername, boolean ldapIsAdmin) {
        Optional<Identity> existing = identityStore.findByUsername(ldapUsername);
        if (existing.isPresent()) {
            return syncAdmin(configuration, existing.get(), ldapIsAdmin);
        }

        if (!configuration.isCreateUsersFromLdap()) {
            logger.error("User not configured for LDAP Uid: {}", ldapUsername);
            throw new DirectoryAuthenticationException(FailureKind.PROVISIONING_DISABLED, Phase.RECONCILE,
                    "Automatic User Creation is disabled and there is no local user for authorized Uid: " + ldapUsername);
        }

        try {
            return provision(configuration, ldapUsername, ldapIsAdmin);
        } catch (DuplicateIdentityException e) {
            logger.warn("Identity {} was created concurrently, fetching it again", ldapUsername);
            Identity identity = identityStore.findByUsername(ldapUsername).orElseThrow(() -> e);
            return syncAdmin(configuration, identity, ldapIsAdmin);
        }
    }

    private Identity provision(DirectoryConfiguration configuration, String ldapUsername, boolean ldapIsAdmin) {
        logger.debug("Creating new user {} - is admin? {}", ldapUsername, ldapIsAdmin);
        Identity identity = identityStore.createUsername(ldapUsername);
        identity.setAdministrator(ldapIsAdmin);
        identity.setEnableAllFolders(configuration.isEnableAllFolders());
        if (!configuration.isEnableAllFolders()) {
            identity.setEnabledFolders(configuration.getEnabledFolders());
        }
        identityStore.updateIdentity(identity);
        return identity;
    }

    // the directory is authoritative for the admin flag only while an admin filter is configured
    private Identity syncAdmin(DirectoryConfiguration configuration, Identity identity, boolean ldapIsAdmin) {
        if (configuration.isAdminCheckEnabled() && identity.isAdministrator() != ldapIsAdmin) {
            logger.debug("Updating user {} admin status to: {}.", identity.getUsername(), ldapIsAdmin);
            identity.setAdministrator(ldapIsAdmin);
            identityStore.updateIdentity(identity);
        }
        return identity;
    }
}
