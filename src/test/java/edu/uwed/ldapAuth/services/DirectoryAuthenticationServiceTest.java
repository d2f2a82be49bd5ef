package edu.uwed.ldapAuth.services;

import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import com.unboundid.ldap.sdk.LDAPException;
import edu.uwed.ldapAuth.configuration.ConfigProperties;
import edu.uwed.ldapAuth.ldap.DirectoryAdminResolver;
import edu.uwed.ldapAuth.ldap.DirectoryAuthenticationException;
import edu.uwed.ldapAuth.ldap.DirectoryAuthenticationException.FailureKind;
import edu.uwed.ldapAuth.ldap.DirectoryAuthenticationException.Phase;
import edu.uwed.ldapAuth.ldap.DirectoryConnectionFactory;
import edu.uwed.ldapAuth.ldap.DirectoryUserLocator;
import edu.uwed.ldapAuth.ldap.InMemoryDirectoryFixture;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static edu.uwed.ldapAuth.ldap.InMemoryDirectoryFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class DirectoryAuthenticationServiceTest {

    private static InMemoryDirectoryServer server;

    private ConfigProperties.DirectoryConfig config;
    private InMemoryIdentityStore identityStore;

    @BeforeAll
    public static void startServer() throws LDAPException {
        server = InMemoryDirectoryFixture.start();
    }

    @AfterAll
    public static void stopServer() {
        server.shutDown(true);
    }

    @BeforeEach
    public void setUp() {
        config = directoryConfig(server);
        identityStore = new InMemoryIdentityStore();
    }

    private DirectoryAuthenticationService service() {
        return service(identityStore);
    }

    private DirectoryAuthenticationService service(IdentityStore store) {
        return new DirectoryAuthenticationService(
                config,
                new DirectoryConnectionFactory(),
                new DirectoryUserLocator(),
                new DirectoryAdminResolver(),
                store
        );
    }

    private static Identity existing(InMemoryIdentityStore store, String username, boolean administrator) {
        Identity identity = store.createUsername(username);
        identity.setAdministrator(administrator);
        store.updateIdentity(identity);
        return identity;
    }

    @Test
    public void testAuthenticateCreatesIdentity() {
        AuthenticationOutcome outcome = service().authenticate("alice", ALICE_PASSWORD);

        assertEquals("alice", outcome.getUsername());
        assertFalse(outcome.isAdministrator());
        assertTrue(outcome.isEnableAllFolders());
        Identity identity = identityStore.findByUsername("alice").orElseThrow();
        assertFalse(identity.isAdministrator());
        assertTrue(identity.isEnableAllFolders());
    }

    @Test
    public void testWrongPasswordIsInvalidCredentialsWithoutMutation() {
        DirectoryAuthenticationException e = assertThrows(DirectoryAuthenticationException.class,
                () -> service().authenticate("alice", "wrong-pw"));

        assertEquals(FailureKind.INVALID_CREDENTIALS, e.getKind());
        assertEquals(Phase.VERIFY, e.getPhase());
        assertEquals(DirectoryAuthenticationException.INVALID_LOGIN_MESSAGE, e.getMessage());
        assertEquals(0, identityStore.size());
    }

    @Test
    public void testEmptyPasswordIsRejected() {
        DirectoryAuthenticationException e = assertThrows(DirectoryAuthenticationException.class,
                () -> service().authenticate("alice", ""));

        assertEquals(FailureKind.INVALID_CREDENTIALS, e.getKind());
        assertEquals(0, identityStore.size());
    }

    @Test
    public void testUnknownUserSharesTheInvalidLoginMessage() {
        DirectoryAuthenticationException e = assertThrows(DirectoryAuthenticationException.class,
                () -> service().authenticate("mallory", "whatever"));

        assertEquals(FailureKind.USER_NOT_FOUND, e.getKind());
        assertEquals(DirectoryAuthenticationException.INVALID_LOGIN_MESSAGE, e.getMessage());
        assertEquals(0, identityStore.size());
    }

    @Test
    public void testCaseInsensitiveUsername() {
        assertThrows(DirectoryAuthenticationException.class, () -> service().authenticate("ALICE", ALICE_PASSWORD));

        config.setCaseInsensitiveUsername(true);
        AuthenticationOutcome outcome = service().authenticate("ALICE", ALICE_PASSWORD);

        // the local name comes from the directory entry, not from what was typed
        assertEquals("alice", outcome.getUsername());
    }

    @Test
    public void testMatchOnSecondaryAttributeResolvesPrimaryUsername() {
        config.setSearchAttributes("uid, mail");

        AuthenticationOutcome outcome = service().authenticate("bob@example.com", BOB_PASSWORD);

        assertEquals("bob", outcome.getUsername());
        assertTrue(identityStore.findByUsername("bob").isPresent());
    }

    @Test
    public void testProvisioningDisabled() {
        config.setCreateUsersFromLdap(false);

        DirectoryAuthenticationException e = assertThrows(DirectoryAuthenticationException.class,
                () -> service().authenticate("alice", ALICE_PASSWORD));

        assertEquals(FailureKind.PROVISIONING_DISABLED, e.getKind());
        assertEquals(0, identityStore.size());
    }

    @Test
    public void testProvisioningDisabledStillAuthenticatesExistingIdentity() {
        config.setCreateUsersFromLdap(false);
        existing(identityStore, "alice", false);

        assertEquals("alice", service().authenticate("alice", ALICE_PASSWORD).getUsername());
    }

    @Test
    public void testRepeatedAuthenticationCreatesOnce() {
        config.setAdminFilter(ADMIN_FILTER);
        DirectoryAuthenticationService service = service();

        AuthenticationOutcome first = service.authenticate("bob", BOB_PASSWORD);
        AuthenticationOutcome second = service.authenticate("bob", BOB_PASSWORD);

        assertEquals(1, identityStore.size());
        assertTrue(first.isAdministrator());
        assertEquals(first, second);
    }

    @Test
    public void testAdminFilterGrantsAdministrator() {
        config.setAdminFilter(ADMIN_FILTER);

        assertTrue(service().authenticate("bob", BOB_PASSWORD).isAdministrator());
        assertTrue(identityStore.findByUsername("bob").orElseThrow().isAdministrator());
        assertFalse(service().authenticate("alice", ALICE_PASSWORD).isAdministrator());
    }

    @Test
    public void testAdminFilterRevokesStoredAdministrator() {
        config.setAdminFilter(ADMIN_FILTER);
        existing(identityStore, "alice", true);

        AuthenticationOutcome outcome = service().authenticate("alice", ALICE_PASSWORD);

        assertFalse(outcome.isAdministrator());
        assertFalse(identityStore.findByUsername("alice").orElseThrow().isAdministrator());
    }

    @Test
    public void testDisabledAdminFilterLeavesStoredFlagAlone() {
        config.setAdminFilter("_disabled_");
        existing(identityStore, "alice", true);
        existing(identityStore, "bob", false);

        assertTrue(service().authenticate("alice", ALICE_PASSWORD).isAdministrator());
        assertFalse(service().authenticate("bob", BOB_PASSWORD).isAdministrator());
        assertTrue(identityStore.findByUsername("alice").orElseThrow().isAdministrator());
        assertFalse(identityStore.findByUsername("bob").orElseThrow().isAdministrator());
    }

    @Test
    public void testRestrictedFoldersAreCopiedOnCreate() {
        config.setEnableAllFolders(false);
        config.setEnabledFolders(List.of("movies", "music"));

        AuthenticationOutcome outcome = service().authenticate("alice", ALICE_PASSWORD);

        assertFalse(outcome.isEnableAllFolders());
        assertEquals(List.of("movies", "music"), outcome.getEnabledFolders());
        assertEquals(List.of("movies", "music"), identityStore.findByUsername("alice").orElseThrow().getEnabledFolders());
    }

    @Test
    public void testConcurrentCreationIsFetchedAgain() {
        config.setAdminFilter(ADMIN_FILTER);
        InMemoryIdentityStore racingStore = new InMemoryIdentityStore() {
            @Override
            public Identity createUsername(String username) {
                // another login created the record first
                super.createUsername(username);
                throw new DuplicateIdentityException(username);
            }
        };

        AuthenticationOutcome outcome = service(racingStore).authenticate("bob", BOB_PASSWORD);

        assertEquals("bob", outcome.getUsername());
        assertTrue(outcome.isAdministrator());
        assertEquals(1, racingStore.size());
        assertTrue(racingStore.findByUsername("bob").orElseThrow().isAdministrator());
    }

    @Test
    public void testServiceAccountRejected() {
        config.setBindPassword("wrong-pw");

        DirectoryAuthenticationException e = assertThrows(DirectoryAuthenticationException.class,
                () -> service().authenticate("alice", ALICE_PASSWORD));

        assertEquals(FailureKind.BIND_FAILURE, e.getKind());
        assertEquals(Phase.LOCATE, e.getPhase());
        assertEquals(DirectoryAuthenticationException.SERVER_FAILURE_MESSAGE, e.getMessage());
    }

    @Test
    public void testServerUnreachable() throws LDAPException {
        config.setLdapPort(closedPort());

        DirectoryAuthenticationException e = assertThrows(DirectoryAuthenticationException.class,
                () -> service().authenticate("alice", ALICE_PASSWORD));

        assertEquals(FailureKind.CONNECTION_FAILURE, e.getKind());
        assertEquals(Phase.LOCATE, e.getPhase());
        assertEquals(0, identityStore.size());
    }

    @Test
    public void testPasswordCapabilities() {
        DirectoryAuthenticationService service = service();
        Identity identity = new LocalIdentity("alice");

        assertTrue(service.hasStoredPassword(identity));
        assertThrows(UnsupportedOperationException.class, () -> service.changePassword(identity, "new-pw"));
    }

    @Test
    public void testFilteredUsers() {
        assertEquals(List.of(BOB_DN), service().getFilteredUsers(ADMIN_FILTER));
    }

    @Test
    public void testBrokenAdminFilterIsSearchFailure() {
        config.setAdminFilter("(employeeType=admin");

        DirectoryAuthenticationException e = assertThrows(DirectoryAuthenticationException.class,
                () -> service().authenticate("bob", BOB_PASSWORD));

        // the user bind succeeded, so this must not read as rejected credentials
        assertEquals(FailureKind.SEARCH_FAILURE, e.getKind());
        assertEquals(Phase.ADMIN_CHECK, e.getPhase());
        assertEquals(0, identityStore.size());
    }

    @Test
    public void testBrokenUserFilterIsSearchFailure() {
        DirectoryAuthenticationException e = assertThrows(DirectoryAuthenticationException.class,
                () -> service().getFilteredUsers("(uid=*"));

        assertEquals(FailureKind.SEARCH_FAILURE, e.getKind());
        assertEquals(DirectoryAuthenticationException.SERVER_FAILURE_MESSAGE, e.getMessage());
    }
}
