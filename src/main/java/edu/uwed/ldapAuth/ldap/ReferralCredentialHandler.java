package edu.uwed.ldapAuth.ldap;

import com.unboundid.ldap.sdk.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows referrals with the credential of the current phase instead of falling back to an
 * anonymous bind on the referred server.
 */
public class ReferralCredentialHandler implements ReferralConnector {

    private static final Logger logger = LoggerFactory.getLogger(ReferralCredentialHandler.class);

    private final DirectoryConnectionFactory connectionFactory;
    private final DirectoryConfiguration configuration;
    private final ReferralCredential credential;

    public ReferralCredentialHandler(
            DirectoryConnectionFactory connectionFactory,
            DirectoryConfiguration configuration,
            ReferralCredential credential
    ) {
        this.connectionFactory = connectionFactory;
        this.configuration = configuration;
        this.credential = credential;
    }

    /**
     * Enables referral following on the request and routes every hop through this handler.
     */
    public <T extends LDAPRequest> T install(T request) {
        request.setFollowReferrals(true);
        request.setReferralConnector(this);
        return request;
    }

    @Override
    public LDAPConnection getReferralConnection(LDAPURL referralURL, LDAPConnection connection) throws LDAPException {
        if (!referralURL.hostProvided()) {
            throw new LDAPException(ResultCode.UNAVAILABLE, "Null referral host in " + referralURL);
        }
        String host = referralURL.getHost();
        int port = referralURL.getPort();
        logger.debug("Following referral to {}:{} as user {}", host, port, credential.getDn());

        LDAPConnection referralConnection = connectionFactory.connect(host, port, configuration);
        try {
            connectionFactory.bind(referralConnection, credential.getDn(), credential.getPassword());
        } catch (LDAPException e) {
            referralConnection.close();
            logger.error("Failed to bind to referred server {}:{} as user {}: {}",
                    host, port, credential.getDn(), e.getResultCode(), e);
            throw e;
        }
        return referralConnection;
    }

    public ReferralCredential getCredential() {
        return credential;
    }
}
