package edu.uwed.ldapAuth.ldap;

import com.unboundid.ldap.sdk.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DirectoryAdminResolver {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryAdminResolver.class);

    /**
     * Runs {@code adminFilter} against the user's own entry only. The directory evaluates the
     * filter; any returned entry means the user is an administrator.
     *
     * @param connection connection bound as the user being checked
     */
    public boolean isAdmin(
            LDAPConnection connection,
            String userDn,
            String adminFilter,
            ReferralCredentialHandler referralHandler
    ) throws LDAPException {
        SearchRequest searchRequest = referralHandler.install(new SearchRequest(
                userDn,
                SearchScope.BASE,
                adminFilter,
                SearchRequest.NO_ATTRIBUTES
        ));
        searchRequest.setSizeLimit(1);

        SearchResult searchResult = connection.search(searchRequest);
        boolean admin = searchResult.getEntryCount() > 0;
        logger.debug("Admin filter {} on {} matched: {}", adminFilter, userDn, admin);
        return admin;
    }
}
