package edu.uwed.ldapAuth.ldap;

import com.unboundid.ldap.sdk.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

@Component
public class DirectoryUserLocator {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryUserLocator.class);

    /**
     * Searches the base DN with the configured filter and returns the first entry carrying a
     * username attribute value equal to {@code username}.
     *
     * @param connection connection bound as the service account
     * @return the located entry, or empty when no entry matched
     */
    public Optional<SearchResultEntry> locate(
            LDAPConnection connection,
            DirectoryConfiguration configuration,
            String username,
            ReferralCredentialHandler referralHandler
    ) throws LDAPException {
        SearchRequest searchRequest = referralHandler.install(new SearchRequest(
                configuration.getBaseDn(),
                SearchScope.SUB,
                configuration.getSearchFilter(),
                configuration.getUsernameAttributeArray()
        ));
        logger.debug("Search: {} {} @ {}", configuration.getBaseDn(), configuration.getSearchFilter(), configuration.getHost());

        SearchResult searchResult = connection.search(searchRequest);
        logger.debug("Search returned {} entries for username {}", searchResult.getEntryCount(), username);

        return findMatch(
                searchResult.getSearchEntries(),
                configuration.getUsernameAttributes(),
                username,
                configuration.getUsernameMatch()
        );
    }

    /**
     * First match wins: entries in server order, then attributes in priority order, then values.
     */
    public static Optional<SearchResultEntry> findMatch(
            List<SearchResultEntry> entries,
            List<String> usernameAttributes,
            String username,
            LdapConstants.USERNAME_MATCH usernameMatch
    ) {
        SearchResultEntry located = null;
        boolean found = false;
        Iterator<SearchResultEntry> iterator = entries.iterator();
        while (!found && iterator.hasNext()) {
            SearchResultEntry entry = iterator.next();
            for (int i = 0; !found && i < usernameAttributes.size(); i++) {
                String attributeName = usernameAttributes.get(i);
                String[] values = entry.getAttributeValues(attributeName);
                if (values == null) {
                    logger.debug("LDAP attribute {} not found for user {}", attributeName, entry.getDN());
                    continue;
                }
                for (String value : values) {
                    if (usernameMatch.matches(username, value)) {
                        located = entry;
                        found = true;
                        break;
                    }
                }
            }
        }
        return Optional.ofNullable(located);
    }

    /**
     * DNs of every entry under the base DN matching {@code filter}. The list is complete before
     * it is returned, so the connection may be closed right after.
     */
    public List<String> findUserDns(
            LDAPConnection connection,
            DirectoryConfiguration configuration,
            String filter,
            ReferralCredentialHandler referralHandler
    ) throws LDAPException {
        SearchRequest searchRequest = referralHandler.install(new SearchRequest(
                configuration.getBaseDn(),
                SearchScope.SUB,
                filter,
                configuration.getUsernameAttributeArray()
        ));
        SearchResult searchResult = connection.search(searchRequest);
        List<String> dns = new ArrayList<>(searchResult.getEntryCount());
        for (SearchResultEntry entry : searchResult.getSearchEntries()) {
            dns.add(entry.getDN());
        }
        logger.debug("Filter {} matched {} entries under {}", filter, dns.size(), configuration.getBaseDn());
        return dns;
    }
}
