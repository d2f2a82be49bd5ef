package edu.uwed.ldapAuth.ldap;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * Immutable view of the directory settings for a single call.
 */
@Value
@Builder
public class DirectoryConfiguration {
    String host;
    int port;
    LdapConstants.LDAP_PROTOCOL protocol;
    boolean skipCertificateVerification;
    String baseDn;
    String bindDn;
    @ToString.Exclude
    String bindPassword;
    String searchFilter;
    // order defines match priority
    List<String> usernameAttributes;
    String usernameAttribute;
    String adminFilter;
    LdapConstants.USERNAME_MATCH usernameMatch;
    boolean createUsersFromLdap;
    boolean enableAllFolders;
    List<String> enabledFolders;
    int connectTimeoutMs;
    long operationTimeoutMs;
    int referralHopLimit;

    public boolean isAdminCheckEnabled() {
        return adminFilter != null
                && !adminFilter.isEmpty()
                && !LdapConstants.ADMIN_FILTER_DISABLED.equals(adminFilter);
    }

    public ReferralCredential getServiceCredential() {
        return new ReferralCredential(bindDn, bindPassword);
    }

    public String[] getUsernameAttributeArray() {
        return usernameAttributes.toArray(new String[0]);
    }
}
