package edu.uwed.ldapAuth.ldap;

import lombok.ToString;
import lombok.Value;

/**
 * The identity a connection is bound with during one phase of an authentication attempt.
 * Referred servers are bound with the same identity.
 */
@Value
public class ReferralCredential {
    String dn;
    @ToString.Exclude
    String password;

    public boolean isAnonymous() {
        return dn == null || dn.isEmpty();
    }
}
