package edu.uwed.ldapAuth.ldap;

public class LdapConstants {

    // admin-filter value that switches the administrator check off
    public static final String ADMIN_FILTER_DISABLED = "_disabled_";

    public static final String SEARCH_ALL_FILTER = "(objectClass=*)";

    private LdapConstants() {
    }

    public enum LDAP_PROTOCOL {
        LDAP, LDAPS, LDAP_TLS
    }

    public enum USERNAME_MATCH {
        EXACT {
            @Override
            public boolean matches(String requested, String candidate) {
                return requested.equals(candidate);
            }
        },
        CASE_INSENSITIVE {
            @Override
            public boolean matches(String requested, String candidate) {
                return requested.equalsIgnoreCase(candidate);
            }
        };

        public abstract boolean matches(String requested, String candidate);
    }
}
