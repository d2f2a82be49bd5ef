package edu.uwed.ldapAuth.configuration;

import edu.uwed.ldapAuth.ldap.DirectoryConfiguration;
import edu.uwed.ldapAuth.ldap.LdapConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/*
local.ldap.directory.host=dc-01.example.com
local.ldap.directory.security=startTLS
local.ldap.directory.ignore-ssl-verification=false
local.ldap.directory.base-dn=dc=example,dc=com
local.ldap.directory.bind-dn=cn=service,dc=example,dc=com
local.ldap.directory.bind-password=secret
local.ldap.directory.search-filter=(objectClass=person)
local.ldap.directory.search-attributes=uid, mail
local.ldap.directory.username-attribute=uid
# _disabled_ (or empty) turns the administrator check off
local.ldap.directory.admin-filter=(memberOf=cn=admins,ou=groups,dc=example,dc=com)
local.ldap.directory.case-insensitive-username=true
local.ldap.directory.create-users-from-ldap=true
local.ldap.directory.enable-all-folders=false
local.ldap.directory.enabled-folders=movies,music
* */
@Configuration
@Data
public class ConfigProperties {

    @Bean
    @ConfigurationProperties(prefix = "local.ldap.directory")
    public DirectoryConfig getDirectoryConfig() {
        return new DirectoryConfig();
    }

    @Data
    public static class DirectoryConfig {
        private String host;
        private int ldapPort = 389;
        private int ldapsPort = 636;
        private String security = "none"; // none | (tls | startTLS) | (ldaps | ssl)
        private boolean ignoreSslVerification = false;
        private String baseDn;
        private String bindDn;
        private String bindPassword;
        private String searchFilter = "(uid=*)";
        private String searchAttributes = "uid, cn, mail, displayName";
        private String usernameAttribute = "uid";
        private String adminFilter = LdapConstants.ADMIN_FILTER_DISABLED;
        private boolean caseInsensitiveUsername = false;
        private boolean createUsersFromLdap = true;
        private boolean enableAllFolders = true;
        private List<String> enabledFolders = new ArrayList<>();
        private int connectTimeoutMs = 5000;
        private long operationTimeoutMs = 10000;
        private int referralHopLimit = 5;

        public boolean isStartTls() {
            return "startTLS".equalsIgnoreCase(security) || "tls".equalsIgnoreCase(security);
        }

        public boolean isLdaps() {
            return "ldaps".equalsIgnoreCase(security) || "ssl".equalsIgnoreCase(security);
        }

        public LdapConstants.LDAP_PROTOCOL getProto() {
            if (isStartTls()) return LdapConstants.LDAP_PROTOCOL.LDAP_TLS;
            if (isLdaps()) return LdapConstants.LDAP_PROTOCOL.LDAPS;
            return LdapConstants.LDAP_PROTOCOL.LDAP;
        }

        public void setSecurity(String security) {
            if (!StringUtils.hasText(security)) {
                this.security = "none";
                return;
            }
            switch (security.trim().toLowerCase()) {
                case "none":
                case "tls":
                case "starttls":
                case "ldaps":
                case "ssl":
                    this.security = security.trim();
                    break;
                default:
                    throw new IllegalArgumentException(
                            String.format("Invalid security value '%s'. Expected one of: none, startTLS, tls, ldaps, ssl", security)
                    );
            }
        }

        /**
         * Copies the current property values into an immutable snapshot. Every authentication
         * attempt works against one snapshot, so a property refresh mid-attempt is never observed.
         */
        public DirectoryConfiguration snapshot() {
            return DirectoryConfiguration.builder()
                    .host(host)
                    .port(isLdaps() ? ldapsPort : ldapPort)
                    .protocol(getProto())
                    .skipCertificateVerification(ignoreSslVerification)
                    .baseDn(baseDn == null ? "" : baseDn)
                    .bindDn(bindDn == null ? "" : bindDn)
                    .bindPassword(bindPassword == null ? "" : bindPassword)
                    .searchFilter(searchFilter)
                    .usernameAttributes(parseAttributeList(searchAttributes))
                    .usernameAttribute(usernameAttribute)
                    .adminFilter(adminFilter)
                    .usernameMatch(caseInsensitiveUsername
                            ? LdapConstants.USERNAME_MATCH.CASE_INSENSITIVE
                            : LdapConstants.USERNAME_MATCH.EXACT)
                    .createUsersFromLdap(createUsersFromLdap)
                    .enableAllFolders(enableAllFolders)
                    .enabledFolders(enabledFolders == null ? List.of() : List.copyOf(enabledFolders))
                    .connectTimeoutMs(connectTimeoutMs)
                    .operationTimeoutMs(operationTimeoutMs)
                    .referralHopLimit(referralHopLimit)
                    .build();
        }

        // "uid, mail ,cn" -> [uid, mail, cn]
        static List<String> parseAttributeList(String attributes) {
            if (!StringUtils.hasText(attributes)) {
                return List.of();
            }
            return Arrays.stream(attributes.replaceAll("\\s", "").split(","))
                    .filter(name -> !name.isEmpty())
                    .toList();
        }
    }
}
