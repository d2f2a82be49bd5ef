package edu.uwed.ldapAuth.configuration;

import edu.uwed.ldapAuth.services.IdentityStore;
import edu.uwed.ldapAuth.services.InMemoryIdentityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LdapConfig {

    private static final Logger logger = LoggerFactory.getLogger(LdapConfig.class);

    // hosts that persist identities elsewhere register their own IdentityStore bean
    @Bean
    @ConditionalOnMissingBean(IdentityStore.class)
    public IdentityStore identityStore() {
        logger.info("No IdentityStore bean supplied, keeping local identities in memory");
        return new InMemoryIdentityStore();
    }
}
