package edu.uwed.ldapAuth.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * HTTP basic over the directory. The {@code DirectoryAuthenticationProvider} bean is picked up
 * by the global authentication manager, so it is not registered on the filter chain again.
 */
@Configuration
public class WebSecurityConfig {
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .authorizeHttpRequests(authorize -> authorize
            .requestMatchers("/test-ldap", "/api/ldap/**").hasRole("ADMIN")
            .anyRequest().authenticated()
            )
            .httpBasic(httpBasic -> httpBasic.realmName("LDAP"));
        return http.build();
    }
}
