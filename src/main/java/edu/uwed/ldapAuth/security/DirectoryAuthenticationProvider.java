package edu.uwed.ldapAuth.security;

import edu.uwed.ldapAuth.services.AuthenticationOutcome;
import edu.uwed.ldapAuth.services.DirectoryAuthenticationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Security entry point: every username/password login is checked against the directory.
 */
@Component
public class DirectoryAuthenticationProvider implements AuthenticationProvider {

    public static final String ROLE_USER = "ROLE_USER";
    public static final String ROLE_ADMIN = "ROLE_ADMIN";

    private final DirectoryAuthenticationService authenticationService;

    @Autowired
    public DirectoryAuthenticationProvider(DirectoryAuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @Override
    public Authentication authenticate(Authentication authentication) throws AuthenticationException {
        String username = authentication.getName();
        String password = authentication.getCredentials() == null ? "" : authentication.getCredentials().toString();

        AuthenticationOutcome outcome = authenticationService.authenticate(username, password);

        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority(ROLE_USER));
        if (outcome.isAdministrator()) {
            authorities.add(new SimpleGrantedAuthority(ROLE_ADMIN));
        }
        UsernamePasswordAuthenticationToken result =
                UsernamePasswordAuthenticationToken.authenticated(outcome.getUsername(), null, authorities);
        result.setDetails(outcome);
        return result;
    }

    @Override
    public boolean supports(Class<?> authentication) {
        return UsernamePasswordAuthenticationToken.class.isAssignableFrom(authentication);
    }
}
