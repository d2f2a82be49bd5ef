package edu.uwed.ldapAuth.controllers;

import edu.uwed.ldapAuth.services.DirectoryAuthenticationService;
import edu.uwed.ldapAuth.services.DirectoryDiagnosticsService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class LdapTestController {

    private final DirectoryDiagnosticsService diagnosticsService;
    private final DirectoryAuthenticationService authenticationService;

    @Autowired
    public LdapTestController(
            DirectoryDiagnosticsService diagnosticsService,
            DirectoryAuthenticationService authenticationService
    ) {
        this.diagnosticsService = diagnosticsService;
        this.authenticationService = authenticationService;
    }

    @GetMapping(value = "/test-ldap", produces = MediaType.TEXT_PLAIN_VALUE)
    public String testLdapConnection() {
        return diagnosticsService.testConnection();
    }

    @GetMapping(value = "/api/ldap/users", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<String> filteredUsers(@RequestParam String filter) {
        return authenticationService.getFilteredUsers(filter);
    }
}
