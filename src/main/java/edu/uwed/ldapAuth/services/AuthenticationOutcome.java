package edu.uwed.ldapAuth.services;

import lombok.Value;

import java.util.List;

@Value
public class AuthenticationOutcome {
    String username;
    boolean administrator;
    boolean enableAllFolders;
    List<String> enabledFolders;

    public static AuthenticationOutcome of(String username, Identity identity) {
        return new AuthenticationOutcome(
                username,
                identity.isAdministrator(),
                identity.isEnableAllFolders(),
                identity.getEnabledFolders() == null ? List.of() : List.copyOf(identity.getEnabledFolders())
        );
    }
}
