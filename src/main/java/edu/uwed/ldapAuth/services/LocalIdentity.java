package edu.uwed.ldapAuth.services;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class LocalIdentity implements Identity {
    private final String username;
    private boolean administrator;
    private boolean enableAllFolders = true;
    private List<String> enabledFolders = new ArrayList<>();

    public static LocalIdentity copyOf(Identity identity) {
        LocalIdentity copy = new LocalIdentity(identity.getUsername());
        copy.setAdministrator(identity.isAdministrator());
        copy.setEnableAllFolders(identity.isEnableAllFolders());
        if (identity.getEnabledFolders() != null) {
            copy.setEnabledFolders(new ArrayList<>(identity.getEnabledFolders()));
        }
        return copy;
    }
}
