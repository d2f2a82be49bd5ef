package edu.uwed.ldapAuth.services;

import java.util.List;

/**
 * Local user record. Only the administrator flag and the folder access settings are written
 * by directory authentication.
 */
public interface Identity {

    String getUsername();

    boolean isAdministrator();

    void setAdministrator(boolean administrator);

    boolean isEnableAllFolders();

    void setEnableAllFolders(boolean enableAllFolders);

    List<String> getEnabledFolders();

    void setEnabledFolders(List<String> enabledFolders);
}
