package edu.uwed.ldapAuth.services;

public class DuplicateIdentityException extends RuntimeException {

    public DuplicateIdentityException(String username) {
        super("Identity already exists: " + username);
    }
}
