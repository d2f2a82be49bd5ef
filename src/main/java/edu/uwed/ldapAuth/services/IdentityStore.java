package edu.uwed.ldapAuth.services;

import java.util.Optional;

public interface IdentityStore {

    Optional<Identity> findByUsername(String username);

    /**
     * Creates an empty record for {@code username}.
     *
     * @throws DuplicateIdentityException if a record with that username already exists
     */
    Identity createUsername(String username);

    void updateIdentity(Identity identity);
}
