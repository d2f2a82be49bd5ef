package edu.uwed.ldapAuth.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Identity store kept in process memory. Callers get copies, so changes only stick through
 * {@link #updateIdentity(Identity)}.
 */
public class InMemoryIdentityStore implements IdentityStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryIdentityStore.class);

    private final ConcurrentMap<String, LocalIdentity> identities = new ConcurrentHashMap<>();

    @Override
    public Optional<Identity> findByUsername(String username) {
        LocalIdentity identity = identities.get(username);
        return identity == null ? Optional.empty() : Optional.of(LocalIdentity.copyOf(identity));
    }

    @Override
    public Identity createUsername(String username) {
        LocalIdentity identity = new LocalIdentity(username);
        if (identities.putIfAbsent(username, identity) != null) {
            throw new DuplicateIdentityException(username);
        }
        logger.debug("Created identity {}", username);
        return LocalIdentity.copyOf(identity);
    }

    @Override
    public void updateIdentity(Identity identity) {
        if (identities.replace(identity.getUsername(), LocalIdentity.copyOf(identity)) == null) {
            throw new IllegalArgumentException("No identity to update: " + identity.getUsername());
        }
        logger.debug("Updated identity {}", identity.getUsername());
    }

    public int size() {
        return identities.size();
    }
}
