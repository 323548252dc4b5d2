package com.github.yoep.debrid.core.credentials;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only set of provider credentials which are known to be invalid.
 * The blacklist only lives in memory and is reset when the application restarts.
 */
public class CredentialBlacklist {
    private static final String SEPARATOR = "|";

    private final Set<String> entries = ConcurrentHashMap.newKeySet();

    /**
     * Add the credential of the given provider to the blacklist.
     *
     * @param providerKey The provider key.
     * @param credential  The invalid credential.
     * @return Returns true when the credential wasn't blacklisted before, else false.
     */
    public boolean add(String providerKey, String credential) {
        return entries.add(entryOf(providerKey, credential));
    }

    public boolean contains(String providerKey, String credential) {
        return entries.contains(entryOf(providerKey, credential));
    }

    public void clear() {
        entries.clear();
    }

    private static String entryOf(String providerKey, String credential) {
        return providerKey + SEPARATOR + credential;
    }
}
