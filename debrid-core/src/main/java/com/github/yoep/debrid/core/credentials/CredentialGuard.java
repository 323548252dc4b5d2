package com.github.yoep.debrid.core.credentials;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

/**
 * Filters provider credentials which are known to be invalid before the provider is contacted.
 * A credential is only blacklisted after the provider rejected it, valid credentials are never rejected upfront.
 */
@Slf4j
public class CredentialGuard {
    private final CredentialBlacklist blacklist;
    private final int minCredentialLength;

    public CredentialGuard(CredentialBlacklist blacklist, int minCredentialLength) {
        Assert.notNull(blacklist, "blacklist cannot be null");
        this.blacklist = blacklist;
        this.minCredentialLength = minCredentialLength;
    }

    /**
     * Check if the given credential might be valid for the provider.
     *
     * @param credential  The credential to verify.
     * @param providerKey The key of the provider the credential belongs to.
     * @return Returns false when the credential is malformed or blacklisted, else true.
     */
    public boolean isValid(String credential, String providerKey) {
        if (credential == null || credential.length() < minCredentialLength) {
            log.trace("Credential of provider {} is shorter than {} characters", providerKey, minCredentialLength);
            return false;
        }

        return !blacklist.contains(providerKey, credential);
    }

    /**
     * Blacklist the given credential for the provider.
     * Blacklisting an already blacklisted credential has no effect.
     *
     * @param credential  The credential which has been rejected by the provider.
     * @param providerKey The key of the provider.
     */
    public void blacklist(String credential, String providerKey) {
        if (credential == null)
            return;

        if (blacklist.add(providerKey, credential)) {
            log.info("Blacklisting invalid credential {} of provider {}", mask(credential), providerKey);
        }
    }

    private static String mask(String credential) {
        var visible = Math.min(4, credential.length());
        return credential.substring(0, visible) + "***";
    }
}
