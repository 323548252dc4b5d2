package com.github.yoep.debrid.core.streams;

import com.github.yoep.debrid.adapter.model.CachedEntry;
import com.github.yoep.debrid.core.providers.ProviderDescriptor;

import java.util.Map;
import java.util.Optional;

/**
 * The outcome of a cached streams lookup at a single provider.
 *
 * @param descriptor The provider which has been queried.
 * @param credential The credential which has been used for the lookup.
 * @param entries    The cached entries by info hash, null when the lookup failed.
 * @param error      The failure of the lookup, null when the lookup succeeded.
 */
record ProviderLookupResult(ProviderDescriptor descriptor, String credential, Map<String, CachedEntry> entries, Throwable error) {
    static ProviderLookupResult success(ProviderDescriptor descriptor, String credential, Map<String, CachedEntry> entries) {
        return new ProviderLookupResult(descriptor, credential, entries, null);
    }

    static ProviderLookupResult failure(ProviderDescriptor descriptor, String credential, Throwable error) {
        return new ProviderLookupResult(descriptor, credential, null, error);
    }

    boolean isSuccess() {
        return error == null;
    }

    Optional<CachedEntry> getEntry(String infoHash) {
        if (entries == null || infoHash == null)
            return Optional.empty();

        return Optional.ofNullable(entries.get(infoHash));
    }

    boolean isCached(String infoHash) {
        return getEntry(infoHash)
                .map(CachedEntry::cached)
                .orElse(false);
    }
}
