package com.github.yoep.debrid.adapter.model;

import lombok.Builder;

/**
 * The availability of a single torrent at a provider.
 *
 * @param cached Indicates if the content is instantly available at the provider.
 * @param url    The provider-local path which identifies the content for a later resolve, or null.
 */
@Builder
public record CachedEntry(boolean cached, String url) {
    public static CachedEntry cached(String url) {
        return new CachedEntry(true, url);
    }

    public static CachedEntry uncached(String url) {
        return new CachedEntry(false, url);
    }
}
