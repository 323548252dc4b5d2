package com.github.yoep.debrid.adapter.cache;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Cache which stores the resolved urls of resolve requests.
 * Implementations must guarantee that the compute function is invoked at most once at a time for the same key.
 */
public interface ResolvedUrlCache {
    /**
     * Get the cached url of the given key, or compute it when it's not cached.
     * A failed computation should not be stored in the cache.
     *
     * @param key     The key of the resolved url.
     * @param compute The function which resolves the url when it's absent.
     * @return Returns the cached or computed url.
     */
    CompletableFuture<String> getOrCompute(String key, Supplier<CompletableFuture<String>> compute);
}
