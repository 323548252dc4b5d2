package com.github.yoep.debrid.core.resolve;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.yoep.debrid.adapter.StaticResponse;
import com.github.yoep.debrid.adapter.cache.ResolvedUrlCache;
import com.github.yoep.debrid.core.utils.FutureUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * In-memory {@link ResolvedUrlCache} backed by a Caffeine {@link AsyncCache}.
 * Concurrent lookups of the same key share a single computation, failed computations are discarded by the cache.
 */
@Slf4j
public class CaffeineResolvedUrlCache implements ResolvedUrlCache {
    private final AsyncCache<String, String> cache;

    public CaffeineResolvedUrlCache(long maximumSize, Duration ttl, Duration staticTtl) {
        Assert.notNull(ttl, "ttl cannot be null");
        Assert.notNull(staticTtl, "staticTtl cannot be null");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new ResolvedUrlExpiry(ttl.toNanos(), staticTtl.toNanos()))
                .buildAsync();
    }

    @Override
    public CompletableFuture<String> getOrCompute(String key, Supplier<CompletableFuture<String>> compute) {
        Assert.notNull(key, "key cannot be null");
        Assert.notNull(compute, "compute cannot be null");
        return cache.get(key, (k, executor) -> {
            log.trace("Resolved url of {} is not cached, resolving it", k);
            return FutureUtils.invoke(compute);
        });
    }

    private static class ResolvedUrlExpiry implements Expiry<String, String> {
        private final long ttlNanos;
        private final long staticTtlNanos;

        private ResolvedUrlExpiry(long ttlNanos, long staticTtlNanos) {
            this.ttlNanos = ttlNanos;
            this.staticTtlNanos = staticTtlNanos;
        }

        @Override
        public long expireAfterCreate(String key, String value, long currentTime) {
            return StaticResponse.isStaticUrl(value) ? staticTtlNanos : ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, String value, long currentTime, long currentDuration) {
            return expireAfterCreate(key, value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, String value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
