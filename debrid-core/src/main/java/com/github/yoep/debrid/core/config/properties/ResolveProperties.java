package com.github.yoep.debrid.core.config.properties;

import lombok.Data;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

@Data
public class ResolveProperties {
    /**
     * The max. duration of a single resolve at a provider.
     */
    @NotNull
    private Duration timeout = Duration.ofMinutes(2);

    /**
     * The max. number of distinct resolves which are executed at the same time.
     */
    @Min(1)
    private int maxConcurrent = 20;

    /**
     * The time a resolved url is kept in the cache.
     */
    @NotNull
    private Duration cacheTtl = Duration.ofHours(3);

    /**
     * The time a static response url is kept in the cache.
     * This is kept short as the content might become available in the meantime.
     */
    @NotNull
    private Duration staticCacheTtl = Duration.ofMinutes(1);

    /**
     * The max. number of resolved urls within the cache.
     */
    @Min(1)
    private long cacheSize = 10000;
}
