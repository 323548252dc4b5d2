package com.github.yoep.debrid.core.resolve;

import com.github.yoep.debrid.adapter.AccessDeniedException;
import com.github.yoep.debrid.adapter.DebridProvider;
import com.github.yoep.debrid.adapter.InvalidCredentialException;
import com.github.yoep.debrid.adapter.StaticResponse;
import com.github.yoep.debrid.adapter.cache.ResolvedUrlCache;
import com.github.yoep.debrid.adapter.model.ResolveRequest;
import com.github.yoep.debrid.core.credentials.CredentialGuard;
import com.github.yoep.debrid.core.utils.FutureUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.text.MessageFormat;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves torrent content at a provider while guaranteeing that at most one resolve is in progress per deduplication key.
 * <p>
 * Identical requests which arrive while a resolve is in progress attach to the outcome of that resolve.
 * The resolves are executed on the given executor, which bounds the number of distinct resolves running at the same time.
 * Each resolve is guarded by a timeout, after which the {@link StaticResponse#FAILED_UNEXPECTED} result is returned.
 */
@Slf4j
public class SingleFlightResolver {
    private final Map<String, CompletableFuture<ResolveResult>> inFlight = new ConcurrentHashMap<>();
    private final ResolvedUrlCache cache;
    private final CredentialGuard credentialGuard;
    private final Executor executor;
    private final Duration timeout;

    public SingleFlightResolver(ResolvedUrlCache cache, CredentialGuard credentialGuard, Executor executor, Duration timeout) {
        Assert.notNull(cache, "cache cannot be null");
        Assert.notNull(credentialGuard, "credentialGuard cannot be null");
        Assert.notNull(executor, "executor cannot be null");
        Assert.notNull(timeout, "timeout cannot be null");
        this.cache = cache;
        this.credentialGuard = credentialGuard;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Resolve the given request with the provider.
     *
     * @param request  The request to resolve.
     * @param provider The provider to resolve the request with.
     * @return Returns the outcome of the resolve.
     */
    public CompletableFuture<ResolveResult> resolve(ResolveRequest request, DebridProvider provider) {
        Assert.notNull(request, "request cannot be null");
        Assert.notNull(provider, "provider cannot be null");
        var key = request.deduplicationKey();
        var future = new CompletableFuture<ResolveResult>();
        var existing = inFlight.putIfAbsent(key, future);

        if (existing != null) {
            log.debug("Resolve of {} at {} is already in progress, awaiting its outcome", request.infoHash(), request.providerKey());
            return existing.copy();
        }

        try {
            executor.execute(() -> doResolve(key, request, provider, future));
        } catch (RejectedExecutionException ex) {
            log.error("Failed to schedule resolve of {}, {}", request.infoHash(), ex.getMessage(), ex);
            fail(key, future, new ResolveException("Resolve could not be scheduled", ex));
        }

        return future.copy();
    }

    /**
     * Get the number of resolves which are currently in progress.
     *
     * @return Returns the number of distinct in-flight resolves.
     */
    public int getInFlightCount() {
        return inFlight.size();
    }

    private void doResolve(String key, ResolveRequest request, DebridProvider provider, CompletableFuture<ResolveResult> future) {
        log.trace("Resolving {} at {}", request.infoHash(), request.providerKey());
        try {
            var url = cache.getOrCompute(key, () -> provider.resolve(request))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);

            log.debug("Resolved {} at {}", request.infoHash(), request.providerKey());
            complete(key, future, ResolveResult.from(url));
        } catch (TimeoutException ex) {
            log.warn("Resolve of {} at {} didn't complete within {}", request.infoHash(), request.providerKey(), timeout);
            complete(key, future, ResolveResult.failed(StaticResponse.FAILED_UNEXPECTED));
        } catch (InterruptedException ex) {
            log.debug("Resolve of {} got interrupted", request.infoHash());
            Thread.currentThread().interrupt();
            complete(key, future, ResolveResult.failed(StaticResponse.FAILED_UNEXPECTED));
        } catch (ExecutionException ex) {
            handleFailure(key, request, ex.getCause() != null ? ex.getCause() : ex, future);
        } catch (RuntimeException ex) {
            handleFailure(key, request, ex, future);
        }
    }

    private void handleFailure(String key, ResolveRequest request, Throwable throwable, CompletableFuture<ResolveResult> future) {
        var cause = FutureUtils.unwrap(throwable);

        if (cause instanceof InvalidCredentialException) {
            log.warn("Credential has been rejected while resolving {} at {}", request.infoHash(), request.providerKey());
            credentialGuard.blacklist(request.credential(), request.providerKey());
            complete(key, future, ResolveResult.failed(StaticResponse.FAILED_ACCESS));
        } else if (cause instanceof AccessDeniedException) {
            log.warn("Access has been denied while resolving {} at {}", request.infoHash(), request.providerKey());
            complete(key, future, ResolveResult.failed(StaticResponse.FAILED_ACCESS));
        } else {
            log.error("Failed to resolve {} at {}, {}", request.infoHash(), request.providerKey(), cause.getMessage(), cause);
            fail(key, future, new ResolveException(
                    MessageFormat.format("Failed to resolve {0} at {1}", request.infoHash(), request.providerKey()), cause));
        }
    }

    // the key is released before completion so callers reacting to the outcome start a new resolve
    private void complete(String key, CompletableFuture<ResolveResult> future, ResolveResult result) {
        inFlight.remove(key, future);
        future.complete(result);
    }

    private void fail(String key, CompletableFuture<ResolveResult> future, Throwable throwable) {
        inFlight.remove(key, future);
        future.completeExceptionally(throwable);
    }
}
