package com.github.yoep.debrid.core.streams;

import com.github.yoep.debrid.adapter.InvalidCredentialException;
import com.github.yoep.debrid.adapter.model.CachedEntry;
import com.github.yoep.debrid.adapter.model.StreamCandidate;
import com.github.yoep.debrid.core.DebridConfiguration;
import com.github.yoep.debrid.core.credentials.CredentialGuard;
import com.github.yoep.debrid.core.errors.ErrorClassifier;
import com.github.yoep.debrid.core.providers.ProviderDescriptor;
import com.github.yoep.debrid.core.providers.ProviderRegistry;
import com.github.yoep.debrid.core.utils.FutureUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.util.Assert;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Merges the cached streams of the configured providers into the stream candidates.
 * <p>
 * All configured providers are queried at the same time, their results are applied in registry order.
 * When a provider fails with a failure which can be shown to the user, only the error streams are returned.
 */
@Slf4j
public class StreamAggregator {
    private final ProviderRegistry providerRegistry;
    private final CredentialGuard credentialGuard;
    private final ErrorClassifier errorClassifier;

    public StreamAggregator(ProviderRegistry providerRegistry, CredentialGuard credentialGuard, ErrorClassifier errorClassifier) {
        Assert.notNull(providerRegistry, "providerRegistry cannot be null");
        Assert.notNull(credentialGuard, "credentialGuard cannot be null");
        Assert.notNull(errorClassifier, "errorClassifier cannot be null");
        this.providerRegistry = providerRegistry;
        this.credentialGuard = credentialGuard;
        this.errorClassifier = errorClassifier;
    }

    /**
     * Apply the configured providers on the given stream candidates.
     *
     * @param candidates The stream candidates.
     * @param config     The debrid configuration of the user.
     * @return Returns the final streams, or the given candidates when no provider is configured.
     */
    public CompletableFuture<List<StreamCandidate>> applyProviders(List<StreamCandidate> candidates, DebridConfiguration config) {
        if (candidates == null || candidates.isEmpty() || config == null) {
            return CompletableFuture.completedFuture(candidates);
        }

        var providers = configuredProviders(config);
        if (providers.isEmpty()) {
            return CompletableFuture.completedFuture(candidates);
        }

        log.debug("Looking up {} stream candidates at providers {}", candidates.size(), providers.stream()
                .map(ProviderDescriptor::key)
                .collect(Collectors.toList()));
        var input = Collections.unmodifiableList(new ArrayList<>(candidates));
        var lookups = providers.stream()
                .map(e -> lookup(e, input, config.getCredential(e.key()).orElse(null)))
                .collect(Collectors.toList());

        return CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0]))
                .thenApply(e -> lookups.stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.toList()))
                .thenApply(results -> processResults(input, config, results));
    }

    private List<ProviderDescriptor> configuredProviders(DebridConfiguration config) {
        return providerRegistry.getDescriptors().stream()
                .filter(e -> config.getCredential(e.key()).isPresent())
                .collect(Collectors.toList());
    }

    private CompletableFuture<ProviderLookupResult> lookup(ProviderDescriptor descriptor, List<StreamCandidate> candidates, String credential) {
        if (!credentialGuard.isValid(credential, descriptor.key())) {
            log.debug("Skipping provider {}, credential is invalid", descriptor.key());
            return CompletableFuture.completedFuture(ProviderLookupResult.failure(descriptor, credential, new InvalidCredentialException(descriptor.key())));
        }

        return FutureUtils.invoke(() -> descriptor.provider().getCachedStreams(candidates, credential))
                .handle((entries, ex) -> {
                    if (ex != null) {
                        var cause = FutureUtils.unwrap(ex);

                        if (cause instanceof InvalidCredentialException) {
                            credentialGuard.blacklist(credential, descriptor.key());
                        }

                        log.warn("Failed to retrieve cached streams of {}, {}", descriptor.displayName(), cause.getMessage(), cause);
                        return ProviderLookupResult.failure(descriptor, credential, cause);
                    }

                    return ProviderLookupResult.success(descriptor, credential, entries != null ? entries : Collections.emptyMap());
                });
    }

    private List<StreamCandidate> processResults(List<StreamCandidate> candidates, DebridConfiguration config, List<ProviderLookupResult> results) {
        var errorStreams = results.stream()
                .filter(e -> !e.isSuccess())
                .map(e -> errorClassifier.classify(e.descriptor(), e.error(), config.host()))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());

        if (!errorStreams.isEmpty()) {
            log.debug("Returning {} error streams instead of the provider streams", errorStreams.size());
            return errorStreams;
        }

        var lookups = results.stream()
                .filter(ProviderLookupResult::isSuccess)
                .collect(Collectors.toList());
        var streams = populateCachedLinks(candidates, lookups, config);

        if (!config.isExcludeDownloadLinks()) {
            streams.addAll(createDownloadLinks(candidates, lookups, config));
        }
        if (config.isIncludeTorrentLinks()) {
            return streams;
        }

        return streams.stream()
                .filter(StreamCandidate::hasUrl)
                .collect(Collectors.toList());
    }

    private List<StreamCandidate> populateCachedLinks(List<StreamCandidate> candidates, List<ProviderLookupResult> lookups, DebridConfiguration config) {
        var streams = new ArrayList<StreamCandidate>(candidates.size());

        for (StreamCandidate candidate : candidates) {
            var stream = candidate;

            // the last provider which has the candidate cached takes the slot
            for (ProviderLookupResult lookup : lookups) {
                if (candidate.hasInfoHash() && lookup.isCached(candidate.infoHash())) {
                    stream = providerStream(candidate, lookup, "[" + lookup.descriptor().shortName() + "+] ", config);
                }
            }

            streams.add(stream);
        }

        return streams;
    }

    private List<StreamCandidate> createDownloadLinks(List<StreamCandidate> candidates, List<ProviderLookupResult> lookups, DebridConfiguration config) {
        var poolSize = candidates.size();
        var streams = new ArrayList<StreamCandidate>();

        candidates.stream()
                .filter(StreamCandidate::hasInfoHash)
                .filter(e -> lookups.stream().noneMatch(lookup -> lookup.isCached(e.infoHash())))
                .filter(e -> StreamHelper.isHealthyForDebrid(e, poolSize))
                .forEach(candidate -> lookups.forEach(lookup ->
                        streams.add(providerStream(candidate, lookup, "[" + lookup.descriptor().shortName() + " download] ", config))));

        log.trace("Created {} download streams", streams.size());
        return streams;
    }

    private static StreamCandidate providerStream(StreamCandidate candidate, ProviderLookupResult lookup, String prefix, DebridConfiguration config) {
        return StreamCandidate.builder()
                .name(prefix + candidate.name())
                .title(candidate.title())
                .url(providerUrl(candidate, lookup, config))
                .behaviorHints(candidate.behaviorHints())
                .build();
    }

    private static String providerUrl(StreamCandidate candidate, ProviderLookupResult lookup, DebridConfiguration config) {
        var uriBuilder = UriComponentsBuilder.fromHttpUrl(config.host())
                .pathSegment(lookup.descriptor().key());

        lookup.getEntry(candidate.infoHash())
                .map(CachedEntry::url)
                .filter(StringUtils::isNotEmpty)
                .ifPresentOrElse(uriBuilder::path,
                        () -> uriBuilder.pathSegment(lookup.credential(), candidate.infoHash(), String.valueOf(candidate.fileIndex())));

        return uriBuilder
                .pathSegment(StreamHelper.filename(candidate))
                .build()
                .toUriString();
    }
}
