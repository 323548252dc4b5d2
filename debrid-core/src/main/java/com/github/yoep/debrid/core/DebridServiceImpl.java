package com.github.yoep.debrid.core;

import com.github.yoep.debrid.adapter.InvalidCredentialException;
import com.github.yoep.debrid.adapter.StaticResponse;
import com.github.yoep.debrid.adapter.model.CatalogItem;
import com.github.yoep.debrid.adapter.model.ItemMeta;
import com.github.yoep.debrid.adapter.model.ResolveRequest;
import com.github.yoep.debrid.adapter.model.StreamCandidate;
import com.github.yoep.debrid.core.credentials.CredentialGuard;
import com.github.yoep.debrid.core.meta.ItemMetaEnricher;
import com.github.yoep.debrid.core.meta.ItemMetaHelper;
import com.github.yoep.debrid.core.providers.ProviderDescriptor;
import com.github.yoep.debrid.core.providers.ProviderRegistry;
import com.github.yoep.debrid.core.resolve.SingleFlightResolver;
import com.github.yoep.debrid.core.streams.StreamAggregator;
import com.github.yoep.debrid.core.utils.FutureUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RequiredArgsConstructor
public class DebridServiceImpl implements DebridService {
    private final ProviderRegistry providerRegistry;
    private final CredentialGuard credentialGuard;
    private final StreamAggregator streamAggregator;
    private final SingleFlightResolver resolver;
    private final ItemMetaEnricher itemMetaEnricher;

    //region DebridService

    @Override
    public boolean hasProviderConfigured(DebridConfiguration config) {
        if (config == null)
            return false;

        return providerRegistry.getKeys().stream()
                .anyMatch(e -> config.getCredential(e).isPresent());
    }

    @Override
    public CompletableFuture<List<StreamCandidate>> applyProviders(List<StreamCandidate> streams, DebridConfiguration config) {
        if (streams == null || streams.isEmpty() || !hasProviderConfigured(config)) {
            return CompletableFuture.completedFuture(streams);
        }

        return streamAggregator.applyProviders(streams, config);
    }

    @Override
    public CompletableFuture<String> resolve(ResolveRequest request) {
        if (request == null) {
            return CompletableFuture.failedFuture(new InvalidResolveRequestException("No resolve request passed"));
        }

        return FutureUtils.invoke(() -> doResolve(providerRegistry.getRequiredDescriptor(request.providerKey()), request));
    }

    @Override
    public CompletableFuture<List<CatalogItem>> getProviderCatalog(String providerKey, DebridConfiguration config) {
        return FutureUtils.invoke(() -> getCatalog(providerRegistry.getRequiredDescriptor(providerKey), config));
    }

    @Override
    public CompletableFuture<ItemMeta> getProviderItemMeta(String providerKey, String itemId, DebridConfiguration config) {
        return FutureUtils.invoke(() -> getItemMeta(providerRegistry.getRequiredDescriptor(providerKey), itemId, config));
    }

    //endregion

    //region Functions

    private CompletableFuture<String> doResolve(ProviderDescriptor descriptor, ResolveRequest request) {
        if (StringUtils.isEmpty(request.credential()) || StringUtils.isAnyBlank(request.infoHash(), request.host())) {
            log.warn("Unable to resolve {} at {}, required parameters are missing", request.infoHash(), descriptor.key());
            return CompletableFuture.failedFuture(new InvalidResolveRequestException("No valid parameters passed"));
        }
        if (!credentialGuard.isValid(request.credential(), descriptor.key())) {
            log.debug("Skipping resolve of {} at {}, credential is invalid", request.infoHash(), descriptor.key());
            return CompletableFuture.completedFuture(StaticResponse.FAILED_ACCESS.toUrl(request.host()));
        }

        return resolver.resolve(request, descriptor.provider())
                .thenApply(e -> e.toUrl(request.host()));
    }

    private CompletableFuture<List<CatalogItem>> getCatalog(ProviderDescriptor descriptor, DebridConfiguration config) {
        if (!descriptor.supportsCatalog()) {
            return CompletableFuture.failedFuture(new CatalogNotSupportedException(descriptor.key()));
        }
        if (config != null && config.hasOption(DebridOption.NO_CATALOG)) {
            log.debug("Catalog of {} has been disabled by the configuration", descriptor.key());
            return CompletableFuture.completedFuture(Collections.emptyList());
        }

        var credential = credentialOf(descriptor.key(), config);
        if (!credentialGuard.isValid(credential, descriptor.key())) {
            return CompletableFuture.failedFuture(new InvalidCredentialException(descriptor.key()));
        }

        var provider = descriptor.provider();
        return blacklistOnInvalidCredential(descriptor, credential,
                FutureUtils.invoke(() -> provider.getCatalog(credential, config.skip(), config.clientAddress())));
    }

    private CompletableFuture<ItemMeta> getItemMeta(ProviderDescriptor descriptor, String itemId, DebridConfiguration config) {
        var credential = credentialOf(descriptor.key(), config);
        var provider = descriptor.provider();
        var host = config != null ? config.host() : null;
        var clientAddress = config != null ? config.clientAddress() : null;

        return blacklistOnInvalidCredential(descriptor, credential,
                FutureUtils.invoke(() -> provider.getItemMeta(itemId, credential, clientAddress)))
                .thenCompose(itemMetaEnricher::enrich)
                .thenApply(meta -> ItemMetaHelper.rewriteStreamUrls(meta, host, descriptor.key()));
    }

    private <T> CompletableFuture<T> blacklistOnInvalidCredential(ProviderDescriptor descriptor, String credential, CompletableFuture<T> future) {
        return future.whenComplete((result, ex) -> {
            if (ex == null)
                return;

            var cause = FutureUtils.unwrap(ex);
            if (cause instanceof InvalidCredentialException) {
                credentialGuard.blacklist(credential, descriptor.key());
            }

            log.warn("Provider {} failed, {}", descriptor.displayName(), cause.getMessage());
        });
    }

    private static String credentialOf(String providerKey, DebridConfiguration config) {
        if (config == null)
            return null;

        return config.getCredential(providerKey).orElse(null);
    }

    //endregion
}
