package com.github.yoep.debrid.core;

import com.github.yoep.debrid.adapter.model.CatalogItem;
import com.github.yoep.debrid.adapter.model.ItemMeta;
import com.github.yoep.debrid.adapter.model.ResolveRequest;
import com.github.yoep.debrid.adapter.model.StreamCandidate;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface DebridService {
    /**
     * Check if the configuration contains a credential for any of the registered providers.
     *
     * @param config The debrid configuration of the user.
     * @return Returns true when at least one provider is configured, else false.
     */
    boolean hasProviderConfigured(DebridConfiguration config);

    /**
     * Apply the configured providers on the given stream candidates.
     * The cached streams of the providers replace the candidates, uncached candidates might receive additional download streams.
     *
     * @param streams The stream candidates.
     * @param config  The debrid configuration of the user.
     * @return Returns the final list of streams.
     */
    CompletableFuture<List<StreamCandidate>> applyProviders(List<StreamCandidate> streams, DebridConfiguration config);

    /**
     * Resolve the given request into a playable url.
     * Failures which can be shown to the user result in the absolute url of a static response.
     *
     * @param request The resolve request.
     * @return Returns the url to redirect the client to.
     */
    CompletableFuture<String> resolve(ResolveRequest request);

    /**
     * Retrieve the catalog of the given provider.
     *
     * @param providerKey The key of the provider.
     * @param config      The debrid configuration of the user.
     * @return Returns the catalog items.
     */
    CompletableFuture<List<CatalogItem>> getProviderCatalog(String providerKey, DebridConfiguration config);

    /**
     * Retrieve the metadata of an item within the catalog of the given provider.
     *
     * @param providerKey The key of the provider.
     * @param itemId      The id of the catalog item.
     * @param config      The debrid configuration of the user.
     * @return Returns the item metadata with absolute stream urls.
     */
    CompletableFuture<ItemMeta> getProviderItemMeta(String providerKey, String itemId, DebridConfiguration config);
}
