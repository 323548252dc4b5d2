package com.github.yoep.debrid.adapter;

import com.github.yoep.debrid.adapter.model.CachedEntry;
import com.github.yoep.debrid.adapter.model.CatalogItem;
import com.github.yoep.debrid.adapter.model.ItemMeta;
import com.github.yoep.debrid.adapter.model.ResolveRequest;
import com.github.yoep.debrid.adapter.model.StreamCandidate;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The capabilities of a debrid provider.
 * <p>
 * Each operation reports its failure by completing the returned future exceptionally.
 * Authentication failures use {@link InvalidCredentialException}, expired or missing subscriptions use {@link AccessDeniedException},
 * any other exception is considered a transport or parsing failure of the provider.
 */
public interface DebridProvider {
    /**
     * Get the type of this provider.
     *
     * @return Returns the provider type.
     */
    ProviderType getType();

    /**
     * Check which of the given stream candidates are already cached by the provider.
     *
     * @param candidates The stream candidates to look up.
     * @param credential The credential of the user for this provider.
     * @return Returns the cached entries mapped by the info hash of the candidate.
     */
    CompletableFuture<Map<String, CachedEntry>> getCachedStreams(List<StreamCandidate> candidates, String credential);

    /**
     * Resolve the given request into a directly playable url.
     * The result might also be the path of a {@link StaticResponse} when the provider can't serve the content (yet).
     *
     * @param request The resolve request.
     * @return Returns the resolved url.
     */
    CompletableFuture<String> resolve(ResolveRequest request);

    /**
     * Retrieve the downloads of the user as catalog items.
     * This is only supported when {@link ProviderType#isCatalogSupported()} is true.
     *
     * @param credential    The credential of the user for this provider.
     * @param skip          The number of items to skip.
     * @param clientAddress The address of the client requesting the catalog.
     * @return Returns the catalog page.
     */
    CompletableFuture<List<CatalogItem>> getCatalog(String credential, int skip, String clientAddress);

    /**
     * Retrieve the metadata of a single catalog item.
     * The stream urls within the metadata are allowed to be relative to the provider.
     *
     * @param itemId        The id of the catalog item.
     * @param credential    The credential of the user for this provider.
     * @param clientAddress The address of the client requesting the item.
     * @return Returns the item metadata.
     */
    CompletableFuture<ItemMeta> getItemMeta(String itemId, String credential, String clientAddress);
}
