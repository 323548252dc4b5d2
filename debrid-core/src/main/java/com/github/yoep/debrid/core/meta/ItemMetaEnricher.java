package com.github.yoep.debrid.core.meta;

import com.github.yoep.debrid.adapter.model.ItemMeta;

import java.util.concurrent.CompletableFuture;

/**
 * Enriches the metadata of a provider catalog item, e.g. with the information of the known torrents.
 */
@FunctionalInterface
public interface ItemMetaEnricher {
    /**
     * Enrich the given item metadata.
     *
     * @param meta The metadata returned by the provider.
     * @return Returns the enriched metadata.
     */
    CompletableFuture<ItemMeta> enrich(ItemMeta meta);

    /**
     * Get an enricher which returns the metadata unmodified.
     *
     * @return Returns the pass-through enricher.
     */
    static ItemMetaEnricher passThrough() {
        return CompletableFuture::completedFuture;
    }
}
