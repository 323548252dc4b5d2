package com.github.yoep.debrid.adapter.model;

import lombok.Builder;

/**
 * An item within the catalog of a provider, e.g. a download of the user.
 */
@Builder
public record CatalogItem(String id, String type, String name, String poster) {
}
