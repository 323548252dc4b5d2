package com.github.yoep.debrid.adapter.model;

import lombok.Builder;

import java.util.List;

/**
 * The metadata of a catalog item.
 *
 * @param id       The id of the item.
 * @param type     The type of the item, e.g. "other".
 * @param name     The name of the item.
 * @param infoHash The info hash of the torrent of the item, can be null.
 * @param videos   The videos which are contained within the item.
 */
@Builder(toBuilder = true)
public record ItemMeta(String id, String type, String name, String infoHash, List<MetaVideo> videos) {
}
