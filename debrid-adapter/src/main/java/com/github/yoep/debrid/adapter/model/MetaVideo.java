package com.github.yoep.debrid.adapter.model;

import lombok.Builder;

import java.util.List;

/**
 * A single video of a catalog item.
 *
 * @param id       The id of the video.
 * @param title    The title of the video.
 * @param released The release date of the video in ISO format, can be null.
 * @param infoHash The info hash of the torrent which contains the video, can be null.
 * @param streams  The streams of the video, their urls might be relative to the provider.
 */
@Builder(toBuilder = true)
public record MetaVideo(String id, String title, String released, String infoHash, List<StreamCandidate> streams) {
}
