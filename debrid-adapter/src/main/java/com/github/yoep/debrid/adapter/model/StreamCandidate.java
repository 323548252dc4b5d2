package com.github.yoep.debrid.adapter.model;

import lombok.Builder;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * A stream which can be offered to the user.
 *
 * @param infoHash      The info hash of the torrent content, or null when the stream isn't torrent based (anymore).
 * @param fileIndex     The index of the file within the torrent, or null when unknown.
 * @param name          The name of the stream, shown as source label.
 * @param title         The human-readable description which may contain the seeders and quality hints.
 * @param url           The playable url, or null when the stream hasn't been resolved.
 * @param behaviorHints Metadata which is passed along untouched.
 */
@Builder(toBuilder = true)
public record StreamCandidate(String infoHash,
                              Integer fileIndex,
                              String name,
                              String title,
                              String url,
                              Map<String, Object> behaviorHints) {
    /**
     * Check if this stream identifies torrent content.
     *
     * @return Returns true when the info hash is present.
     */
    public boolean hasInfoHash() {
        return StringUtils.isNotEmpty(infoHash);
    }

    /**
     * Check if this stream carries a url.
     *
     * @return Returns true when the url is present.
     */
    public boolean hasUrl() {
        return StringUtils.isNotEmpty(url);
    }
}
