package com.github.yoep.debrid.adapter.model;

import lombok.Builder;

/**
 * A request to resolve torrent content into a playable url at a provider.
 *
 * @param clientAddress   The address of the client which requested the stream.
 * @param providerKey     The key of the provider to resolve with.
 * @param credential      The credential of the user for the provider.
 * @param infoHash        The info hash of the torrent.
 * @param cachedEntryInfo The provider specific info which was handed out with the cached entry, can be null.
 * @param fileIndex       The index of the file within the torrent, can be null.
 * @param host            The host base url of the application, used for the static responses.
 */
@Builder
public record ResolveRequest(String clientAddress,
                             String providerKey,
                             String credential,
                             String infoHash,
                             String cachedEntryInfo,
                             Integer fileIndex,
                             String host) {
    private static final String SEPARATOR = "|";

    /**
     * Get the key which identifies identical resolve requests.
     *
     * @return Returns the deduplication key of this request.
     */
    public String deduplicationKey() {
        return String.join(SEPARATOR,
                String.valueOf(clientAddress),
                String.valueOf(providerKey),
                String.valueOf(credential),
                String.valueOf(infoHash),
                String.valueOf(fileIndex));
    }
}
