package com.github.yoep.debrid.core;

import lombok.Builder;
import lombok.Singular;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The debrid configuration of a single user request.
 *
 * @param credentials   The credential of the user per provider key.
 * @param host          The host base url of the application, used to build absolute stream urls.
 * @param clientAddress The address of the client which made the request.
 * @param skip          The number of catalog items to skip.
 * @param options       The enabled debrid options.
 */
@Builder(toBuilder = true)
public record DebridConfiguration(@Singular Map<String, String> credentials,
                                  String host,
                                  String clientAddress,
                                  int skip,
                                  @Singular Set<DebridOption> options) {
    /**
     * Get the credential of the given provider.
     *
     * @param providerKey The provider key.
     * @return Returns the credential when it's configured, else {@link Optional#empty()}.
     */
    public Optional<String> getCredential(String providerKey) {
        return Optional.ofNullable(credentials)
                .map(e -> e.get(providerKey))
                .filter(StringUtils::isNotEmpty);
    }

    public boolean isIncludeTorrentLinks() {
        return hasOption(DebridOption.TORRENT_LINKS);
    }

    public boolean isExcludeDownloadLinks() {
        return hasOption(DebridOption.NO_DOWNLOAD_LINKS);
    }

    public boolean hasOption(DebridOption option) {
        return options != null && options.contains(option);
    }
}
