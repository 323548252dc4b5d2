package com.github.yoep.debrid.core.meta;

import com.github.yoep.debrid.adapter.model.ItemMeta;
import com.github.yoep.debrid.adapter.model.MetaVideo;
import com.github.yoep.debrid.adapter.model.StreamCandidate;
import org.springframework.util.Assert;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.stream.Collectors;

public class ItemMetaHelper {
    private static final String ABSOLUTE_URL_PREFIX = "http";

    private ItemMetaHelper() {
    }

    /**
     * Rewrite the provider relative stream urls of the metadata into absolute resolve urls.
     *
     * @param meta        The item metadata.
     * @param host        The host base url of the application.
     * @param providerKey The key of the provider which returned the metadata.
     * @return Returns the metadata with absolute stream urls.
     */
    public static ItemMeta rewriteStreamUrls(ItemMeta meta, String host, String providerKey) {
        Assert.notNull(meta, "meta cannot be null");
        if (meta.videos() == null)
            return meta;

        return meta.toBuilder()
                .videos(meta.videos().stream()
                        .map(e -> rewriteStreamUrls(e, host, providerKey))
                        .collect(Collectors.toList()))
                .build();
    }

    private static MetaVideo rewriteStreamUrls(MetaVideo video, String host, String providerKey) {
        if (video.streams() == null)
            return video;

        return video.toBuilder()
                .streams(rewriteStreams(video.streams(), host, providerKey))
                .build();
    }

    private static List<StreamCandidate> rewriteStreams(List<StreamCandidate> streams, String host, String providerKey) {
        return streams.stream()
                .map(e -> isRelative(e.url()) ? e.toBuilder()
                        .url(UriComponentsBuilder.fromHttpUrl(host)
                                .pathSegment(providerKey)
                                .path(e.url())
                                .build()
                                .toUriString())
                        .build() : e)
                .collect(Collectors.toList());
    }

    private static boolean isRelative(String url) {
        return url != null && !url.startsWith(ABSOLUTE_URL_PREFIX);
    }
}
