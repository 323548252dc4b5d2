package com.github.yoep.debrid.adapter;

import lombok.Getter;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Arrays;
import java.util.Optional;

/**
 * Static video responses which are served instead of the actual content.
 * These are used to inform the user about the state of the content through the player itself.
 */
@Getter
public enum StaticResponse {
    DOWNLOADING("videos/downloading_v2.mp4"),
    FAILED_DOWNLOAD("videos/download_failed_v2.mp4"),
    FAILED_ACCESS("videos/failed_access_v2.mp4"),
    FAILED_RAR("videos/failed_rar_v2.mp4"),
    FAILED_OPENING("videos/failed_opening_v2.mp4"),
    FAILED_UNEXPECTED("videos/failed_unexpected_v2.mp4"),
    FAILED_INFRINGEMENT("videos/failed_infringement_v2.mp4");

    /**
     * The path of the video, relative to the host of the application.
     */
    private final String path;

    StaticResponse(String path) {
        this.path = path;
    }

    /**
     * Get the absolute url of this response for the given host.
     *
     * @param host The host base url, e.g. "https://example.com".
     * @return Returns the absolute url.
     */
    public String toUrl(String host) {
        return UriComponentsBuilder.fromHttpUrl(host)
                .path(path)
                .build()
                .toUriString();
    }

    /**
     * Get the static response which matches the given url.
     *
     * @param url The url to check, can be relative or absolute.
     * @return Returns the matching static response, else {@link Optional#empty()}.
     */
    public static Optional<StaticResponse> fromUrl(String url) {
        if (url == null)
            return Optional.empty();

        return Arrays.stream(values())
                .filter(e -> url.endsWith(e.path))
                .findFirst();
    }

    /**
     * Check if the given url is a static response url.
     *
     * @param url The url to check.
     * @return Returns true when the url points to a static response, else false.
     */
    public static boolean isStaticUrl(String url) {
        return fromUrl(url).isPresent();
    }
}
