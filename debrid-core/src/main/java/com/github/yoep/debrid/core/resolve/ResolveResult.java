package com.github.yoep.debrid.core.resolve;

import com.github.yoep.debrid.adapter.StaticResponse;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of a resolve, which is either a playable url or a {@link StaticResponse} failure.
 */
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ResolveResult {
    private final String url;
    private final StaticResponse failure;

    public static ResolveResult ok(String url) {
        Objects.requireNonNull(url, "url cannot be null");
        return new ResolveResult(url, null);
    }

    public static ResolveResult failed(StaticResponse failure) {
        Objects.requireNonNull(failure, "failure cannot be null");
        return new ResolveResult(null, failure);
    }

    /**
     * Create the result of an url returned by a provider.
     * Urls pointing to a static response are considered a failure.
     *
     * @param url The url returned by the provider.
     * @return Returns the resolve result of the url.
     */
    public static ResolveResult from(String url) {
        if (StringUtils.isBlank(url))
            return failed(StaticResponse.FAILED_UNEXPECTED);

        return StaticResponse.fromUrl(url)
                .map(ResolveResult::failed)
                .orElseGet(() -> ok(url));
    }

    public boolean isOk() {
        return url != null;
    }

    public Optional<String> getUrl() {
        return Optional.ofNullable(url);
    }

    public Optional<StaticResponse> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Get the url which should be handed to the client.
     *
     * @param host The host base url of the application.
     * @return Returns the resolved url, or the absolute url of the static response on failure.
     */
    public String toUrl(String host) {
        return isOk() ? url : failure.toUrl(host);
    }
}
