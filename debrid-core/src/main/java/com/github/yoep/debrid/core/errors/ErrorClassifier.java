package com.github.yoep.debrid.core.errors;

import com.github.yoep.debrid.adapter.AccessDeniedException;
import com.github.yoep.debrid.adapter.InvalidCredentialException;
import com.github.yoep.debrid.adapter.StaticResponse;
import com.github.yoep.debrid.adapter.model.StreamCandidate;
import com.github.yoep.debrid.core.providers.ProviderDescriptor;
import com.github.yoep.debrid.core.utils.FutureUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.util.Optional;

/**
 * Converts provider failures into placeholder streams which inform the user about the failure.
 */
@Slf4j
public class ErrorClassifier {
    private final String productName;

    public ErrorClassifier(String productName) {
        Assert.hasText(productName, "productName cannot be empty");
        this.productName = productName;
    }

    /**
     * Classify the given provider failure.
     *
     * @param descriptor The provider which failed.
     * @param error      The failure of the provider.
     * @param host       The host base url of the application.
     * @return Returns the placeholder stream of the failure, or {@link Optional#empty()} when the failure can't be shown to the user.
     */
    public Optional<StreamCandidate> classify(ProviderDescriptor descriptor, Throwable error, String host) {
        Assert.notNull(descriptor, "descriptor cannot be null");
        var cause = error != null ? FutureUtils.unwrap(error) : null;

        if (cause instanceof InvalidCredentialException) {
            return Optional.of(placeholder(descriptor, "Invalid " + descriptor.displayName() + " credential!", host));
        }
        if (cause instanceof AccessDeniedException) {
            return Optional.of(placeholder(descriptor, "Expired/invalid " + descriptor.displayName() + " subscription!", host));
        }

        log.trace("Failure of provider {} is not classifiable", descriptor.key());
        return Optional.empty();
    }

    private StreamCandidate placeholder(ProviderDescriptor descriptor, String title, String host) {
        return StreamCandidate.builder()
                .name(productName + "\n" + descriptor.shortName() + " error")
                .title(title)
                .url(StaticResponse.FAILED_ACCESS.toUrl(host))
                .build();
    }
}
