package com.github.yoep.debrid.core.providers;

import com.github.yoep.debrid.adapter.DebridProvider;
import com.github.yoep.debrid.adapter.ProviderType;

import java.util.Objects;

/**
 * The registration of a {@link DebridProvider} implementation within the {@link ProviderRegistry}.
 *
 * @param type     The static information of the provider.
 * @param provider The provider implementation.
 */
public record ProviderDescriptor(ProviderType type, DebridProvider provider) {
    public ProviderDescriptor {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(provider, "provider cannot be null");
    }

    public String key() {
        return type.getKey();
    }

    public String displayName() {
        return type.getDisplayName();
    }

    public String shortName() {
        return type.getShortName();
    }

    public boolean supportsCatalog() {
        return type.isCatalogSupported();
    }
}
