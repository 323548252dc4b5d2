package com.github.yoep.debrid.core.providers;

import com.github.yoep.debrid.adapter.DebridProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the available debrid providers.
 * The providers are always ordered by the declaration order of their type, which makes the iteration over the registry deterministic.
 */
@Slf4j
public class ProviderRegistry {
    private final Map<String, ProviderDescriptor> descriptors;

    public ProviderRegistry(Collection<? extends DebridProvider> providers) {
        Assert.notNull(providers, "providers cannot be null");
        var ordered = new ArrayList<ProviderDescriptor>(providers.size());

        for (DebridProvider provider : providers) {
            var type = provider.getType();
            Assert.notNull(type, "provider type cannot be null");
            ordered.add(new ProviderDescriptor(type, provider));
        }

        var registrations = new LinkedHashMap<String, ProviderDescriptor>();
        ordered.sort(Comparator.comparing(ProviderDescriptor::type));
        ordered.forEach(descriptor -> {
            if (registrations.containsKey(descriptor.key())) {
                throw new IllegalStateException(MessageFormat.format("Provider \"{0}\" has been registered more than once", descriptor.key()));
            }

            registrations.put(descriptor.key(), descriptor);
        });

        this.descriptors = Collections.unmodifiableMap(registrations);
        log.debug("Registered debrid providers {}", descriptors.keySet());
    }

    /**
     * Get the descriptor of the given provider key.
     *
     * @param key The provider key.
     * @return Returns the descriptor if the provider is registered, else {@link Optional#empty()}.
     */
    public Optional<ProviderDescriptor> getDescriptor(String key) {
        if (key == null)
            return Optional.empty();

        return Optional.ofNullable(descriptors.get(key));
    }

    /**
     * Get the descriptor of the given provider key.
     *
     * @param key The provider key.
     * @return Returns the descriptor of the provider.
     * @throws ProviderNotFoundException Is thrown when the provider is not registered.
     */
    public ProviderDescriptor getRequiredDescriptor(String key) {
        return getDescriptor(key)
                .orElseThrow(() -> new ProviderNotFoundException(key));
    }

    /**
     * Get all registered providers in registry order.
     *
     * @return Returns the provider descriptors.
     */
    public List<ProviderDescriptor> getDescriptors() {
        return new ArrayList<>(descriptors.values());
    }

    /**
     * Get the keys of all registered providers in registry order.
     *
     * @return Returns the provider keys.
     */
    public List<String> getKeys() {
        return new ArrayList<>(descriptors.keySet());
    }

    public boolean isRegistered(String key) {
        return key != null && descriptors.containsKey(key);
    }
}
