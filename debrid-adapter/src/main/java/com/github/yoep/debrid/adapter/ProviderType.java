package com.github.yoep.debrid.adapter;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * The debrid providers which are known by the application.
 * The declaration order of the constants is the order in which provider results are applied to the streams.
 */
@Getter
public enum ProviderType {
    REAL_DEBRID("realdebrid", "RealDebrid", "RD", true),
    PREMIUMIZE("premiumize", "Premiumize", "PM", true),
    ALL_DEBRID("alldebrid", "AllDebrid", "AD", true),
    DEBRID_LINK("debridlink", "DebridLink", "DL", true),
    OFFCLOUD("offcloud", "Offcloud", "OC", true),
    PUTIO("putio", "Put.io", "Putio", false);

    /**
     * The stable identifier of the provider, used as configuration key and url path segment.
     */
    private final String key;
    /**
     * The human-readable name of the provider.
     */
    private final String displayName;
    /**
     * The abbreviation used within stream labels.
     */
    private final String shortName;
    /**
     * Indicates if the provider exposes the downloads of the user as catalog.
     */
    private final boolean catalogSupported;

    ProviderType(String key, String displayName, String shortName, boolean catalogSupported) {
        this.key = key;
        this.displayName = displayName;
        this.shortName = shortName;
        this.catalogSupported = catalogSupported;
    }

    /**
     * Get the provider type for the given key.
     *
     * @param key The provider key to look up.
     * @return Returns the provider type if found, else {@link Optional#empty()}.
     */
    public static Optional<ProviderType> fromKey(String key) {
        return Arrays.stream(values())
                .filter(e -> e.key.equals(key))
                .findFirst();
    }
}
