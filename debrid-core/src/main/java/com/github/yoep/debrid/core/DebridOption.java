package com.github.yoep.debrid.core;

import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The debrid options a user can enable within the configuration.
 */
@Getter
public enum DebridOption {
    /**
     * Don't offer links which start a download at the provider.
     */
    NO_DOWNLOAD_LINKS("nodownloadlinks"),
    /**
     * Keep the torrent streams which couldn't be resolved by any provider.
     */
    TORRENT_LINKS("torrentlinks"),
    /**
     * Don't show the provider catalog.
     */
    NO_CATALOG("nocatalog");

    private final String value;

    DebridOption(String value) {
        this.value = value;
    }

    public static Optional<DebridOption> fromValue(String value) {
        return Arrays.stream(values())
                .filter(e -> e.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    /**
     * Parse the comma separated options value of the configuration.
     * Unknown options are ignored.
     *
     * @param value The options value, e.g. "nodownloadlinks,torrentlinks".
     * @return Returns the parsed options.
     */
    public static Set<DebridOption> parse(String value) {
        if (value == null || value.isBlank())
            return Collections.emptySet();

        var options = EnumSet.noneOf(DebridOption.class);
        Arrays.stream(value.split(","))
                .map(DebridOption::fromValue)
                .flatMap(Optional::stream)
                .forEach(options::add);
        return Collections.unmodifiableSet(options);
    }
}
