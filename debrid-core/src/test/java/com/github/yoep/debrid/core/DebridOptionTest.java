package com.github.yoep.debrid.core;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class DebridOptionTest {
    @Test
    void testParse_whenValueContainsKnownOptions_shouldReturnTheOptions() {
        var result = DebridOption.parse("nodownloadlinks, TorrentLinks");

        assertEquals(EnumSet.of(DebridOption.NO_DOWNLOAD_LINKS, DebridOption.TORRENT_LINKS), result);
    }

    @Test
    void testParse_whenValueContainsUnknownOptions_shouldIgnoreThem() {
        var result = DebridOption.parse("lorem,nocatalog");

        assertEquals(EnumSet.of(DebridOption.NO_CATALOG), result);
    }

    @Test
    void testParse_whenValueIsBlank_shouldReturnEmptySet() {
        assertTrue(DebridOption.parse(null).isEmpty());
        assertTrue(DebridOption.parse(" ").isEmpty());
    }
}
