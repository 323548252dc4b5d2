package com.github.yoep.debrid.core.streams;

import com.github.yoep.debrid.adapter.AccessDeniedException;
import com.github.yoep.debrid.adapter.DebridProvider;
import com.github.yoep.debrid.adapter.InvalidCredentialException;
import com.github.yoep.debrid.adapter.ProviderType;
import com.github.yoep.debrid.adapter.model.CachedEntry;
import com.github.yoep.debrid.adapter.model.StreamCandidate;
import com.github.yoep.debrid.core.DebridConfiguration;
import com.github.yoep.debrid.core.DebridOption;
import com.github.yoep.debrid.core.credentials.CredentialBlacklist;
import com.github.yoep.debrid.core.credentials.CredentialGuard;
import com.github.yoep.debrid.core.errors.ErrorClassifier;
import com.github.yoep.debrid.core.providers.ProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StreamAggregatorTest {
    private static final String HOST = "https://torrentio.example.com";
    private static final String RD_CREDENTIAL = "RDCREDENTIAL0123456789";
    private static final String PM_CREDENTIAL = "PMCREDENTIAL0123456789";
    private static final String INFO_HASH = "aaaabbbbccccdddd";

    @Mock
    private DebridProvider realDebrid;
    @Mock
    private DebridProvider premiumize;

    private CredentialGuard credentialGuard;
    private StreamAggregator aggregator;

    @BeforeEach
    void setUp() {
        when(realDebrid.getType()).thenReturn(ProviderType.REAL_DEBRID);
        when(premiumize.getType()).thenReturn(ProviderType.PREMIUMIZE);

        credentialGuard = new CredentialGuard(new CredentialBlacklist(), 15);
        aggregator = new StreamAggregator(new ProviderRegistry(Arrays.asList(premiumize, realDebrid)), credentialGuard, new ErrorClassifier("Torrentio"));
    }

    @Test
    void testApplyProviders_whenNoProviderIsConfigured_shouldReturnTheSameCandidates() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Torrentio\n1080p", "Movie.mkv\n👤 5"));
        var config = DebridConfiguration.builder()
                .host(HOST)
                .build();

        var result = aggregator.applyProviders(candidates, config).get();

        assertSame(candidates, result);
        verify(realDebrid, never()).getCachedStreams(anyList(), any());
        verify(premiumize, never()).getCachedStreams(anyList(), any());
    }

    @Test
    void testApplyProviders_whenCredentialIsEmpty_shouldReturnTheSameCandidates() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Torrentio\n1080p", "Movie.mkv\n👤 5"));
        var config = DebridConfiguration.builder()
                .credential(ProviderType.REAL_DEBRID.getKey(), "")
                .host(HOST)
                .build();

        var result = aggregator.applyProviders(candidates, config).get();

        assertSame(candidates, result);
    }

    @Test
    void testApplyProviders_whenCredentialIsWhitespace_shouldReturnInvalidCredentialPlaceholder() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Torrentio\n1080p", "Movie.mkv\n👤 5"));
        var config = DebridConfiguration.builder()
                .credential(ProviderType.REAL_DEBRID.getKey(), "   ")
                .host(HOST)
                .build();

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(1, result.size());
        assertEquals("Torrentio\nRD error", result.get(0).name());
        assertEquals("Invalid RealDebrid credential!", result.get(0).title());
        verify(realDebrid, never()).getCachedStreams(anyList(), any());
    }

    @Test
    void testApplyProviders_whenHostHasTrailingSlash_shouldNotDuplicateTheSeparator() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Torrentio\n1080p", "Movie (2020).mkv\n👤 5"));
        var config = realDebridConfig()
                .host(HOST + "/")
                .build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Map.of(INFO_HASH, CachedEntry.cached("/torrents/123"))));

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(HOST + "/realdebrid/torrents/123/Movie%20(2020).mkv", result.get(0).url());
    }

    @Test
    void testApplyProviders_whenCandidateIsCached_shouldBrandTheStreamWithTheProvider() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Torrentio\n1080p", "Movie.mkv\n👤 5"));
        var config = realDebridConfig().build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Map.of(INFO_HASH, CachedEntry.cached(null))));

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(1, result.size());
        var stream = result.get(0);
        assertEquals("[RD+] Torrentio\n1080p", stream.name());
        assertEquals("Movie.mkv\n👤 5", stream.title());
        assertEquals(HOST + "/realdebrid/" + RD_CREDENTIAL + "/" + INFO_HASH + "/0/Movie.mkv", stream.url());
        assertNull(stream.infoHash(), "expected the info hash to have been dropped");
        assertNull(stream.fileIndex(), "expected the file index to have been dropped");
    }

    @Test
    void testApplyProviders_whenCachedEntryHasUrl_shouldUseTheEntryUrlAsPath() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Torrentio\n1080p", "Movie.mkv\n👤 5"));
        var config = realDebridConfig().build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Map.of(INFO_HASH, CachedEntry.cached("torrents/123"))));

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(HOST + "/realdebrid/torrents/123/Movie.mkv", result.get(0).url());
    }

    @Test
    void testApplyProviders_whenMultipleProvidersHaveTheCandidateCached_shouldPreferTheLastProvider() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Torrentio\n1080p", "Movie.mkv\n👤 5"));
        var config = realDebridConfig()
                .credential(ProviderType.PREMIUMIZE.getKey(), PM_CREDENTIAL)
                .build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Map.of(INFO_HASH, CachedEntry.cached(null))));
        when(premiumize.getCachedStreams(anyList(), eq(PM_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Map.of(INFO_HASH, CachedEntry.cached(null))));

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(1, result.size());
        assertEquals("[PM+] Torrentio\n1080p", result.get(0).name());
        assertTrue(result.get(0).url().startsWith(HOST + "/premiumize/"), "expected the premiumize url, got " + result.get(0).url());
    }

    @Test
    void testApplyProviders_whenCandidateIsNotCached_shouldCreateDownloadLinkPerProvider() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Movie", "👤 0 📦 1GB"));
        var config = realDebridConfig()
                .credential(ProviderType.PREMIUMIZE.getKey(), PM_CREDENTIAL)
                .build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Map.of(INFO_HASH, CachedEntry.uncached(null))));
        when(premiumize.getCachedStreams(anyList(), eq(PM_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Collections.emptyMap()));

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(Arrays.asList("[RD download] Movie", "[PM download] Movie"), names(result));
    }

    @Test
    void testApplyProviders_whenPoolIsLarge_shouldSkipDownloadLinksOfZeroSeederStreams() throws ExecutionException, InterruptedException {
        var candidates = IntStream.range(0, 5)
                .mapToObj(i -> candidate("hash" + i, "Movie " + i, "👤 " + (i + 1)))
                .collect(Collectors.toCollection(ArrayList::new));
        candidates.add(candidate("dead", "Movie dead", "👤 0"));
        candidates.add(candidate("dead4k", "Movie 4k", "👤 0"));
        var config = realDebridConfig().build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Collections.emptyMap()));

        var result = aggregator.applyProviders(candidates, config).get();

        var names = names(result);
        assertEquals(6, names.size());
        assertFalse(names.contains("[RD download] Movie dead"), "expected the zero seeder stream to have been skipped");
        assertTrue(names.contains("[RD download] Movie 4k"), "expected the 4k stream to have been kept");
    }

    @Test
    void testApplyProviders_whenNoDownloadLinksOptionIsEnabled_shouldOnlyReturnCachedStreams() throws ExecutionException, InterruptedException {
        var candidates = Arrays.asList(
                candidate(INFO_HASH, "Cached", "Cached.mkv\n👤 5"),
                candidate("otherhash", "Uncached", "Uncached.mkv\n👤 5"));
        var config = realDebridConfig()
                .option(DebridOption.NO_DOWNLOAD_LINKS)
                .build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Map.of(INFO_HASH, CachedEntry.cached(null))));

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(Collections.singletonList("[RD+] Cached"), names(result));
    }

    @Test
    void testApplyProviders_whenTorrentLinksOptionIsEnabled_shouldKeepTheUnresolvedCandidates() throws ExecutionException, InterruptedException {
        var candidate = candidate(INFO_HASH, "Movie", "Movie.mkv\n👤 5");
        var config = realDebridConfig()
                .option(DebridOption.TORRENT_LINKS)
                .build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Collections.emptyMap()));

        var result = aggregator.applyProviders(Collections.singletonList(candidate), config).get();

        assertEquals(2, result.size());
        assertEquals(candidate, result.get(0));
        assertEquals("[RD download] Movie", result.get(1).name());
    }

    @Test
    void testApplyProviders_whenCredentialIsRejected_shouldReturnPlaceholderAndBlacklistTheCredential() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Movie", "Movie.mkv\n👤 5"));
        var config = realDebridConfig().build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.failedFuture(new InvalidCredentialException(ProviderType.REAL_DEBRID.getKey())));

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(1, result.size());
        assertEquals("Torrentio\nRD error", result.get(0).name());
        assertEquals("Invalid RealDebrid credential!", result.get(0).title());
        assertEquals(HOST + "/videos/failed_access_v2.mp4", result.get(0).url());
        assertFalse(credentialGuard.isValid(RD_CREDENTIAL, ProviderType.REAL_DEBRID.getKey()));

        var secondResult = aggregator.applyProviders(candidates, config).get();

        assertEquals(result, secondResult);
        verify(realDebrid, times(1)).getCachedStreams(anyList(), eq(RD_CREDENTIAL));
    }

    @Test
    void testApplyProviders_whenAccessIsDenied_shouldReturnPlaceholderWithoutBlacklisting() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Movie", "Movie.mkv\n👤 5"));
        var config = realDebridConfig().build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.failedFuture(new AccessDeniedException(ProviderType.REAL_DEBRID.getKey())));

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(1, result.size());
        assertEquals("Expired/invalid RealDebrid subscription!", result.get(0).title());
        assertTrue(credentialGuard.isValid(RD_CREDENTIAL, ProviderType.REAL_DEBRID.getKey()));
    }

    @Test
    void testApplyProviders_whenCredentialIsTooShort_shouldNotQueryTheProvider() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Movie", "Movie.mkv\n👤 5"));
        var config = DebridConfiguration.builder()
                .credential(ProviderType.REAL_DEBRID.getKey(), "short")
                .host(HOST)
                .build();

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(1, result.size());
        assertEquals("Invalid RealDebrid credential!", result.get(0).title());
        verify(realDebrid, never()).getCachedStreams(anyList(), any());
    }

    @Test
    void testApplyProviders_whenProviderFailsUnexpectedly_shouldIgnoreTheProvider() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Movie", "Movie.mkv\n👤 5"));
        var config = realDebridConfig()
                .credential(ProviderType.PREMIUMIZE.getKey(), PM_CREDENTIAL)
                .build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenReturn(CompletableFuture.failedFuture(new IOException("connection reset")));
        when(premiumize.getCachedStreams(anyList(), eq(PM_CREDENTIAL)))
                .thenReturn(CompletableFuture.completedFuture(Map.of(INFO_HASH, CachedEntry.cached(null))));

        var result = aggregator.applyProviders(candidates, config).get();

        assertEquals(Collections.singletonList("[PM+] Movie"), names(result));
    }

    @Test
    void testApplyProviders_whenProviderThrowsSynchronously_shouldIgnoreTheProvider() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Movie", "Movie.mkv\n👤 5"));
        var config = realDebridConfig().build();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL)))
                .thenThrow(new IllegalStateException("boom"));

        var result = aggregator.applyProviders(candidates, config).get();

        assertTrue(result.isEmpty(), "expected no streams, got " + result);
    }

    @Test
    void testApplyProviders_whenMultipleProvidersAreConfigured_shouldQueryThemConcurrently() throws ExecutionException, InterruptedException {
        var candidates = Collections.singletonList(candidate(INFO_HASH, "Movie", "Movie.mkv\n👤 5"));
        var config = realDebridConfig()
                .credential(ProviderType.PREMIUMIZE.getKey(), PM_CREDENTIAL)
                .build();
        var realDebridFuture = new CompletableFuture<Map<String, CachedEntry>>();
        var premiumizeFuture = new CompletableFuture<Map<String, CachedEntry>>();
        when(realDebrid.getCachedStreams(anyList(), eq(RD_CREDENTIAL))).thenReturn(realDebridFuture);
        when(premiumize.getCachedStreams(anyList(), eq(PM_CREDENTIAL))).thenReturn(premiumizeFuture);

        var result = aggregator.applyProviders(candidates, config);

        verify(realDebrid).getCachedStreams(anyList(), eq(RD_CREDENTIAL));
        verify(premiumize).getCachedStreams(anyList(), eq(PM_CREDENTIAL));
        assertFalse(result.isDone(), "expected the result to await all providers");

        premiumizeFuture.complete(Map.of(INFO_HASH, CachedEntry.cached(null)));
        assertFalse(result.isDone(), "expected the result to await all providers");

        realDebridFuture.complete(Collections.emptyMap());
        assertEquals(Collections.singletonList("[PM+] Movie"), names(result.get()));
    }

    private static DebridConfiguration.DebridConfigurationBuilder realDebridConfig() {
        return DebridConfiguration.builder()
                .credential(ProviderType.REAL_DEBRID.getKey(), RD_CREDENTIAL)
                .host(HOST);
    }

    private static StreamCandidate candidate(String infoHash, String name, String title) {
        return StreamCandidate.builder()
                .infoHash(infoHash)
                .fileIndex(0)
                .name(name)
                .title(title)
                .build();
    }

    private static List<String> names(List<StreamCandidate> streams) {
        return streams.stream()
                .map(StreamCandidate::name)
                .collect(Collectors.toList());
    }
}
