package com.github.yoep.debrid.core.resolve;

import com.github.yoep.debrid.adapter.StaticResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResolveResultTest {
    private static final String HOST = "https://torrentio.example.com";

    @Test
    void testFrom_whenUrlIsPlayable_shouldReturnOk() {
        var result = ResolveResult.from("https://cdn.example.com/Movie.mkv");

        assertTrue(result.isOk(), "expected the result to be ok");
        assertEquals("https://cdn.example.com/Movie.mkv", result.getUrl().orElse(null));
        assertEquals("https://cdn.example.com/Movie.mkv", result.toUrl(HOST));
    }

    @Test
    void testFrom_whenUrlIsBlank_shouldReturnUnexpectedFailure() {
        assertEquals(ResolveResult.failed(StaticResponse.FAILED_UNEXPECTED), ResolveResult.from(null));
        assertEquals(ResolveResult.failed(StaticResponse.FAILED_UNEXPECTED), ResolveResult.from(" "));
    }

    @Test
    void testFrom_whenUrlIsStaticResponse_shouldReturnTheFailure() {
        var result = ResolveResult.from("videos/downloading_v2.mp4");

        assertFalse(result.isOk(), "expected the result to be a failure");
        assertEquals(StaticResponse.DOWNLOADING, result.getFailure().orElse(null));
        assertEquals(HOST + "/videos/downloading_v2.mp4", result.toUrl(HOST));
    }
}
