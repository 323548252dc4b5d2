package com.github.yoep.debrid.core.streams;

import com.github.yoep.debrid.adapter.model.StreamCandidate;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

public class StreamHelper {
    static final int SMALL_POOL_SIZE = 5;

    private static final Pattern ZERO_SEEDERS_PATTERN = Pattern.compile("👤 0(?!\\d)");
    private static final Pattern SEEDERS_LINE_PATTERN = Pattern.compile("\n👤.*", Pattern.DOTALL);
    private static final String QUALITY_4K = "4k";

    private StreamHelper() {
    }

    /**
     * Check if the stream has been reported without any seeders.
     *
     * @param stream The stream to check.
     * @return Returns true when the title reports zero seeders.
     */
    public static boolean isZeroSeeders(StreamCandidate stream) {
        return stream.title() != null && ZERO_SEEDERS_PATTERN.matcher(stream.title()).find();
    }

    public static boolean is4k(StreamCandidate stream) {
        return stream.name() != null && stream.name().toLowerCase(Locale.ROOT).contains(QUALITY_4K);
    }

    /**
     * Check if the stream is worth a download at a provider.
     * Streams without seeders are only accepted when they're 4K or when there are barely any options to choose from.
     *
     * @param stream   The stream to check.
     * @param poolSize The total number of stream candidates.
     * @return Returns true when the stream is healthy enough.
     */
    public static boolean isHealthyForDebrid(StreamCandidate stream, int poolSize) {
        return !isZeroSeeders(stream) || is4k(stream) || poolSize <= SMALL_POOL_SIZE;
    }

    /**
     * Get the url encoded filename of the stream.
     * The filename is the last line of the title before the seeders information.
     *
     * @param stream The stream to retrieve the filename of.
     * @return Returns the filename encoded as url path segment.
     */
    public static String filename(StreamCandidate stream) {
        var filename = "";

        if (stream.title() != null) {
            var titleParts = SEEDERS_LINE_PATTERN.matcher(stream.title()).replaceAll("").split("\n");
            filename = StringUtils.substringAfterLast("/" + titleParts[titleParts.length - 1], "/");
        }
        if (StringUtils.isBlank(filename)) {
            filename = StringUtils.defaultString(stream.name());
        }

        return UriUtils.encodePathSegment(filename.trim(), StandardCharsets.UTF_8);
    }
}
