package io.kneo.iptv.service.relay;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class RelayHeaders {
    public static final String FALLBACK_USER_AGENT = "Mozilla/5.0";

    public static final List<String> FORWARDED_REQUEST_HEADERS = List.of("Range", "Accept", "If-Range");

    public static final List<String> PASSED_RESPONSE_HEADERS = List.of(
            "Content-Type", "Accept-Ranges", "Content-Range", "Content-Length");

    public static final String EXPOSED_HEADERS = "Content-Length, Content-Range, Accept-Ranges";

    private static final String DEFAULT_CONTENT_TYPE = "video/mp4";

    private RelayHeaders() {
    }

    /**
     * {@code scheme://host[:port]} of the URL, or an empty string when it has no usable host.
     */
    public static String originOf(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return "";
            }
            String origin = uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getHost();
            return uri.getPort() >= 0 ? origin + ":" + uri.getPort() : origin;
        } catch (URISyntaxException e) {
            return "";
        }
    }

    /**
     * Headers a live-media origin expects from a browser-like client.
     */
    public static Map<String, String> originRequestHeaders(String url, String userAgent) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "*/*");
        headers.put("User-Agent", userAgent);
        String origin = originOf(url);
        if (!origin.isEmpty()) {
            headers.put("Referer", origin + "/");
            headers.put("Origin", origin);
        }
        return headers;
    }

    public static String guessContentType(String url) {
        String path = url.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.endsWith(".m3u8") || path.endsWith(".m3u")) {
            return "application/vnd.apple.mpegurl";
        }
        if (path.endsWith(".mpd")) {
            return "application/dash+xml";
        }
        if (path.endsWith(".ts")) {
            return "video/mp2t";
        }
        if (path.endsWith(".aac")) {
            return "audio/aac";
        }
        if (path.endsWith(".mp3")) {
            return "audio/mpeg";
        }
        return DEFAULT_CONTENT_TYPE;
    }
}
