package io.kneo.iptv.service.playlist;

import io.kneo.iptv.config.IptvConfig;
import io.kneo.iptv.model.Channel;
import io.kneo.iptv.model.cnst.ChannelIdStrategy;
import io.kneo.iptv.service.exceptions.SourceParseException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an extended-M3U document into channels. Entries with a broken URL line are dropped,
 * broken attributes fall back to defaults; only a document without the {@code #EXTM3U} header
 * is rejected as a whole.
 */
@ApplicationScoped
public class PlaylistParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlaylistParser.class);

    public static final String ID_PREFIX = "iptv:";

    private static final String EXTM3U_HEADER = "#EXTM3U";
    private static final String EXTINF_PREFIX = "#EXTINF:";
    private static final String EXTGRP_PREFIX = "#EXTGRP:";
    private static final int URL_HASH_LENGTH = 12;

    private static final Pattern URL_PATTERN = Pattern.compile(
            "^(https?|rtmp|rtmps|rtmpe|rtmpt|rtsp|udp|rtp|mms|mmsh|ftp)://\\S+",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile("([A-Za-z0-9_-]+)=\"([^\"]*)\"");

    private final ChannelIdStrategy idStrategy;
    private final String defaultCategory;

    @Inject
    public PlaylistParser(IptvConfig config) {
        this(config.getChannelIdStrategy(), config.getDefaultCategory());
    }

    public PlaylistParser(ChannelIdStrategy idStrategy, String defaultCategory) {
        this.idStrategy = idStrategy;
        this.defaultCategory = defaultCategory;
    }

    public List<Channel> parse(String content) {
        if (content == null || content.isBlank()) {
            throw new SourceParseException("Playlist document is empty");
        }
        String text = content.charAt(0) == '\uFEFF' ? content.substring(1) : content;
        String[] lines = text.split("\\r\\n|\\r|\\n");
        if (!hasHeader(lines)) {
            throw new SourceParseException("Playlist does not start with " + EXTM3U_HEADER);
        }

        List<Entry> entries = new ArrayList<>();
        Entry pending = null;
        int dropped = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(EXTINF_PREFIX)) {
                if (pending != null) {
                    LOGGER.warn("Playlist line {}: entry '{}' has no URL line, dropped", pending.lineNumber, pending.name);
                    dropped++;
                }
                pending = parseEntry(line, i + 1);
            } else if (line.startsWith(EXTGRP_PREFIX)) {
                if (pending != null) {
                    pending.extGroup = line.substring(EXTGRP_PREFIX.length()).trim();
                }
            } else if (!line.startsWith("#")) {
                if (pending == null) {
                    LOGGER.debug("Playlist line {}: URL without #EXTINF ignored", i + 1);
                    continue;
                }
                if (URL_PATTERN.matcher(line).matches()) {
                    pending.url = line;
                    entries.add(pending);
                } else {
                    LOGGER.warn("Playlist line {}: entry '{}' has invalid URL '{}', dropped", i + 1, pending.name, line);
                    dropped++;
                }
                pending = null;
            }
        }
        if (pending != null) {
            LOGGER.warn("Playlist line {}: entry '{}' has no URL line, dropped", pending.lineNumber, pending.name);
            dropped++;
        }

        List<Channel> channels = toChannels(entries);
        LOGGER.info("Parsed playlist: {} channels, {} entries dropped", channels.size(), dropped);
        return channels;
    }

    private boolean hasHeader(String[] lines) {
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                return trimmed.regionMatches(true, 0, EXTM3U_HEADER, 0, EXTM3U_HEADER.length());
            }
        }
        return false;
    }

    private Entry parseEntry(String line, int lineNumber) {
        String body = line.substring(EXTINF_PREFIX.length());
        int separator = findNameSeparator(body);
        String attributePart = separator >= 0 ? body.substring(0, separator) : body;
        String name = separator >= 0 ? body.substring(separator + 1).trim() : "";

        Map<String, String> attributes = new HashMap<>();
        Matcher matcher = ATTRIBUTE_PATTERN.matcher(attributePart);
        while (matcher.find()) {
            attributes.putIfAbsent(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2).trim());
        }
        return new Entry(lineNumber, name, attributes);
    }

    /**
     * Position of the comma that ends the attribute list. Commas inside quoted values don't count.
     */
    static int findNameSeparator(String body) {
        boolean quoted = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ',' && !quoted) {
                return i;
            }
        }
        return -1;
    }

    private List<Channel> toChannels(List<Entry> entries) {
        List<Channel> channels = new ArrayList<>(entries.size());
        Map<String, Integer> seenIds = new HashMap<>();
        for (int index = 0; index < entries.size(); index++) {
            Entry entry = entries.get(index);
            String name = entry.name.isEmpty() ? "Channel " + index : entry.name;
            String category = firstNonEmpty(entry.attribute("group-title"), entry.extGroup, defaultCategory);
            String guideId = firstNonEmpty(entry.attribute("tvg-id"), name);
            String id = switch (idStrategy) {
                case POSITION -> ID_PREFIX + index;
                case ORIGIN_URL -> uniqueId(ID_PREFIX + hash(entry.url), seenIds);
            };
            channels.add(new Channel(
                    id,
                    name,
                    entry.attribute("tvg-logo"),
                    category,
                    entry.url,
                    guideId,
                    entry.attribute("tvg-name"),
                    entry.attribute("tvg-country"),
                    entry.attribute("tvg-language")));
        }
        return List.copyOf(channels);
    }

    private static String uniqueId(String baseId, Map<String, Integer> seenIds) {
        int occurrence = seenIds.merge(baseId, 1, Integer::sum);
        return occurrence == 1 ? baseId : baseId + "-" + occurrence;
    }

    private static String hash(String url) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(url.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, URL_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    private static class Entry {
        private final int lineNumber;
        private final String name;
        private final Map<String, String> attributes;
        private String extGroup;
        private String url;

        Entry(int lineNumber, String name, Map<String, String> attributes) {
            this.lineNumber = lineNumber;
            this.name = name;
            this.attributes = attributes;
        }

        String attribute(String key) {
            return attributes.getOrDefault(key, "");
        }
    }
}
