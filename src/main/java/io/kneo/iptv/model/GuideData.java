package io.kneo.iptv.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Programme timelines keyed by guide channel id. Every list is ordered by start time.
 * {@code displayNames} maps a lower-cased guide display name to its guide channel id.
 */
public record GuideData(Map<String, List<Programme>> programmes, Map<String, String> displayNames) {
    private static final GuideData EMPTY = new GuideData(Map.of(), Map.of());

    public GuideData {
        programmes = Map.copyOf(programmes);
        displayNames = Map.copyOf(displayNames);
    }

    public static GuideData empty() {
        return EMPTY;
    }

    public List<Programme> programmesFor(String guideId) {
        if (guideId == null || guideId.isEmpty()) {
            return List.of();
        }
        List<Programme> direct = programmes.get(guideId);
        if (direct != null) {
            return direct;
        }
        String byName = displayNames.get(guideId.toLowerCase(Locale.ROOT));
        return byName == null ? List.of() : programmes.getOrDefault(byName, List.of());
    }

    public int channelCount() {
        return programmes.size();
    }

    public int programmeCount() {
        return programmes.values().stream().mapToInt(List::size).sum();
    }
}
