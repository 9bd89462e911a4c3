package io.kneo.iptv.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One consistent view of the catalog: the channels of the last good playlist joined with the
 * last good guide. Never mutated after construction; refreshes derive a new instance.
 */
@Getter
public final class CatalogSnapshot {
    private static final CatalogSnapshot EMPTY = new CatalogSnapshot(List.of(), GuideData.empty(), null, null);

    private final List<Channel> channels;
    private final GuideData guide;
    private final Instant playlistLoadedAt;
    private final Instant guideLoadedAt;
    private final Set<String> categories;
    private final Map<String, Channel> channelsById;
    private final Map<String, List<Channel>> channelsByCategory;

    private CatalogSnapshot(List<Channel> channels, GuideData guide, Instant playlistLoadedAt, Instant guideLoadedAt) {
        this.channels = List.copyOf(channels);
        this.guide = guide;
        this.playlistLoadedAt = playlistLoadedAt;
        this.guideLoadedAt = guideLoadedAt;

        Map<String, Channel> byId = new LinkedHashMap<>();
        Map<String, List<Channel>> byCategory = new LinkedHashMap<>();
        for (Channel channel : this.channels) {
            byId.putIfAbsent(channel.id(), channel);
            byCategory.computeIfAbsent(channel.category(), k -> new ArrayList<>()).add(channel);
        }
        byCategory.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.channelsById = Collections.unmodifiableMap(byId);
        this.channelsByCategory = Collections.unmodifiableMap(byCategory);
        this.categories = Collections.unmodifiableSet(new LinkedHashSet<>(byCategory.keySet()));
    }

    public static CatalogSnapshot empty() {
        return EMPTY;
    }

    public CatalogSnapshot withChannels(List<Channel> newChannels, Instant loadedAt) {
        return new CatalogSnapshot(newChannels, guide, loadedAt, guideLoadedAt);
    }

    public CatalogSnapshot withGuide(GuideData newGuide, Instant loadedAt) {
        return new CatalogSnapshot(channels, newGuide, playlistLoadedAt, loadedAt);
    }

    public Optional<Channel> findChannel(String id) {
        return Optional.ofNullable(channelsById.get(id));
    }

    public List<Channel> channelsIn(String category) {
        return channelsByCategory.getOrDefault(category, List.of());
    }

    public List<Programme> programmesFor(Channel channel) {
        List<Programme> programmes = guide.programmesFor(channel.guideId());
        if (programmes.isEmpty() && !channel.name().equals(channel.guideId())) {
            return guide.programmesFor(channel.name());
        }
        return programmes;
    }
}
