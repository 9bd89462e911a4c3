package io.kneo.iptv.service.catalog;

import io.kneo.iptv.config.IptvConfig;
import io.kneo.iptv.config.RelayConfig;
import io.kneo.iptv.dto.CatalogFilter;
import io.kneo.iptv.dto.ChannelDetailDTO;
import io.kneo.iptv.dto.ChannelMetaDTO;
import io.kneo.iptv.dto.PlaybackTargetDTO;
import io.kneo.iptv.dto.ProgrammeDTO;
import io.kneo.iptv.dto.StatusDTO;
import io.kneo.iptv.model.CatalogSnapshot;
import io.kneo.iptv.model.Channel;
import io.kneo.iptv.model.NowNext;
import io.kneo.iptv.model.Programme;
import io.kneo.iptv.service.exceptions.ChannelNotFoundException;
import io.kneo.iptv.service.refresh.CatalogRefreshScheduler;
import io.kneo.iptv.service.relay.RelayHeaders;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Read side of the catalog. Every call works against one snapshot taken at its start.
 */
@ApplicationScoped
public class CatalogService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogService.class);
    private static final String DEFAULT_DESCRIPTION_PREFIX = "Live TV - ";
    private static final String RELAY_PATH = "/proxy?url=";

    private final CatalogIndex index;
    private final NowNextResolver resolver;
    private final FavoritesService favorites;
    private final CatalogRefreshScheduler scheduler;
    private final IptvConfig config;
    private final RelayConfig relayConfig;

    @Inject
    public CatalogService(CatalogIndex index, NowNextResolver resolver, FavoritesService favorites,
                          CatalogRefreshScheduler scheduler, IptvConfig config, RelayConfig relayConfig) {
        this.index = index;
        this.resolver = resolver;
        this.favorites = favorites;
        this.scheduler = scheduler;
        this.config = config;
        this.relayConfig = relayConfig;
    }

    public Uni<List<ChannelMetaDTO>> listCatalog(CatalogFilter filter) {
        return Uni.createFrom().item(() -> listCatalog(filter, Instant.now()));
    }

    public List<ChannelMetaDTO> listCatalog(CatalogFilter filter, Instant asOf) {
        CatalogSnapshot snapshot = index.current();
        Stream<Channel> channels = filter.hasCategory()
                ? snapshot.channelsIn(filter.getCategory()).stream()
                : snapshot.getChannels().stream();
        if (filter.isFavoritesOnly()) {
            channels = channels.filter(channel -> favorites.contains(channel.id()));
        }
        if (filter.hasSearchText()) {
            String needle = filter.getSearchText().trim().toLowerCase(Locale.ROOT);
            channels = channels.filter(channel -> matches(channel, needle));
        }
        int limit = filter.getLimit() != null ? filter.getLimit() : config.getCatalogPageSize();
        return channels
                .skip(Math.max(filter.getSkip(), 0))
                .limit(Math.max(limit, 0))
                .map(channel -> toMeta(channel, resolver.resolve(snapshot, channel, asOf)))
                .toList();
    }

    public Uni<ChannelDetailDTO> getDetail(String id) {
        return scheduler.ensureGuideLoaded()
                .onItem().transform(v -> getDetail(id, Instant.now()));
    }

    public ChannelDetailDTO getDetail(String id, Instant asOf) {
        CatalogSnapshot snapshot = index.current();
        Channel channel = snapshot.findChannel(id).orElseThrow(() -> new ChannelNotFoundException(id));
        NowNext nowNext = resolver.resolve(snapshot, channel, asOf);

        ChannelDetailDTO dto = new ChannelDetailDTO();
        dto.setId(channel.id());
        dto.setName(channel.name());
        dto.setArtworkUrl(channel.artworkUrl());
        dto.setCategory(channel.category());
        dto.setDescription(describe(channel, nowNext));
        dto.setReleaseInfo(releaseInfo(channel));
        nowNext.current().map(ProgrammeDTO::of).ifPresent(dto::setCurrent);
        nowNext.next().map(ProgrammeDTO::of).ifPresent(dto::setNext);
        return dto;
    }

    public Uni<PlaybackTargetDTO> getPlaybackTarget(String id, String requestBaseUrl) {
        return Uni.createFrom().item(() -> {
            Channel channel = index.current().findChannel(id).orElseThrow(() -> new ChannelNotFoundException(id));
            PlaybackTargetDTO dto = new PlaybackTargetDTO();
            dto.setTitle(channel.name());
            dto.setOriginUrl(channel.originUrl());
            dto.setProxyHeaders(RelayHeaders.originRequestHeaders(channel.originUrl(), defaultUserAgent()));
            if (relayConfig.isEnabled()) {
                String baseUrl = trimTrailingSlash(config.getPublicUrl().orElse(requestBaseUrl));
                dto.setUrl(baseUrl + RELAY_PATH + URLEncoder.encode(channel.originUrl(), StandardCharsets.UTF_8));
                dto.setRelayed(true);
            } else {
                dto.setUrl(channel.originUrl());
                dto.setRelayed(false);
            }
            LOGGER.debug("Playback target for {}: {}", id, dto.getUrl());
            return dto;
        });
    }

    public Set<String> getCategories() {
        return index.current().getCategories();
    }

    public boolean addFavorite(String id) {
        index.current().findChannel(id).orElseThrow(() -> new ChannelNotFoundException(id));
        return favorites.add(id);
    }

    public boolean removeFavorite(String id) {
        return favorites.remove(id);
    }

    public Set<String> getFavorites() {
        return favorites.getAll();
    }

    public StatusDTO getStatus() {
        CatalogSnapshot snapshot = index.current();
        StatusDTO dto = new StatusDTO();
        dto.setStatus("running");
        dto.setChannels(snapshot.getChannels().size());
        dto.setCategories(snapshot.getCategories().size());
        dto.setEpgChannels(snapshot.getGuide().channelCount());
        dto.setFavorites(favorites.getAll().size());
        dto.setPlaylistState(scheduler.getPlaylistState());
        dto.setGuideState(scheduler.getGuideState());
        dto.setPlaylistLoadedAt(snapshot.getPlaylistLoadedAt());
        dto.setGuideLoadedAt(snapshot.getGuideLoadedAt());
        dto.setPlaylistError(scheduler.getPlaylistError());
        dto.setGuideError(scheduler.getGuideError());
        return dto;
    }

    static String describe(Channel channel, NowNext nowNext) {
        if (nowNext.current().isPresent()) {
            Programme current = nowNext.current().get();
            StringBuilder text = new StringBuilder("Now: ").append(current.title())
                    .append("\nNext: ").append(nowNext.next().map(Programme::title).orElse("N/A"));
            if (current.description() != null && !current.description().isBlank()) {
                text.append('\n').append(current.description());
            }
            return text.toString();
        }
        String fallback = channel.tvgName() != null && !channel.tvgName().isBlank()
                ? channel.tvgName()
                : DEFAULT_DESCRIPTION_PREFIX + channel.category();
        return nowNext.next()
                .map(next -> fallback + "\nNext: " + next.title())
                .orElse(fallback);
    }

    private ChannelMetaDTO toMeta(Channel channel, NowNext nowNext) {
        ChannelMetaDTO dto = new ChannelMetaDTO();
        dto.setId(channel.id());
        dto.setName(channel.name());
        dto.setArtworkUrl(channel.artworkUrl());
        dto.setCategory(channel.category());
        dto.setDescription(describe(channel, nowNext));
        return dto;
    }

    private static boolean matches(Channel channel, String needle) {
        return channel.name().toLowerCase(Locale.ROOT).contains(needle)
                || channel.guideId().toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String releaseInfo(Channel channel) {
        String country = channel.country();
        String language = channel.language();
        boolean hasCountry = country != null && !country.isBlank();
        boolean hasLanguage = language != null && !language.isBlank();
        if (hasCountry && hasLanguage) {
            return country + " (" + language + ")";
        }
        if (hasCountry) {
            return country;
        }
        return hasLanguage ? language : null;
    }

    private String defaultUserAgent() {
        List<String> agents = relayConfig.getUserAgents();
        return agents.isEmpty() ? RelayHeaders.FALLBACK_USER_AGENT : agents.get(0);
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
