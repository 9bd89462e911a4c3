package io.kneo.iptv.service.refresh;

import io.kneo.iptv.config.IptvConfig;
import io.kneo.iptv.model.Channel;
import io.kneo.iptv.model.GuideData;
import io.kneo.iptv.model.cnst.FeedState;
import io.kneo.iptv.service.catalog.CatalogIndex;
import io.kneo.iptv.service.exceptions.SourceFetchException;
import io.kneo.iptv.service.guide.GuideParser;
import io.kneo.iptv.service.playlist.PlaylistParser;
import io.kneo.iptv.service.source.FeedFetcher;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@ApplicationScoped
public class CatalogRefreshScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogRefreshScheduler.class);
    public static final String PLAYLIST_FEED = "playlist";
    public static final String GUIDE_FEED = "guide";

    private final IptvConfig config;
    private final FeedFetcher fetcher;
    private final PlaylistParser playlistParser;
    private final GuideParser guideParser;
    private final FeedRefresher<List<Channel>> playlistRefresher;
    private final FeedRefresher<GuideData> guideRefresher;
    private final AtomicBoolean guideStarted = new AtomicBoolean(false);
    private final AtomicReference<Uni<Void>> firstGuideLoad = new AtomicReference<>();

    @Inject
    public CatalogRefreshScheduler(IptvConfig config, FeedFetcher fetcher, PlaylistParser playlistParser,
                                   GuideParser guideParser, CatalogIndex index) {
        this.config = config;
        this.fetcher = fetcher;
        this.playlistParser = playlistParser;
        this.guideParser = guideParser;
        this.playlistRefresher = new FeedRefresher<>(PLAYLIST_FEED, this::loadPlaylist, index::publishChannels,
                config.getPlaylistRefreshInterval(), config.getPlaylistRetryDelay());
        this.guideRefresher = new FeedRefresher<>(GUIDE_FEED, this::loadGuide, index::publishGuide,
                config.getGuideRefreshInterval(), config.getGuideRetryDelay());
    }

    void onStart(@Observes StartupEvent ev) {
        start();
    }

    void onStop(@Observes ShutdownEvent ev) {
        stop();
    }

    public void start() {
        if (isConfigured(config.getPlaylistUrl().orElse(null))) {
            playlistRefresher.start(true);
        } else {
            LOGGER.warn("iptv.playlist.url is not set, catalog stays empty");
        }
        if (!isConfigured(config.getGuideUrl().orElse(null))) {
            LOGGER.warn("iptv.guide.url is not set, channels are served without programme data");
        } else if (config.isGuideLazy()) {
            LOGGER.info("Guide is loaded on first detail request");
        } else if (guideStarted.compareAndSet(false, true)) {
            guideRefresher.start(true);
        }
    }

    public void stop() {
        playlistRefresher.stop();
        guideRefresher.stop();
        guideStarted.set(false);
        firstGuideLoad.set(null);
    }

    /**
     * Triggers the first load of a lazily configured guide and completes when it is done. Callers
     * arriving while it runs share that load; after it, later loads belong to the refresher's
     * schedule and retry delay, so this completes at once.
     */
    public Uni<Void> ensureGuideLoaded() {
        if (!config.isGuideLazy()
                || !isConfigured(config.getGuideUrl().orElse(null))
                || guideRefresher.getState().hasData()) {
            return Uni.createFrom().voidItem();
        }
        Uni<Void> load = firstGuideLoad.get();
        if (load != null) {
            return load;
        }
        Uni<Void> candidate = guideRefresher.refresh().replaceWithVoid().memoize().indefinitely();
        if (!firstGuideLoad.compareAndSet(null, candidate)) {
            Uni<Void> winner = firstGuideLoad.get();
            return winner != null ? winner : Uni.createFrom().voidItem();
        }
        if (guideStarted.compareAndSet(false, true)) {
            guideRefresher.start(false);
        }
        return candidate;
    }

    public Uni<Boolean> refreshPlaylist() {
        return playlistRefresher.refresh();
    }

    public Uni<Boolean> refreshGuide() {
        return guideRefresher.refresh();
    }

    public FeedState getPlaylistState() {
        return playlistRefresher.getState();
    }

    public FeedState getGuideState() {
        return guideRefresher.getState();
    }

    public String getPlaylistError() {
        return playlistRefresher.getLastError();
    }

    public String getGuideError() {
        return guideRefresher.getLastError();
    }

    private Uni<List<Channel>> loadPlaylist() {
        String url = config.getPlaylistUrl().filter(CatalogRefreshScheduler::isConfigured)
                .orElseThrow(() -> new SourceFetchException("", "Playlist URL is not configured"));
        return fetcher.fetch(url, config.getPlaylistFetchTimeout())
                .emitOn(Infrastructure.getDefaultWorkerPool())
                .onItem().transform(playlistParser::parse);
    }

    private Uni<GuideData> loadGuide() {
        String url = config.getGuideUrl().filter(CatalogRefreshScheduler::isConfigured)
                .orElseThrow(() -> new SourceFetchException("", "Guide URL is not configured"));
        return fetcher.fetch(url, config.getGuideFetchTimeout())
                .emitOn(Infrastructure.getDefaultWorkerPool())
                .onItem().transform(guideParser::parse);
    }

    private static boolean isConfigured(String url) {
        return url != null && !url.isBlank();
    }
}
