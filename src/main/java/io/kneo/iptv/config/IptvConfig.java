package io.kneo.iptv.config;

import io.kneo.iptv.model.cnst.ChannelIdStrategy;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "iptv")
public interface IptvConfig {

    @WithName("playlist.url")
    Optional<String> getPlaylistUrl();

    @WithName("playlist.refresh-interval")
    @WithDefault("1h")
    Duration getPlaylistRefreshInterval();

    @WithName("playlist.retry-delay")
    @WithDefault("30s")
    Duration getPlaylistRetryDelay();

    @WithName("playlist.fetch-timeout")
    @WithDefault("15s")
    Duration getPlaylistFetchTimeout();

    @WithName("guide.url")
    Optional<String> getGuideUrl();

    @WithName("guide.refresh-interval")
    @WithDefault("2h")
    Duration getGuideRefreshInterval();

    @WithName("guide.retry-delay")
    @WithDefault("5m")
    Duration getGuideRetryDelay();

    @WithName("guide.fetch-timeout")
    @WithDefault("20s")
    Duration getGuideFetchTimeout();

    @WithName("guide.lazy")
    @WithDefault("false")
    boolean isGuideLazy();

    @WithName("channel.id-strategy")
    @WithDefault("POSITION")
    ChannelIdStrategy getChannelIdStrategy();

    @WithName("channel.default-category")
    @WithDefault("Other")
    String getDefaultCategory();

    @WithName("catalog.page-size")
    @WithDefault("100")
    int getCatalogPageSize();

    @WithName("public-url")
    Optional<String> getPublicUrl();
}
