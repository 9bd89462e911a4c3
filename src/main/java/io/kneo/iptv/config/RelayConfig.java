package io.kneo.iptv.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;

@ConfigMapping(prefix = "iptv.relay")
public interface RelayConfig {

    @WithName("enabled")
    @WithDefault("true")
    boolean isEnabled();

    @WithName("max-redirects")
    @WithDefault("5")
    int getMaxRedirects();

    @WithName("connect-timeout")
    @WithDefault("20s")
    Duration getConnectTimeout();

    @WithName("idle-timeout")
    @WithDefault("30s")
    Duration getIdleTimeout();

    @WithName("user-agents")
    @WithDefault("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML\\, like Gecko) Chrome/120.0.0.0 Safari/537.36,"
            + "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML\\, like Gecko) Version/16.1 Safari/605.1.15,"
            + "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:120.0) Gecko/20100101 Firefox/120.0,"
            + "VLC/3.0.18 LibVLC/3.0.18")
    List<String> getUserAgents();
}
