package io.kneo.iptv.model.cnst;

public enum ChannelIdStrategy {
    POSITION,
    ORIGIN_URL
}
